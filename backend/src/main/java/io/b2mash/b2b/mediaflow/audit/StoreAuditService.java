package io.b2mash.b2b.mediaflow.audit;

import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link AuditService} that appends to whichever {@link EntityStore} backend is active. Recording
 * failures are logged at WARN and swallowed so that activity logging never fails a lifecycle
 * operation.
 */
@Service
public class StoreAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(StoreAuditService.class);

  private final EntityStore store;
  private final Clock clock;

  public StoreAuditService(EntityStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      store.appendAuditEvent(new AuditEvent(record, clock.instant()));
      log.debug(
          "Recorded activity: action={}, category={}, job={}, order={}",
          record.action(),
          record.category(),
          record.jobId(),
          record.orderId());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record activity action={} category={}: {}",
          record.action(),
          record.category(),
          e.getMessage(),
          e);
    }
  }

  @Override
  public List<AuditEvent> findByJob(UUID jobId) {
    return store.listAuditEventsForJob(jobId);
  }

  @Override
  public List<AuditEvent> findByOrder(UUID orderId) {
    return store.listAuditEventsForOrder(orderId);
  }
}
