package io.b2mash.b2b.mediaflow.audit;

import java.util.List;
import java.util.UUID;

/** Records and lists lifecycle activity. */
public interface AuditService {

  /**
   * Records a single activity entry. Fire-and-forget: a failure to record is logged and never
   * propagates to the caller.
   *
   * @param record the activity data to persist
   */
  void log(AuditEventRecord record);

  /** Activity for one job, oldest first. */
  List<AuditEvent> findByJob(UUID jobId);

  /** Activity for one order, oldest first. */
  List<AuditEvent> findByOrder(UUID orderId);
}
