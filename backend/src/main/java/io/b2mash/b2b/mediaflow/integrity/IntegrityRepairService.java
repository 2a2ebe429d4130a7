package io.b2mash.b2b.mediaflow.integrity;

import io.b2mash.b2b.mediaflow.audit.AuditEventBuilder;
import io.b2mash.b2b.mediaflow.audit.AuditService;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Fixes broken references found by {@link IntegrityValidator}. */
@Service
public class IntegrityRepairService {

  private static final Logger log = LoggerFactory.getLogger(IntegrityRepairService.class);

  private final EntityStore store;
  private final AuditService auditService;

  public IntegrityRepairService(EntityStore store, AuditService auditService) {
    this.store = store;
    this.auditService = auditService;
  }

  /**
   * Re-points an order at {@code correctJobId} and copies that job's tenant and customer onto it.
   * The previous and new job ids are kept in the activity log.
   */
  public RepairResult repairOrphanedOrder(UUID orderId, UUID correctJobId) {
    var order = store.findOrder(orderId);
    if (order.isEmpty()) {
      return RepairResult.failed("Order " + orderId + " not found");
    }
    var job = store.findJob(correctJobId);
    if (job.isEmpty()) {
      return RepairResult.failed("Target job " + correctJobId + " not found");
    }
    UUID previousJobId = order.get().getJobId();
    var target = job.get();

    var repaired =
        store.updateOrder(
            orderId,
            o -> o.relinkToJob(target.getId(), target.getPartnerId(), target.getCustomerId()));
    if (repaired.isEmpty()) {
      return RepairResult.failed("Order " + orderId + " disappeared during repair");
    }

    String summary =
        "Order " + repaired.get().getOrderNumber() + " re-linked to job " + target.getJobId();
    var details = new LinkedHashMap<String, Object>();
    details.put("previous_job_id", previousJobId != null ? previousJobId.toString() : null);
    details.put("new_job_id", target.getId().toString());
    details.put("new_public_job_id", target.getJobId());
    auditService.log(
        AuditEventBuilder.builder()
            .partnerId(target.getPartnerId())
            .jobId(target.getId())
            .orderId(orderId)
            .customerId(target.getCustomerId())
            .action("repair")
            .category("order")
            .title(summary)
            .details(details)
            .build());

    log.info(
        "Repaired order {}: job {} -> {}",
        repaired.get().getOrderNumber(),
        previousJobId,
        target.getId());
    return RepairResult.succeeded(summary);
  }
}
