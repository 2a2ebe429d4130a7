package io.b2mash.b2b.mediaflow.integrity;

import java.util.List;
import java.util.UUID;

/** Result of a referential health check over jobs, orders and uploads. */
public record HealthReport(
    boolean healthy, List<String> issues, Statistics statistics, OrphanedRecords orphanedRecords) {

  public HealthReport {
    issues = List.copyOf(issues);
  }

  public record Statistics(int totalJobs, int totalOrders, int totalUploads) {}

  /**
   * @param jobs jobs no order references
   * @param orders orders without a job, with a dangling job or with a dangling customer
   * @param uploads uploads with a dangling job or a dangling order
   */
  public record OrphanedRecords(List<UUID> jobs, List<UUID> orders, List<UUID> uploads) {

    public OrphanedRecords {
      jobs = List.copyOf(jobs);
      orders = List.copyOf(orders);
      uploads = List.copyOf(uploads);
    }

    public boolean isEmpty() {
      return jobs.isEmpty() && orders.isEmpty() && uploads.isEmpty();
    }
  }
}
