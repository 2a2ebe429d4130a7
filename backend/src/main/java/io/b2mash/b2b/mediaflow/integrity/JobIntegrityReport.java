package io.b2mash.b2b.mediaflow.integrity;

import java.util.List;
import java.util.UUID;

/**
 * Result of {@link IntegrityValidator#validateJobIntegrity(UUID)}.
 *
 * @param connections what the job is linked to; null when the job does not exist
 */
public record JobIntegrityReport(
    UUID jobId, boolean valid, List<String> issues, Connections connections) {

  public JobIntegrityReport {
    issues = List.copyOf(issues);
  }

  /** References found from and to the job. */
  public record Connections(UUID customerId, List<UUID> orderIds, int uploadCount) {

    public Connections {
      orderIds = List.copyOf(orderIds);
    }
  }
}
