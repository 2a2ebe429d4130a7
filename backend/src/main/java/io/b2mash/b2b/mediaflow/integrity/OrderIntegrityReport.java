package io.b2mash.b2b.mediaflow.integrity;

import java.util.List;
import java.util.UUID;

/**
 * Result of {@link IntegrityValidator#validateOrderIntegrity(UUID)}.
 *
 * @param lineCount order lines attached to the order
 * @param uploadCount uploads that reference the order
 */
public record OrderIntegrityReport(
    UUID orderId, boolean valid, List<String> issues, int lineCount, int uploadCount) {

  public OrderIntegrityReport {
    issues = List.copyOf(issues);
  }
}
