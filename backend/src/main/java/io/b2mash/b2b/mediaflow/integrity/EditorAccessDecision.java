package io.b2mash.b2b.mediaflow.integrity;

import io.b2mash.b2b.mediaflow.order.OrderStatus;

/**
 * Whether an editor may work on a job.
 *
 * @param orderNumber the order the decision was based on; null when the editor has none
 * @param orderStatus status of that order; null when the editor has none
 */
public record EditorAccessDecision(
    boolean canAccess, String reason, String orderNumber, OrderStatus orderStatus) {

  static EditorAccessDecision denied(String reason) {
    return new EditorAccessDecision(false, reason, null, null);
  }
}
