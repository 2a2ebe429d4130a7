package io.b2mash.b2b.mediaflow.order;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Order lifecycle status with validated transitions.
 *
 * <ul>
 *   <li>PENDING → PROCESSING, CANCELLED
 *   <li>PROCESSING → IN_PROGRESS, CANCELLED, IN_REVISION
 *   <li>IN_PROGRESS → COMPLETED, IN_REVISION, CANCELLED
 *   <li>IN_REVISION → IN_PROGRESS, CANCELLED
 *   <li>COMPLETED → IN_REVISION (reopen only)
 *   <li>CANCELLED is terminal
 * </ul>
 */
public enum OrderStatus {
  /** Created, not yet accepted by an editor. */
  PENDING,

  /** Accepted by the assigned editor. */
  PROCESSING,

  /** Editing underway, deliverables may be in internal quality review. */
  IN_PROGRESS,

  /** Sent back for another revision round. */
  IN_REVISION,

  /** Quality check passed; deliverables are released to the recipient. */
  COMPLETED,

  /** Terminal. */
  CANCELLED;

  private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(PROCESSING, CANCELLED),
          PROCESSING, Set.of(IN_PROGRESS, CANCELLED, IN_REVISION),
          IN_PROGRESS, Set.of(COMPLETED, IN_REVISION, CANCELLED),
          IN_REVISION, Set.of(IN_PROGRESS, CANCELLED),
          COMPLETED, Set.of(IN_REVISION),
          CANCELLED, Set.of());

  public Set<OrderStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(OrderStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == CANCELLED;
  }

  /** Statuses in which the assigned editor may work on the order's job. */
  public boolean isActionable() {
    return this == PROCESSING || this == IN_PROGRESS;
  }

  /** Whether deliverables of an order in this status may be shown to the recipient. */
  public boolean releasesDeliverables() {
    return this == COMPLETED;
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<OrderStatus> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (OrderStatus status : values()) {
      if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
