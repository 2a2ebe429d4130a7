package io.b2mash.b2b.mediaflow.job;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Job lifecycle status with validated transitions.
 *
 * <ul>
 *   <li>SCHEDULED → IN_PROGRESS, CANCELLED
 *   <li>IN_PROGRESS → COMPLETED, CANCELLED
 *   <li>COMPLETED → IN_PROGRESS (reopen)
 *   <li>CANCELLED is terminal
 * </ul>
 */
public enum JobStatus {
  SCHEDULED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED;

  private static final Map<JobStatus, Set<JobStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          SCHEDULED, Set.of(IN_PROGRESS, CANCELLED),
          IN_PROGRESS, Set.of(COMPLETED, CANCELLED),
          COMPLETED, Set.of(IN_PROGRESS),
          CANCELLED, Set.of());

  /** Returns the set of statuses this status can transition to. */
  public Set<JobStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(JobStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == CANCELLED;
  }

  /** Lower-case wire value, e.g. {@code in_progress}. */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<JobStatus> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (JobStatus status : values()) {
      if (status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
