package io.b2mash.b2b.mediaflow.lifecycle;

import io.b2mash.b2b.mediaflow.exception.InvalidStateException;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Checks status changes against the allow-lists held by {@link JobStatus} and {@link
 * OrderStatus}. Self-transitions are not listed and are therefore rejected.
 */
@Component
public class StatusTransitionValidator {

  /** Validates a transition given as wire values, e.g. {@code in_progress}. */
  public TransitionResult validateTransition(
      EntityKind kind, String currentStatus, String newStatus) {
    return switch (kind) {
      case JOB ->
          check(
              kind,
              currentStatus,
              newStatus,
              JobStatus::fromWire,
              JobStatus::canTransitionTo,
              JobStatus::wireValue);
      case ORDER ->
          check(
              kind,
              currentStatus,
              newStatus,
              OrderStatus::fromWire,
              OrderStatus::canTransitionTo,
              OrderStatus::wireValue);
    };
  }

  public TransitionResult validateTransition(JobStatus current, JobStatus target) {
    return validateTransition(EntityKind.JOB, current.wireValue(), target.wireValue());
  }

  public TransitionResult validateTransition(OrderStatus current, OrderStatus target) {
    return validateTransition(EntityKind.ORDER, current.wireValue(), target.wireValue());
  }

  /**
   * @throws InvalidStateException if the transition is not allowed
   */
  public void requireTransition(JobStatus current, JobStatus target) {
    require(validateTransition(current, target));
  }

  /**
   * @throws InvalidStateException if the transition is not allowed
   */
  public void requireTransition(OrderStatus current, OrderStatus target) {
    require(validateTransition(current, target));
  }

  /** Wire values of the statuses reachable from {@code currentStatus}; empty if unknown. */
  public Set<String> allowedTargets(EntityKind kind, String currentStatus) {
    return switch (kind) {
      case JOB ->
          JobStatus.fromWire(currentStatus)
              .map(s -> wireValues(s.allowedTransitions(), JobStatus::wireValue))
              .orElse(Set.of());
      case ORDER ->
          OrderStatus.fromWire(currentStatus)
              .map(s -> wireValues(s.allowedTransitions(), OrderStatus::wireValue))
              .orElse(Set.of());
    };
  }

  private static <S> Set<String> wireValues(Set<S> statuses, Function<S, String> wire) {
    return statuses.stream().map(wire).collect(Collectors.toUnmodifiableSet());
  }

  private static <S> TransitionResult check(
      EntityKind kind,
      String currentStatus,
      String newStatus,
      Function<String, Optional<S>> parse,
      BiPredicate<S, S> edge,
      Function<S, String> wire) {
    var from = parse.apply(currentStatus);
    if (from.isEmpty()) {
      return TransitionResult.rejected("Unknown " + kind.label() + " status: " + currentStatus);
    }
    var to = parse.apply(newStatus);
    if (to.isEmpty()) {
      return TransitionResult.rejected("Unknown " + kind.label() + " status: " + newStatus);
    }
    if (!edge.test(from.get(), to.get())) {
      return TransitionResult.rejected(
          "Invalid "
              + kind.label()
              + " status transition: "
              + wire.apply(from.get())
              + " → "
              + wire.apply(to.get()));
    }
    return TransitionResult.allowed();
  }

  private static void require(TransitionResult result) {
    if (!result.valid()) {
      throw new InvalidStateException("Invalid status transition", result.error());
    }
  }
}
