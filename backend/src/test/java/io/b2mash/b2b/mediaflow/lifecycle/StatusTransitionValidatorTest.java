package io.b2mash.b2b.mediaflow.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.mediaflow.exception.InvalidStateException;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import org.junit.jupiter.api.Test;

class StatusTransitionValidatorTest {

  private final StatusTransitionValidator validator = new StatusTransitionValidator();

  @Test
  void validateTransition_matchesJobAllowListForEveryPair() {
    for (JobStatus from : JobStatus.values()) {
      for (JobStatus to : JobStatus.values()) {
        assertThat(validator.validateTransition(from, to).valid())
            .as("%s -> %s", from, to)
            .isEqualTo(from.canTransitionTo(to));
      }
    }
  }

  @Test
  void validateTransition_matchesOrderAllowListForEveryPair() {
    for (OrderStatus from : OrderStatus.values()) {
      for (OrderStatus to : OrderStatus.values()) {
        assertThat(validator.validateTransition(from, to).valid())
            .as("%s -> %s", from, to)
            .isEqualTo(from.canTransitionTo(to));
      }
    }
  }

  @Test
  void validateTransition_rejectsSelfTransition() {
    var result = validator.validateTransition(OrderStatus.PENDING, OrderStatus.PENDING);

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("Invalid order status transition: pending → pending");
  }

  @Test
  void validateTransition_namesInvalidEdge() {
    var result = validator.validateTransition(EntityKind.ORDER, "pending", "completed");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("Invalid order status transition: pending → completed");
  }

  @Test
  void validateTransition_reportsUnknownStatus() {
    var result = validator.validateTransition(EntityKind.JOB, "scheduled", "archived");

    assertThat(result.valid()).isFalse();
    assertThat(result.error()).isEqualTo("Unknown job status: archived");
  }

  @Test
  void requireTransition_throwsInvalidState() {
    assertThatThrownBy(
            () -> validator.requireTransition(JobStatus.CANCELLED, JobStatus.IN_PROGRESS))
        .isInstanceOf(InvalidStateException.class)
        .satisfies(
            e ->
                assertThat(((InvalidStateException) e).getBody().getDetail())
                    .isEqualTo("Invalid job status transition: cancelled → in_progress"));
  }

  @Test
  void allowedTargets_returnsWireValues() {
    assertThat(validator.allowedTargets(EntityKind.ORDER, "in_progress"))
        .containsExactlyInAnyOrder("completed", "in_revision", "cancelled");
    assertThat(validator.allowedTargets(EntityKind.JOB, "nonsense")).isEmpty();
  }
}
