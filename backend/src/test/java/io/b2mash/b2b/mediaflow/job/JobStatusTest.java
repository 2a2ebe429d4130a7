package io.b2mash.b2b.mediaflow.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobStatusTest {

  @Test
  void scheduled_canStartOrCancel() {
    assertThat(JobStatus.SCHEDULED.allowedTransitions())
        .containsExactlyInAnyOrder(JobStatus.IN_PROGRESS, JobStatus.CANCELLED);
  }

  @Test
  void scheduled_cannotJumpToCompleted() {
    assertThat(JobStatus.SCHEDULED.canTransitionTo(JobStatus.COMPLETED)).isFalse();
  }

  @Test
  void completed_canOnlyBeReopened() {
    assertThat(JobStatus.COMPLETED.allowedTransitions()).containsExactly(JobStatus.IN_PROGRESS);
  }

  @Test
  void cancelled_isTerminal() {
    assertThat(JobStatus.CANCELLED.isTerminal()).isTrue();
    assertThat(JobStatus.CANCELLED.allowedTransitions()).isEmpty();
  }

  @Test
  void fromWire_acceptsLowerCaseAndPadding() {
    assertThat(JobStatus.fromWire(" in_progress ")).contains(JobStatus.IN_PROGRESS);
    assertThat(JobStatus.fromWire("IN_PROGRESS")).contains(JobStatus.IN_PROGRESS);
    assertThat(JobStatus.fromWire("delivered")).isEmpty();
    assertThat(JobStatus.fromWire(null)).isEmpty();
  }

  @Test
  void changeStatus_stampsDeliveredAtOnFirstCompletion() {
    var job = new Job("abc12345", "p", null, "1 Main St", JobStatus.IN_PROGRESS, null);
    var first = Instant.parse("2026-01-01T10:00:00Z");

    job.changeStatus(JobStatus.COMPLETED, first);
    job.changeStatus(JobStatus.IN_PROGRESS, first.plusSeconds(60));
    job.changeStatus(JobStatus.COMPLETED, first.plusSeconds(120));

    assertThat(job.getDeliveredAt()).isEqualTo(first);
  }

  @Test
  void changeStatus_rejectsDisallowedEdge() {
    var job = new Job("abc12345", "p", null, "1 Main St", null, null);

    assertThat(job.getStatus()).isEqualTo(JobStatus.SCHEDULED);
    assertThatThrownBy(() -> job.changeStatus(JobStatus.COMPLETED, Instant.now()))
        .isInstanceOf(IllegalStateException.class);
  }
}
