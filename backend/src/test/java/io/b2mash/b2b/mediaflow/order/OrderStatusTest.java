package io.b2mash.b2b.mediaflow.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class OrderStatusTest {

  private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

  @Test
  void pending_mustBeAcceptedBeforeWork() {
    assertThat(OrderStatus.PENDING.allowedTransitions())
        .containsExactlyInAnyOrder(OrderStatus.PROCESSING, OrderStatus.CANCELLED);
  }

  @Test
  void completed_canOnlyGoBackToRevision() {
    assertThat(OrderStatus.COMPLETED.allowedTransitions())
        .containsExactly(OrderStatus.IN_REVISION);
  }

  @Test
  void onlyProcessingAndInProgressAreActionable() {
    for (OrderStatus status : OrderStatus.values()) {
      assertThat(status.isActionable())
          .as(status.name())
          .isEqualTo(status == OrderStatus.PROCESSING || status == OrderStatus.IN_PROGRESS);
    }
  }

  @Test
  void onlyCompletedReleasesDeliverables() {
    assertThat(OrderStatus.COMPLETED.releasesDeliverables()).isTrue();
    assertThat(OrderStatus.IN_PROGRESS.releasesDeliverables()).isFalse();
  }

  @Test
  void changeStatus_stampsAcceptanceAndCompletion() {
    var order = newOrder(2);

    order.changeStatus(OrderStatus.PROCESSING, NOW);
    order.changeStatus(OrderStatus.IN_PROGRESS, NOW.plus(Duration.ofHours(1)));
    order.changeStatus(OrderStatus.COMPLETED, NOW.plus(Duration.ofHours(5)));

    assertThat(order.getDateAccepted()).isEqualTo(NOW);
    assertThat(order.getDateCompleted()).isEqualTo(NOW.plus(Duration.ofHours(5)));
  }

  @Test
  void changeStatus_revisionClearsCompletion() {
    var order = newOrder(2);
    order.changeStatus(OrderStatus.PROCESSING, NOW);
    order.changeStatus(OrderStatus.IN_PROGRESS, NOW);
    order.changeStatus(OrderStatus.COMPLETED, NOW);

    order.changeStatus(OrderStatus.IN_REVISION, NOW.plusSeconds(30));

    assertThat(order.getDateCompleted()).isNull();
    assertThat(order.getStatus()).isEqualTo(OrderStatus.IN_REVISION);
  }

  @Test
  void changeStatus_rejectsSkippingAcceptance() {
    var order = newOrder(2);

    assertThatThrownBy(() -> order.changeStatus(OrderStatus.COMPLETED, NOW))
        .isInstanceOf(IllegalStateException.class);
    assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
  }

  @Test
  void consumeRevisionRound_stopsAtMaximum() {
    var order = newOrder(1);

    order.consumeRevisionRound();

    assertThat(order.hasRevisionRoundsLeft()).isFalse();
    assertThatThrownBy(order::consumeRevisionRound).isInstanceOf(IllegalStateException.class);
    assertThat(RevisionStatus.of(order)).isEqualTo(new RevisionStatus(1, 1, 0));
  }

  private static Order newOrder(int maxRounds) {
    return new Order(
        "p", "#00001", UUID.randomUUID(), null, "editor", "admin", maxRounds, NOW, NOW);
  }
}
