package io.b2mash.b2b.mediaflow.order;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.mediaflow.persistence.memory.InMemoryEntityStore;
import io.b2mash.b2b.mediaflow.testutil.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrderNumberAllocatorTest {

  private InMemoryEntityStore store;
  private MutableClock clock;
  private OrderNumberAllocator allocator;

  @BeforeEach
  void setUp() {
    store = new InMemoryEntityStore();
    clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    allocator = new OrderNumberAllocator(store, clock, OrderProperties.defaults());
  }

  @Test
  void format_padsToFiveDigitsAndGrowsBeyond() {
    assertThat(OrderNumberAllocator.format(1)).isEqualTo("#00001");
    assertThat(OrderNumberAllocator.format(42)).isEqualTo("#00042");
    assertThat(OrderNumberAllocator.format(123456)).isEqualTo("#123456");
  }

  @Test
  void generateOrderNumber_continuesFromCounter() {
    for (int i = 0; i < 41; i++) {
      store.incrementCounter(OrderNumberAllocator.COUNTER_NAME);
    }

    assertThat(allocator.generateOrderNumber()).isEqualTo("#00042");
    assertThat(allocator.generateOrderNumber()).isEqualTo("#00043");
  }

  @Test
  void generateOrderNumber_concurrentCallersNeverShareANumber() throws Exception {
    int callers = 32;
    ExecutorService executor = Executors.newFixedThreadPool(8);
    var start = new CountDownLatch(1);
    try {
      var futures = new ArrayList<Future<String>>();
      for (int i = 0; i < callers; i++) {
        Callable<String> call =
            () -> {
              start.await();
              return allocator.generateOrderNumber();
            };
        futures.add(executor.submit(call));
      }
      start.countDown();

      var numbers = new HashSet<String>();
      for (Future<String> future : futures) {
        numbers.add(future.get(10, TimeUnit.SECONDS));
      }

      assertThat(numbers).hasSize(callers);
      assertThat(numbers).contains("#00001", "#00032");
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void reserveOrderNumber_holdsNumberForTwoHours() {
    UUID jobId = UUID.randomUUID();

    var reservation = allocator.reserveOrderNumber("user-1", jobId);

    assertThat(reservation.getOrderNumber()).isEqualTo("#00001");
    assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.RESERVED);
    assertThat(reservation.getJobId()).isEqualTo(jobId);
    assertThat(Duration.between(reservation.getReservedAt(), reservation.getExpiresAt()))
        .isEqualTo(Duration.ofHours(2));
  }

  @Test
  void confirm_withinWindowSucceedsOnce() {
    var reservation = allocator.reserveOrderNumber("user-1", null);
    clock.advance(Duration.ofMinutes(90));

    assertThat(allocator.confirmReservation(reservation.getOrderNumber())).isTrue();
    var second = allocator.confirm(reservation.getOrderNumber());

    assertThat(second.confirmed()).isFalse();
    assertThat(second.message()).isEqualTo("Reservation #00001 is already confirmed");
    assertThat(allocator.getReservation("#00001"))
        .hasValueSatisfying(r -> assertThat(r.getStatus()).isEqualTo(ReservationStatus.CONFIRMED));
  }

  @Test
  void confirm_afterExpiryFailsAndNumberIsNotReused() {
    allocator.reserveOrderNumber("user-1", null);
    clock.advance(Duration.ofHours(2).plusSeconds(1));

    var outcome = allocator.confirm("#00001");

    assertThat(outcome.confirmed()).isFalse();
    assertThat(outcome.message()).isEqualTo("Reservation #00001 is already expired");
    assertThat(allocator.getReservation("#00001"))
        .hasValueSatisfying(r -> assertThat(r.getStatus()).isEqualTo(ReservationStatus.EXPIRED));
    assertThat(allocator.generateOrderNumber()).isEqualTo("#00002");
  }

  @Test
  void confirm_unknownNumberIsRejectedWithoutThrowing() {
    var outcome = allocator.confirm("#99999");

    assertThat(outcome.confirmed()).isFalse();
    assertThat(outcome.message()).isEqualTo("No reservation found for #99999");
  }

  @Test
  void cleanupExpiredReservations_expiresOnlyOverdueOnes() {
    allocator.reserveOrderNumber("user-1", null);
    clock.advance(Duration.ofHours(1));
    allocator.reserveOrderNumber("user-2", null);
    clock.advance(Duration.ofMinutes(61));

    int expired = allocator.cleanupExpiredReservations();

    assertThat(expired).isEqualTo(1);
    List<OrderReservation> reserved = store.listReservations(ReservationStatus.RESERVED);
    assertThat(reserved).extracting(OrderReservation::getOrderNumber).containsExactly("#00002");
    assertThat(allocator.cleanupExpiredReservations()).isZero();
  }
}
