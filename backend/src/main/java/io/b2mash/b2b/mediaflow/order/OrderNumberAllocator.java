package io.b2mash.b2b.mediaflow.order;

import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues order numbers from a single global counter and manages the reserve → confirm/expire flow.
 *
 * <ul>
 *   <li>Format: "#" + counter zero-padded to 5 digits; counters above 99999 simply get longer
 *   <li>The counter only moves forward. Expired reservations leave permanent gaps, a number is
 *       never handed out twice
 *   <li>Expiry is lazy: each allocation and confirmation first sweeps overdue reservations
 * </ul>
 */
@Service
public class OrderNumberAllocator {

  private static final Logger log = LoggerFactory.getLogger(OrderNumberAllocator.class);

  static final String COUNTER_NAME = "orderCounter";

  private final EntityStore store;
  private final Clock clock;
  private final OrderProperties properties;

  public OrderNumberAllocator(EntityStore store, Clock clock, OrderProperties properties) {
    this.store = store;
    this.clock = clock;
    this.properties = properties;
  }

  /** Mints the next order number. The counter increment is persisted before this returns. */
  public String generateOrderNumber() {
    cleanupExpiredReservations();
    return nextNumber();
  }

  /** Mints a number and holds it for {@code userId} until the reservation window closes. */
  public OrderReservation reserveOrderNumber(String userId, UUID jobId) {
    cleanupExpiredReservations();
    String orderNumber = nextNumber();
    Instant now = clock.instant();
    var reservation =
        store.createReservation(
            new OrderReservation(
                orderNumber, userId, jobId, now, now.plus(properties.reservationTtl())));
    log.info(
        "Reserved order number {} for user {} (job {}) until {}",
        orderNumber,
        userId,
        jobId,
        reservation.getExpiresAt());
    return reservation;
  }

  /** Returns true only if the reservation existed, was still reserved and not yet due. */
  public boolean confirmReservation(String orderNumber) {
    return confirm(orderNumber).confirmed();
  }

  /**
   * Confirms a reservation. A reservation found past its expiry is marked expired instead. Never
   * throws for a bad number; the outcome carries the reason.
   */
  public ReservationConfirmation confirm(String orderNumber) {
    cleanupExpiredReservations();
    Instant now = clock.instant();
    var outcome = new AtomicReference<ReservationConfirmation>();
    var updated =
        store.updateReservation(
            orderNumber,
            reservation -> {
              if (reservation.getStatus() != ReservationStatus.RESERVED) {
                outcome.set(
                    ReservationConfirmation.rejected(
                        orderNumber,
                        "Reservation "
                            + orderNumber
                            + " is already "
                            + reservation.getStatus().wireValue()));
              } else if (now.isAfter(reservation.getExpiresAt())) {
                reservation.expire();
                outcome.set(
                    ReservationConfirmation.rejected(
                        orderNumber, "Reservation " + orderNumber + " has expired"));
              } else {
                reservation.confirm();
                outcome.set(ReservationConfirmation.confirmed(orderNumber));
              }
            });
    if (updated.isEmpty()) {
      log.warn("Confirmation requested for unknown reservation {}", orderNumber);
      return ReservationConfirmation.rejected(
          orderNumber, "No reservation found for " + orderNumber);
    }
    var result = outcome.get();
    if (result.confirmed()) {
      log.info("Confirmed reservation {}", orderNumber);
    } else {
      log.warn("Reservation {} not confirmed: {}", orderNumber, result.message());
    }
    return result;
  }

  public Optional<OrderReservation> getReservation(String orderNumber) {
    return store.findReservation(orderNumber);
  }

  /**
   * Marks every overdue reservation as expired. The numbers are not returned to the pool.
   *
   * @return how many reservations were expired by this call
   */
  public int cleanupExpiredReservations() {
    Instant now = clock.instant();
    int expired = 0;
    for (var candidate : store.listReservations(ReservationStatus.RESERVED)) {
      if (!candidate.isOverdue(now)) {
        continue;
      }
      var changed = new AtomicBoolean();
      store.updateReservation(
          candidate.getOrderNumber(),
          reservation -> {
            // re-checked under the store's lock, a concurrent confirm may have won
            if (reservation.isOverdue(now)) {
              reservation.expire();
              changed.set(true);
            }
          });
      if (changed.get()) {
        expired++;
      }
    }
    if (expired > 0) {
      log.info("Expired {} overdue order number reservation(s)", expired);
    }
    return expired;
  }

  private String nextNumber() {
    return format(store.incrementCounter(COUNTER_NAME));
  }

  static String format(long counter) {
    return String.format("#%05d", counter);
  }
}
