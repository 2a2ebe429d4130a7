package io.b2mash.b2b.mediaflow.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-boxed claim on an order number that has been minted but not yet attached to an order. Keyed
 * by the order number itself, so there is at most one reservation per number.
 */
@Entity
@Table(name = "order_reservations")
public class OrderReservation {

  @Id
  @Column(name = "order_number", length = 20)
  private String orderNumber;

  @Column(name = "user_id", nullable = false)
  private String userId;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "reserved_at", nullable = false)
  private Instant reservedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ReservationStatus status;

  protected OrderReservation() {}

  public OrderReservation(
      String orderNumber, String userId, UUID jobId, Instant reservedAt, Instant expiresAt) {
    this.orderNumber = orderNumber;
    this.userId = userId;
    this.jobId = jobId;
    this.reservedAt = reservedAt;
    this.expiresAt = expiresAt;
    this.status = ReservationStatus.RESERVED;
  }

  public boolean isOverdue(Instant now) {
    return status == ReservationStatus.RESERVED && now.isAfter(expiresAt);
  }

  public void confirm() {
    moveTo(ReservationStatus.CONFIRMED);
  }

  public void expire() {
    moveTo(ReservationStatus.EXPIRED);
  }

  private void moveTo(ReservationStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Reservation " + orderNumber + " cannot move from " + status + " to " + target);
    }
    this.status = target;
  }

  public String getOrderNumber() {
    return orderNumber;
  }

  public String getUserId() {
    return userId;
  }

  public UUID getJobId() {
    return jobId;
  }

  public Instant getReservedAt() {
    return reservedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public ReservationStatus getStatus() {
    return status;
  }
}
