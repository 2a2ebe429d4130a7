package io.b2mash.b2b.mediaflow.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * A billable unit of work against a job. The order number is fixed at construction and has no
 * setter.
 */
// ORDER is a JPQL keyword, hence the explicit entity name
@Entity(name = "WorkOrder")
@Table(name = "orders")
public class Order {

  @Id private UUID id;

  @Column(name = "partner_id", nullable = false)
  private String partnerId;

  @Column(name = "order_number", nullable = false, unique = true, updatable = false, length = 20)
  private String orderNumber;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "customer_id")
  private UUID customerId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OrderStatus status;

  @Column(name = "assigned_to")
  private String assignedTo;

  @Column(name = "created_by")
  private String createdBy;

  @Column(name = "date_accepted")
  private Instant dateAccepted;

  @Column(name = "date_completed")
  private Instant dateCompleted;

  @Column(name = "files_expiry_date")
  private Instant filesExpiryDate;

  @Column(name = "max_revision_rounds", nullable = false)
  private int maxRevisionRounds;

  @Column(name = "used_revision_rounds", nullable = false)
  private int usedRevisionRounds;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Order() {}

  public Order(
      String partnerId,
      String orderNumber,
      UUID jobId,
      UUID customerId,
      String assignedTo,
      String createdBy,
      int maxRevisionRounds,
      Instant createdAt,
      Instant filesExpiryDate) {
    this.id = UUID.randomUUID();
    this.partnerId = partnerId;
    this.orderNumber = orderNumber;
    this.jobId = jobId;
    this.customerId = customerId;
    this.status = OrderStatus.PENDING;
    this.assignedTo = assignedTo;
    this.createdBy = createdBy;
    this.maxRevisionRounds = maxRevisionRounds;
    this.usedRevisionRounds = 0;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.filesExpiryDate = filesExpiryDate;
  }

  /**
   * Moves the order to {@code target}, stamping the acceptance and completion instants.
   *
   * @throws IllegalStateException if the transition is not in the allow-list
   */
  public void changeStatus(OrderStatus target, Instant now) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Cannot move order " + orderNumber + " from " + status + " to " + target);
    }
    switch (target) {
      case PROCESSING -> this.dateAccepted = now;
      case COMPLETED -> this.dateCompleted = now;
      case IN_REVISION -> this.dateCompleted = null;
      default -> {
        // no lifecycle timestamp for the remaining targets
      }
    }
    this.status = target;
    this.updatedAt = now;
  }

  public void assignTo(String editorId) {
    this.assignedTo = editorId;
    this.updatedAt = Instant.now();
  }

  /** Re-points the order at another job and takes over that job's tenant and customer. */
  public void relinkToJob(UUID jobId, String partnerId, UUID customerId) {
    this.jobId = jobId;
    this.partnerId = partnerId;
    this.customerId = customerId;
    this.updatedAt = Instant.now();
  }

  public boolean hasRevisionRoundsLeft() {
    return usedRevisionRounds < maxRevisionRounds;
  }

  public void consumeRevisionRound() {
    if (!hasRevisionRoundsLeft()) {
      throw new IllegalStateException("Order " + orderNumber + " has no revision rounds left");
    }
    this.usedRevisionRounds++;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getPartnerId() {
    return partnerId;
  }

  public String getOrderNumber() {
    return orderNumber;
  }

  public UUID getJobId() {
    return jobId;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public OrderStatus getStatus() {
    return status;
  }

  public String getAssignedTo() {
    return assignedTo;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getDateAccepted() {
    return dateAccepted;
  }

  public Instant getDateCompleted() {
    return dateCompleted;
  }

  public Instant getFilesExpiryDate() {
    return filesExpiryDate;
  }

  public int getMaxRevisionRounds() {
    return maxRevisionRounds;
  }

  public int getUsedRevisionRounds() {
    return usedRevisionRounds;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
