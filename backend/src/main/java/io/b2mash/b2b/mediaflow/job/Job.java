package io.b2mash.b2b.mediaflow.job;

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
 * A production engagement (e.g. a property shoot). Identified internally by {@link #getId()} and
 * publicly by the short {@link #getJobId()}. Status changes go through {@link
 * #changeStatus(JobStatus, Instant)}, which enforces the {@link JobStatus} transition table.
 */
@Entity
@Table(name = "jobs")
public class Job {

  @Id private UUID id;

  @Column(name = "job_id", nullable = false, unique = true, length = 32)
  private String jobId;

  @Column(name = "partner_id", nullable = false)
  private String partnerId;

  @Column(name = "customer_id")
  private UUID customerId;

  @Column(name = "address", nullable = false, length = 500)
  private String address;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private JobStatus status;

  @Column(name = "assigned_to")
  private String assignedTo;

  @Column(name = "delivery_token", unique = true, length = 64)
  private String deliveryToken;

  @Column(name = "delivered_at")
  private Instant deliveredAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(
      String jobId,
      String partnerId,
      UUID customerId,
      String address,
      JobStatus status,
      String assignedTo) {
    this.id = UUID.randomUUID();
    this.jobId = jobId;
    this.partnerId = partnerId;
    this.customerId = customerId;
    this.address = address;
    this.status = status != null ? status : JobStatus.SCHEDULED;
    this.assignedTo = assignedTo;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Edits the descriptive fields. Status and identity are not touched here. */
  public void updateDetails(String address, UUID customerId, String assignedTo) {
    this.address = address;
    this.customerId = customerId;
    this.assignedTo = assignedTo;
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the job to {@code target}. The first time a job reaches COMPLETED the delivery instant
   * is stamped; reopening keeps the original stamp.
   *
   * @throws IllegalStateException if the transition is not in the allow-list
   */
  public void changeStatus(JobStatus target, Instant now) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Cannot move job " + jobId + " from " + status + " to " + target);
    }
    this.status = target;
    if (target == JobStatus.COMPLETED && deliveredAt == null) {
      this.deliveredAt = now;
    }
    this.updatedAt = now;
  }

  public void assignDeliveryToken(String token) {
    this.deliveryToken = token;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getJobId() {
    return jobId;
  }

  public String getPartnerId() {
    return partnerId;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public String getAddress() {
    return address;
  }

  public JobStatus getStatus() {
    return status;
  }

  public String getAssignedTo() {
    return assignedTo;
  }

  public String getDeliveryToken() {
    return deliveryToken;
  }

  public Instant getDeliveredAt() {
    return deliveredAt;
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
