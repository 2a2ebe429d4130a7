package io.b2mash.b2b.mediaflow.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable activity entry persisted to the {@code audit_events} table. No {@code @Version}, no
 * {@code updatedAt}, no setters.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

  @Id private UUID id;

  @Column(name = "partner_id")
  private String partnerId;

  @Column(name = "job_id")
  private UUID jobId;

  @Column(name = "order_id")
  private UUID orderId;

  @Column(name = "customer_id")
  private UUID customerId;

  @Column(name = "actor_id")
  private String actorId;

  @Column(name = "action", nullable = false, length = 50)
  private String action;

  @Column(name = "category", nullable = false, length = 50)
  private String category;

  @Column(name = "title", nullable = false)
  private String title;

  @Column(name = "description", length = 2000)
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "metadata", columnDefinition = "jsonb")
  private String metadata;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEvent() {}

  public AuditEvent(AuditEventRecord record, Instant occurredAt) {
    this.id = UUID.randomUUID();
    this.partnerId = record.partnerId();
    this.jobId = record.jobId();
    this.orderId = record.orderId();
    this.customerId = record.customerId();
    this.actorId = record.actorId();
    this.action = record.action();
    this.category = record.category();
    this.title = record.title();
    this.description = record.description();
    this.metadata = record.metadata();
    this.occurredAt = occurredAt;
  }

  public UUID getId() {
    return id;
  }

  public String getPartnerId() {
    return partnerId;
  }

  public UUID getJobId() {
    return jobId;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getCustomerId() {
    return customerId;
  }

  public String getActorId() {
    return actorId;
  }

  public String getAction() {
    return action;
  }

  public String getCategory() {
    return category;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
