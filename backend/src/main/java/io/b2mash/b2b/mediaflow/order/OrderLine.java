package io.b2mash.b2b.mediaflow.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One service selected on an order. {@code serviceId} must resolve to a service offering. */
@Entity
@Table(name = "order_lines")
public class OrderLine {

  @Id private UUID id;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "service_id", nullable = false)
  private UUID serviceId;

  @Column(name = "quantity", nullable = false)
  private int quantity;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected OrderLine() {}

  public OrderLine(UUID orderId, UUID serviceId, int quantity) {
    this.id = UUID.randomUUID();
    this.orderId = orderId;
    this.serviceId = serviceId;
    this.quantity = quantity;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getServiceId() {
    return serviceId;
  }

  public int getQuantity() {
    return quantity;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
