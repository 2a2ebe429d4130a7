package io.b2mash.b2b.mediaflow.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "customers")
public class Customer {

  @Id private UUID id;

  @Column(name = "partner_id", nullable = false)
  private String partnerId;

  @Column(name = "first_name", nullable = false)
  private String firstName;

  @Column(name = "last_name", nullable = false)
  private String lastName;

  @Column(name = "email", nullable = false)
  private String email;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Customer() {}

  public Customer(String partnerId, String firstName, String lastName, String email) {
    this.id = UUID.randomUUID();
    this.partnerId = partnerId;
    this.firstName = firstName;
    this.lastName = lastName;
    this.email = email;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getPartnerId() {
    return partnerId;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getEmail() {
    return email;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
