package io.b2mash.b2b.mediaflow.offering;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A service an editor sells (e.g. "HDR blend", "Virtual staging"). */
@Entity
@Table(name = "service_offerings")
public class ServiceOffering {

  @Id private UUID id;

  @Column(name = "editor_id", nullable = false)
  private String editorId;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ServiceOffering() {}

  public ServiceOffering(String editorId, String name) {
    this.id = UUID.randomUUID();
    this.editorId = editorId;
    this.name = name;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEditorId() {
    return editorId;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
