package io.b2mash.b2b.mediaflow.folder;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Stored metadata for one deliverable folder of a job. Folders that only exist because uploads
 * point at them have no record until a partner renames, hides or reorders them.
 */
@Entity
@Table(name = "folders")
public class FolderRecord {

  @Id private UUID id;

  @Column(name = "job_id", nullable = false)
  private UUID jobId;

  @Column(name = "folder_path", nullable = false, length = 1024)
  private String folderPath;

  @Column(name = "folder_token", length = 64)
  private String folderToken;

  @Column(name = "order_id")
  private UUID orderId;

  @Column(name = "instance_id")
  private UUID instanceId;

  @Column(name = "unique_key", length = 1200)
  private String uniqueKey;

  @Column(name = "partner_folder_name")
  private String partnerFolderName;

  @Column(name = "editor_folder_name")
  private String editorFolderName;

  @Column(name = "visible", nullable = false)
  private boolean visible;

  @Column(name = "display_order")
  private Integer displayOrder;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected FolderRecord() {}

  public FolderRecord(
      UUID jobId,
      String folderPath,
      String folderToken,
      UUID orderId,
      UUID instanceId,
      String uniqueKey,
      String partnerFolderName,
      String editorFolderName,
      Integer displayOrder) {
    this.id = UUID.randomUUID();
    this.jobId = jobId;
    this.folderPath = folderPath;
    this.folderToken = folderToken;
    this.orderId = orderId;
    this.instanceId = instanceId;
    this.uniqueKey = uniqueKey;
    this.partnerFolderName = partnerFolderName;
    this.editorFolderName = editorFolderName;
    this.visible = true;
    this.displayOrder = displayOrder;
    this.createdAt = Instant.now();
  }

  public void rename(String partnerFolderName) {
    this.partnerFolderName = partnerFolderName;
  }

  public void changeVisibility(boolean visible) {
    this.visible = visible;
  }

  public void moveTo(Integer displayOrder) {
    this.displayOrder = displayOrder;
  }

  public void pinKey(String uniqueKey) {
    this.uniqueKey = uniqueKey;
  }

  public UUID getId() {
    return id;
  }

  public UUID getJobId() {
    return jobId;
  }

  public String getFolderPath() {
    return folderPath;
  }

  public String getFolderToken() {
    return folderToken;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getInstanceId() {
    return instanceId;
  }

  public String getUniqueKey() {
    return uniqueKey;
  }

  public String getPartnerFolderName() {
    return partnerFolderName;
  }

  public String getEditorFolderName() {
    return editorFolderName;
  }

  public boolean isVisible() {
    return visible;
  }

  public Integer getDisplayOrder() {
    return displayOrder;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
