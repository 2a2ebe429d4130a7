package io.b2mash.b2b.mediaflow.upload;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A deliverable file an editor produced for a job. Only the blob key and the signed download URL
 * are stored here; the bytes live with the blob provider.
 */
@Entity
@Table(name = "editor_uploads")
public class EditorUpload {

  @Id private UUID id;

  @Column(name = "job_id", nullable = false)
  private UUID jobId;

  @Column(name = "order_id")
  private UUID orderId;

  @Column(name = "editor_id", nullable = false)
  private String editorId;

  @Column(name = "file_name", nullable = false)
  private String fileName;

  @Column(name = "storage_path", nullable = false, length = 1024)
  private String storagePath;

  @Column(name = "download_url", length = 2048)
  private String downloadUrl;

  @Column(name = "folder_path", length = 1024)
  private String folderPath;

  @Column(name = "folder_token", length = 64)
  private String folderToken;

  @Column(name = "editor_folder_name")
  private String editorFolderName;

  @Column(name = "partner_folder_name")
  private String partnerFolderName;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private UploadStatus status;

  @Column(name = "uploaded_at", nullable = false)
  private Instant uploadedAt;

  @Column(name = "expires_at")
  private Instant expiresAt;

  protected EditorUpload() {}

  public EditorUpload(
      UUID jobId,
      UUID orderId,
      String editorId,
      String fileName,
      String storagePath,
      String downloadUrl,
      UploadStatus status,
      Instant uploadedAt,
      Instant expiresAt) {
    this.id = UUID.randomUUID();
    this.jobId = jobId;
    this.orderId = orderId;
    this.editorId = editorId;
    this.fileName = fileName;
    this.storagePath = storagePath;
    this.downloadUrl = downloadUrl;
    this.status = status != null ? status : UploadStatus.FOR_EDITING;
    this.uploadedAt = uploadedAt;
    this.expiresAt = expiresAt;
  }

  public void placeInFolder(
      String folderPath, String folderToken, String editorFolderName, String partnerFolderName) {
    this.folderPath = folderPath;
    this.folderToken = folderToken;
    this.editorFolderName = editorFolderName;
    this.partnerFolderName = partnerFolderName;
  }

  public void renameForPartner(String partnerFolderName) {
    this.partnerFolderName = partnerFolderName;
  }

  public boolean isExpiredForEditing(Instant now) {
    return status == UploadStatus.FOR_EDITING && expiresAt != null && now.isAfter(expiresAt);
  }

  public UUID getId() {
    return id;
  }

  public UUID getJobId() {
    return jobId;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public String getEditorId() {
    return editorId;
  }

  public String getFileName() {
    return fileName;
  }

  public String getStoragePath() {
    return storagePath;
  }

  public String getDownloadUrl() {
    return downloadUrl;
  }

  public String getFolderPath() {
    return folderPath;
  }

  public String getFolderToken() {
    return folderToken;
  }

  public String getEditorFolderName() {
    return editorFolderName;
  }

  public String getPartnerFolderName() {
    return partnerFolderName;
  }

  public UploadStatus getStatus() {
    return status;
  }

  public Instant getUploadedAt() {
    return uploadedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }
}
