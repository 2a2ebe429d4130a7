package io.b2mash.b2b.mediaflow.upload;

import java.time.Instant;
import java.util.UUID;

/**
 * Input for recording an editor upload.
 *
 * @param jobId internal id of the job
 * @param orderId order the file was produced for; optional
 * @param status {@code for_editing} when null
 * @param expiresAt the configured default expiry applies when null
 */
public record NewEditorUpload(
    UUID jobId,
    UUID orderId,
    String editorId,
    String fileName,
    String storagePath,
    String downloadUrl,
    String folderPath,
    String folderToken,
    String editorFolderName,
    String partnerFolderName,
    UploadStatus status,
    Instant expiresAt) {}
