package io.b2mash.b2b.mediaflow.folder;

import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.util.List;
import java.util.UUID;

/**
 * One folder of a job as presented to partners.
 *
 * @param uniqueKey rendered {@link FolderKey}; pass it back to rename, hide or reorder the folder
 * @param files uploads released to the recipient (their order is completed)
 * @param fileCount number of released files
 */
public record UploadFolder(
    String uniqueKey,
    String folderPath,
    String editorFolderName,
    String partnerFolderName,
    UUID orderId,
    String orderNumber,
    String folderToken,
    boolean visible,
    Integer displayOrder,
    int fileCount,
    List<EditorUpload> files) {

  public UploadFolder {
    files = List.copyOf(files);
  }
}
