package io.b2mash.b2b.mediaflow.upload;

/** Status of an editor upload. */
public enum UploadStatus {
  /** Source material handed to the editor; removed by the expiry sweep once past expiresAt. */
  FOR_EDITING,

  /** Finished deliverable. */
  COMPLETED
}
