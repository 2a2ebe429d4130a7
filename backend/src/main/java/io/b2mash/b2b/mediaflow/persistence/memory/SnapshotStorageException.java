package io.b2mash.b2b.mediaflow.persistence.memory;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Raised when the in-memory store cannot read or write its snapshot file. */
public class SnapshotStorageException extends UncheckedIOException {

  public SnapshotStorageException(String message, IOException cause) {
    super(message, cause);
  }
}
