package io.b2mash.b2b.mediaflow.persistence.memory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.folder.FolderRecord;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Reads and writes {@link StoreSnapshot} files. Entities are (de)serialized through their fields so
 * that they need no setters; instants are written as ISO-8601 strings.
 *
 * <p>Entity constructors are never used as creators. Jackson instantiates entities through their
 * no-arg constructor and fills the fields directly.
 */
class SnapshotCodec {

  @JsonAutoDetect(
      fieldVisibility = Visibility.ANY,
      getterVisibility = Visibility.NONE,
      isGetterVisibility = Visibility.NONE,
      setterVisibility = Visibility.NONE,
      creatorVisibility = Visibility.NONE)
  private abstract static class FieldAccess {}

  private final JsonMapper mapper;

  SnapshotCodec() {
    var builder =
        JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    for (Class<?> entity :
        new Class<?>[] {
          Customer.class,
          Job.class,
          Order.class,
          OrderLine.class,
          ServiceOffering.class,
          OrderReservation.class,
          EditorUpload.class,
          FolderRecord.class,
          AuditEvent.class
        }) {
      builder.addMixIn(entity, FieldAccess.class);
    }
    this.mapper = builder.build();
  }

  /** Returns the stored snapshot, or empty when the file does not exist yet. */
  Optional<StoreSnapshot> read(Path file) {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      var snapshot = mapper.readValue(Files.readString(file), StoreSnapshot.class);
      if (snapshot.schemaVersion() > StoreSnapshot.CURRENT_SCHEMA_VERSION) {
        throw new IllegalStateException(
            "Snapshot "
                + file
                + " has schema version "
                + snapshot.schemaVersion()
                + ", newer than supported version "
                + StoreSnapshot.CURRENT_SCHEMA_VERSION);
      }
      return Optional.of(snapshot);
    } catch (IOException e) {
      throw new SnapshotStorageException("Failed to read snapshot " + file, e);
    } catch (JacksonException e) {
      throw new SnapshotStorageException(
          "Snapshot " + file + " is not valid JSON", new IOException(e.getMessage(), e));
    }
  }

  /** Detached deep copy of an entity, made through the same field mapping as the snapshot. */
  @SuppressWarnings("unchecked")
  <T> T copy(T entity) {
    return (T) mapper.readValue(mapper.writeValueAsBytes(entity), entity.getClass());
  }

  /** Writes to a sibling temp file first, then moves it over {@code file} atomically. */
  void write(Path file, StoreSnapshot snapshot) {
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
      Files.writeString(temp, mapper.writeValueAsString(snapshot));
      Files.move(
          temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new SnapshotStorageException("Failed to write snapshot " + file, e);
    }
  }
}
