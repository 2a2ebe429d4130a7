package io.b2mash.b2b.mediaflow.folder;

import io.b2mash.b2b.mediaflow.exception.ResourceNotFoundException;
import io.b2mash.b2b.mediaflow.exception.ValidationFailedException;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.support.TokenGenerator;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the folder view of a job's deliverables by merging stored folder records with folders
 * inferred from uploads, and applies partner edits (rename, hide, reorder) as upserts on the
 * folder records.
 *
 * <p>Each upload attaches to, in order: the folder with the same {@link FolderKey}, a stored folder
 * with the same token, a stored folder with the same normalized path, or a new inferred folder.
 * Files are only listed once their order is completed.
 *
 * <p>Mutations on one job are serialized by a per-job lock; different jobs do not contend.
 */
@Service
public class FolderOrganizer {

  private static final Logger log = LoggerFactory.getLogger(FolderOrganizer.class);

  private static final Comparator<UploadFolder> DISPLAY_ORDER =
      Comparator.comparing(
          UploadFolder::displayOrder, Comparator.nullsLast(Comparator.naturalOrder()));

  private final EntityStore store;
  private final Map<UUID, ReentrantLock> jobLocks = new ConcurrentHashMap<>();

  public FolderOrganizer(EntityStore store) {
    this.store = store;
  }

  /**
   * Lists the job's folders sorted by display order (unordered folders last, stored folders ahead
   * of inferred ones on ties).
   */
  public List<UploadFolder> getUploadFolders(UUID jobId) {
    var orders = new HashMap<UUID, Optional<Order>>();
    return merge(jobId).stream()
        .map(folder -> toView(folder, orders))
        .sorted(DISPLAY_ORDER)
        .toList();
  }

  /**
   * Creates a standalone folder placed after every existing one.
   *
   * @param parentFolderPath parent to nest under; {@code folders/} when null
   * @param folderToken token to use; a 16-character token is generated when null
   */
  public CreatedFolder createFolder(
      UUID jobId,
      String partnerFolderName,
      String parentFolderPath,
      UUID orderId,
      String folderToken) {
    if (partnerFolderName == null || partnerFolderName.isBlank()) {
      throw new ValidationFailedException("Folder", List.of("partnerFolderName is required"));
    }
    return withJobLock(
        jobId,
        () -> {
          String token =
              folderToken != null && !folderToken.isBlank()
                  ? folderToken.trim()
                  : TokenGenerator.generate(TokenGenerator.FOLDER_TOKEN_LENGTH);
          String folderPath =
              FolderPaths.isBlank(parentFolderPath)
                  ? "folders/" + token
                  : FolderPaths.normalize(parentFolderPath) + "/" + token;
          int displayOrder =
              store.listFoldersForJob(jobId).stream()
                      .map(FolderRecord::getDisplayOrder)
                      .filter(Objects::nonNull)
                      .max(Integer::compare)
                      .orElse(0)
                  + 1;
          String uniqueKey = new FolderKey.Token(token).render();
          store.createFolder(
              new FolderRecord(
                  jobId,
                  folderPath,
                  token,
                  orderId,
                  null,
                  uniqueKey,
                  partnerFolderName,
                  partnerFolderName,
                  displayOrder));
          log.info("Created folder {} ({}) for job {}", folderPath, partnerFolderName, jobId);
          return new CreatedFolder(folderPath, partnerFolderName, token, uniqueKey);
        });
  }

  /**
   * Renames the folder for partners and updates the partner folder name of every upload in it.
   *
   * @return number of uploads renamed
   */
  public int updateFolderName(UUID jobId, String uniqueKey, String partnerFolderName) {
    if (partnerFolderName == null || partnerFolderName.isBlank()) {
      throw new ValidationFailedException("Folder", List.of("partnerFolderName is required"));
    }
    return withJobLock(
        jobId,
        () -> {
          var folder = locate(jobId, uniqueKey);
          upsertRecord(jobId, folder, record -> record.rename(partnerFolderName));
          int renamed = 0;
          for (EditorUpload upload : folder.files) {
            if (store
                .updateUpload(upload.getId(), u -> u.renameForPartner(partnerFolderName))
                .isPresent()) {
              renamed++;
            }
          }
          log.info(
              "Renamed folder {} of job {} to {} ({} uploads)",
              folder.key.render(),
              jobId,
              partnerFolderName,
              renamed);
          return renamed;
        });
  }

  public void updateFolderVisibility(UUID jobId, String uniqueKey, boolean visible) {
    withJobLock(
        jobId,
        () -> {
          var folder = locate(jobId, uniqueKey);
          upsertRecord(jobId, folder, record -> record.changeVisibility(visible));
          log.info("Folder {} of job {} visible={}", folder.key.render(), jobId, visible);
          return null;
        });
  }

  /** Applies display positions. All keys are resolved before anything is written. */
  public void updateFolderOrder(UUID jobId, List<FolderOrder> positions) {
    withJobLock(
        jobId,
        () -> {
          var merged = merge(jobId);
          var targets = new ArrayList<FolderAccumulator>();
          for (FolderOrder position : positions) {
            targets.add(find(merged, parseKey(position.uniqueKey()), position.uniqueKey()));
          }
          for (int i = 0; i < positions.size(); i++) {
            int displayOrder = positions.get(i).displayOrder();
            upsertRecord(jobId, targets.get(i), record -> record.moveTo(displayOrder));
          }
          log.info("Reordered {} folder(s) of job {}", positions.size(), jobId);
          return null;
        });
  }

  // --- merge ---

  private List<FolderAccumulator> merge(UUID jobId) {
    var byKey = new LinkedHashMap<FolderKey, FolderAccumulator>();
    var storedByToken = new HashMap<String, FolderAccumulator>();
    var storedByPath = new HashMap<String, FolderAccumulator>();

    for (FolderRecord record : store.listFoldersForJob(jobId)) {
      FolderKey key = keyOf(record);
      if (byKey.containsKey(key)) {
        log.warn("Job {} has more than one folder record for {}", jobId, key.render());
        continue;
      }
      var folder = FolderAccumulator.stored(key, record);
      byKey.put(key, folder);
      if (hasText(record.getFolderToken())) {
        storedByToken.putIfAbsent(record.getFolderToken(), folder);
      }
      if (!FolderPaths.isBlank(record.getFolderPath())) {
        storedByPath.putIfAbsent(FolderPaths.comparisonKey(record.getFolderPath()), folder);
      }
    }

    var instanceIds = new HashMap<String, UUID>();
    for (EditorUpload upload : store.listUploadsForJob(jobId)) {
      if (FolderPaths.isBlank(upload.getFolderPath())) {
        continue;
      }
      FolderKey key = keyOf(upload, instanceIds);
      var folder = byKey.get(key);
      if (folder == null && hasText(upload.getFolderToken())) {
        folder = storedByToken.get(upload.getFolderToken());
      }
      if (folder == null) {
        folder = storedByPath.get(FolderPaths.comparisonKey(upload.getFolderPath()));
      }
      if (folder == null) {
        folder = FolderAccumulator.inferred(key, upload);
        byKey.put(key, folder);
      }
      folder.absorb(upload);
    }
    return new ArrayList<>(byKey.values());
  }

  private static FolderKey keyOf(FolderRecord record) {
    try {
      return FolderKey.resolve(
          record.getUniqueKey(),
          record.getFolderToken(),
          record.getOrderId(),
          record.getInstanceId(),
          record.getFolderPath());
    } catch (IllegalArgumentException e) {
      log.warn(
          "Ignoring malformed stored key on folder record {}: {}", record.getId(), e.getMessage());
      return FolderKey.resolve(
          null,
          record.getFolderToken(),
          record.getOrderId(),
          record.getInstanceId(),
          record.getFolderPath());
    }
  }

  private static FolderKey keyOf(EditorUpload upload, Map<String, UUID> instanceIds) {
    UUID instanceId = null;
    if (!hasText(upload.getFolderToken())
        && upload.getOrderId() == null
        && hasText(upload.getEditorFolderName())) {
      String signature =
          FolderPaths.comparisonKey(upload.getFolderPath()) + "::" + upload.getEditorFolderName();
      instanceId = instanceIds.computeIfAbsent(signature, s -> upload.getId());
    }
    return FolderKey.resolve(
        null, upload.getFolderToken(), upload.getOrderId(), instanceId, upload.getFolderPath());
  }

  private UploadFolder toView(FolderAccumulator folder, Map<UUID, Optional<Order>> orders) {
    var released =
        folder.files.stream()
            .filter(
                upload ->
                    upload.getOrderId() != null
                        && lookup(orders, upload.getOrderId())
                            .map(order -> order.getStatus().releasesDeliverables())
                            .orElse(false))
            .toList();
    String orderNumber =
        folder.orderId != null
            ? lookup(orders, folder.orderId).map(Order::getOrderNumber).orElse(null)
            : null;
    return new UploadFolder(
        folder.key.render(),
        folder.folderPath,
        folder.editorFolderName,
        folder.partnerFolderName,
        folder.orderId,
        orderNumber,
        folder.folderToken,
        folder.visible,
        folder.displayOrder,
        released.size(),
        released);
  }

  private Optional<Order> lookup(Map<UUID, Optional<Order>> orders, UUID orderId) {
    return orders.computeIfAbsent(orderId, store::findOrder);
  }

  // --- mutations ---

  private FolderAccumulator locate(UUID jobId, String uniqueKey) {
    return find(merge(jobId), parseKey(uniqueKey), uniqueKey);
  }

  private static FolderAccumulator find(
      List<FolderAccumulator> folders, FolderKey key, String rendered) {
    return folders.stream()
        .filter(folder -> folder.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new ResourceNotFoundException("Folder", rendered));
  }

  private static FolderKey parseKey(String uniqueKey) {
    try {
      return FolderKey.parse(uniqueKey);
    } catch (IllegalArgumentException e) {
      throw new ValidationFailedException("Folder", List.of(e.getMessage()));
    }
  }

  /**
   * Applies {@code change} to the folder's record, creating the record first for inferred folders.
   * The rendered key is stored so the folder keeps its identity.
   */
  private void upsertRecord(UUID jobId, FolderAccumulator folder, Consumer<FolderRecord> change) {
    String renderedKey = folder.key.render();
    if (folder.record != null) {
      store.updateFolder(
          folder.record.getId(),
          record -> {
            record.pinKey(renderedKey);
            change.accept(record);
          });
      return;
    }
    UUID instanceId =
        folder.key instanceof FolderKey.Instance instance ? instance.instanceId() : null;
    var record =
        new FolderRecord(
            jobId,
            folder.folderPath,
            folder.folderToken,
            folder.orderId,
            instanceId,
            renderedKey,
            folder.partnerFolderName,
            folder.editorFolderName,
            folder.displayOrder);
    change.accept(record);
    store.createFolder(record);
    log.debug("Stored metadata for inferred folder {} of job {}", renderedKey, jobId);
  }

  private <T> T withJobLock(UUID jobId, Supplier<T> action) {
    var lock = jobLocks.computeIfAbsent(jobId, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  /** Mutable state of one folder while uploads are being merged in. */
  private static final class FolderAccumulator {
    private final FolderKey key;
    private final FolderRecord record;
    private final List<EditorUpload> files = new ArrayList<>();
    private String folderPath;
    private String editorFolderName;
    private String partnerFolderName;
    private String folderToken;
    private UUID orderId;
    private boolean visible = true;
    private Integer displayOrder;

    private FolderAccumulator(FolderKey key, FolderRecord record) {
      this.key = key;
      this.record = record;
    }

    static FolderAccumulator stored(FolderKey key, FolderRecord record) {
      var folder = new FolderAccumulator(key, record);
      folder.folderPath = FolderPaths.normalize(record.getFolderPath());
      folder.editorFolderName =
          hasText(record.getEditorFolderName())
              ? record.getEditorFolderName()
              : record.getPartnerFolderName();
      folder.partnerFolderName = record.getPartnerFolderName();
      folder.folderToken = record.getFolderToken();
      folder.orderId = record.getOrderId();
      folder.visible = record.isVisible();
      folder.displayOrder = record.getDisplayOrder();
      return folder;
    }

    static FolderAccumulator inferred(FolderKey key, EditorUpload upload) {
      var folder = new FolderAccumulator(key, null);
      folder.folderPath = FolderPaths.normalize(upload.getFolderPath());
      return folder;
    }

    /** Adds the upload and fills in whatever the folder does not know yet. */
    void absorb(EditorUpload upload) {
      files.add(upload);
      if (orderId == null) {
        orderId = upload.getOrderId();
      }
      if (!hasText(editorFolderName)) {
        editorFolderName = upload.getEditorFolderName();
      }
      if (!hasText(partnerFolderName)) {
        partnerFolderName = upload.getPartnerFolderName();
      }
      if (!hasText(folderToken)) {
        folderToken = upload.getFolderToken();
      }
    }
  }
}
