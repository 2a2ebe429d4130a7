package io.b2mash.b2b.mediaflow.folder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.b2b.mediaflow.exception.ResourceNotFoundException;
import io.b2mash.b2b.mediaflow.exception.ValidationFailedException;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.testutil.LifecycleFixture;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FolderOrganizerTest {

  private LifecycleFixture fixture;
  private FolderOrganizer organizer;
  private Job job;
  private Order order;

  @BeforeEach
  void setUp() {
    fixture = new LifecycleFixture();
    organizer = fixture.folderOrganizer;
    job = fixture.job(LifecycleFixture.PARTNER, fixture.customer(LifecycleFixture.PARTNER));
    order = fixture.order(job);
  }

  @Test
  void getUploadFolders_groupsByTokenAcrossPrefixAndCase() {
    fixture.upload(job, order, "completed/" + job.getJobId() + "/Photos", "tok-1", "Photos");
    fixture.upload(job, order, "PHOTOS", "tok-1", "Photos");
    fixture.complete(order);

    var folders = organizer.getUploadFolders(job.getId());

    assertThat(folders)
        .singleElement()
        .satisfies(
            folder -> {
              assertThat(folder.uniqueKey()).isEqualTo("token:tok-1");
              assertThat(folder.fileCount()).isEqualTo(2);
              assertThat(folder.orderNumber()).isEqualTo(order.getOrderNumber());
            });
  }

  @Test
  void getUploadFolders_listsFilesOnlyOnceOrderIsCompleted() {
    fixture.upload(job, order, "Photos", "tok-1", "Photos");

    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(folder -> assertThat(folder.files()).isEmpty());

    fixture.complete(order);

    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(folder -> assertThat(folder.files()).hasSize(1));
  }

  @Test
  void getUploadFolders_separatesOrderlessUploadsByEditorFolder() {
    EditorUpload first = fixture.upload(job, null, "Raw", null, "Morning");
    fixture.upload(job, null, "raw/", null, "Morning");
    EditorUpload other = fixture.upload(job, null, "Raw", null, "Evening");

    var keys = organizer.getUploadFolders(job.getId()).stream().map(UploadFolder::uniqueKey);

    assertThat(keys)
        .containsExactlyInAnyOrder(
            "instance:" + first.getId() + "::raw", "instance:" + other.getId() + "::raw");
  }

  @Test
  void getUploadFolders_separatesSamePathPerOrder() {
    var second = fixture.order(job);
    fixture.upload(job, order, "Photos", null, "Photos");
    fixture.upload(job, second, "Photos", null, "Photos");

    assertThat(organizer.getUploadFolders(job.getId()))
        .extracting(UploadFolder::uniqueKey)
        .containsExactlyInAnyOrder(
            "order:" + order.getId() + "::photos", "order:" + second.getId() + "::photos");
  }

  @Test
  void createFolder_appendsAfterExistingFolders() {
    var first = organizer.createFolder(job.getId(), "Twilight", null, null, "tok-a");
    var second = organizer.createFolder(job.getId(), "Drone", "folders/tok-a", null, null);

    assertThat(first.folderPath()).isEqualTo("folders/tok-a");
    assertThat(first.uniqueKey()).isEqualTo("token:tok-a");
    assertThat(second.folderToken()).hasSize(16);
    assertThat(second.folderPath()).isEqualTo("folders/tok-a/" + second.folderToken());
    assertThat(organizer.getUploadFolders(job.getId()))
        .extracting(UploadFolder::partnerFolderName, UploadFolder::displayOrder)
        .containsExactly(tuple("Twilight", 1), tuple("Drone", 2));
  }

  @Test
  void createFolder_requiresName() {
    assertThatThrownBy(() -> organizer.createFolder(job.getId(), " ", null, null, null))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void createdFolder_picksUpUploadsCarryingItsToken() {
    var created = organizer.createFolder(job.getId(), "Twilight", null, order.getId(), null);
    fixture.upload(job, order, "anything/else", created.folderToken(), "Dusk");
    fixture.complete(order);

    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(
            folder -> {
              assertThat(folder.uniqueKey()).isEqualTo(created.uniqueKey());
              assertThat(folder.partnerFolderName()).isEqualTo("Twilight");
              assertThat(folder.fileCount()).isEqualTo(1);
            });
  }

  @Test
  void updateFolderName_storesRecordForInferredFolderAndRenamesUploads() {
    fixture.upload(job, order, "Photos", "tok-1", "Photos");
    fixture.upload(job, order, "Photos", "tok-1", "Photos");

    int renamed = organizer.updateFolderName(job.getId(), "token:tok-1", "Final Selects");

    assertThat(renamed).isEqualTo(2);
    assertThat(fixture.store.listUploadsForJob(job.getId()))
        .allSatisfy(u -> assertThat(u.getPartnerFolderName()).isEqualTo("Final Selects"));
    assertThat(fixture.store.listFoldersForJob(job.getId()))
        .singleElement()
        .satisfies(record -> assertThat(record.getUniqueKey()).isEqualTo("token:tok-1"));
    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(f -> assertThat(f.partnerFolderName()).isEqualTo("Final Selects"));
  }

  @Test
  void updateFolderName_keepsInstanceIdentity() {
    EditorUpload first = fixture.upload(job, null, "Raw", null, "Morning");
    String key = "instance:" + first.getId() + "::raw";

    organizer.updateFolderName(job.getId(), key, "Sunrise");
    fixture.upload(job, null, "Raw", null, "Morning");

    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(
            folder -> {
              assertThat(folder.uniqueKey()).isEqualTo(key);
              assertThat(folder.partnerFolderName()).isEqualTo("Sunrise");
            });
  }

  @Test
  void updateFolderVisibility_hidesFolder() {
    fixture.upload(job, order, "Photos", "tok-1", "Photos");

    organizer.updateFolderVisibility(job.getId(), "token:tok-1", false);

    assertThat(organizer.getUploadFolders(job.getId()))
        .singleElement()
        .satisfies(folder -> assertThat(folder.visible()).isFalse());
  }

  @Test
  void updateFolderOrder_sortsFoldersWithUnorderedLast() {
    fixture.upload(job, order, "A", "tok-a", "A");
    fixture.upload(job, order, "B", "tok-b", "B");
    fixture.upload(job, order, "C", "tok-c", "C");

    organizer.updateFolderOrder(
        job.getId(), List.of(new FolderOrder("token:tok-c", 1), new FolderOrder("token:tok-a", 2)));

    assertThat(organizer.getUploadFolders(job.getId()))
        .extracting(UploadFolder::uniqueKey)
        .containsExactly("token:tok-c", "token:tok-a", "token:tok-b");
  }

  @Test
  void updateFolderOrder_writesNothingWhenAKeyIsUnknown() {
    fixture.upload(job, order, "A", "tok-a", "A");

    assertThatThrownBy(
            () ->
                organizer.updateFolderOrder(
                    job.getId(),
                    List.of(new FolderOrder("token:tok-a", 1), new FolderOrder("token:nope", 2))))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThat(fixture.store.listFoldersForJob(job.getId())).isEmpty();
  }

  @Test
  void updateFolderVisibility_rejectsMalformedKey() {
    assertThatThrownBy(() -> organizer.updateFolderVisibility(job.getId(), "bogus", true))
        .isInstanceOf(ValidationFailedException.class);
  }
}
