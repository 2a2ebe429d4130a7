package io.b2mash.b2b.mediaflow.storage;

import static io.b2mash.b2b.mediaflow.testutil.LifecycleFixture.EDITOR;
import static io.b2mash.b2b.mediaflow.testutil.LifecycleFixture.OTHER_PARTNER;
import static io.b2mash.b2b.mediaflow.testutil.LifecycleFixture.PARTNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.exception.ForbiddenException;
import io.b2mash.b2b.mediaflow.exception.InvalidStateException;
import io.b2mash.b2b.mediaflow.exception.ResourceNotFoundException;
import io.b2mash.b2b.mediaflow.exception.ValidationFailedException;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.job.JobUpdate;
import io.b2mash.b2b.mediaflow.job.NewJob;
import io.b2mash.b2b.mediaflow.order.NewOrder;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.ReservationStatus;
import io.b2mash.b2b.mediaflow.order.RevisionStatus;
import io.b2mash.b2b.mediaflow.testutil.LifecycleFixture;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LifecycleStorageServiceTest {

  private LifecycleFixture fixture;
  private LifecycleStorage storage;
  private Customer customer;
  private Job job;

  @BeforeEach
  void setUp() {
    fixture = new LifecycleFixture();
    storage = fixture.storage;
    customer = fixture.customer(PARTNER);
    job = fixture.job(PARTNER, customer);
  }

  // --- jobs ---

  @Test
  void createJob_generatesPublicIdAndRecordsActivity() {
    assertThat(job.getJobId()).hasSize(8).matches("[A-Za-z0-9_-]+");
    assertThat(job.getStatus()).isEqualTo(JobStatus.SCHEDULED);
    assertThat(storage.getJobByPublicId(job.getJobId()))
        .hasValueSatisfying(j -> assertThat(j.getId()).isEqualTo(job.getId()));
    assertThat(storage.listJobActivity(job.getId()))
        .extracting(AuditEvent::getAction, AuditEvent::getCategory)
        .containsExactly(tuple("create", "job"));
  }

  @Test
  void createJob_keepsSuppliedPublicIdAndRejectsDuplicates() {
    var created =
        storage.createJob(
            new NewJob(PARTNER, "SHOOT-01", customer.getId(), "2 Pier St", null, null));

    assertThat(created.getJobId()).isEqualTo("SHOOT-01");
    assertThatThrownBy(
            () ->
                storage.createJob(
                    new NewJob(PARTNER, "SHOOT-01", customer.getId(), "3 Pier St", null, null)))
        .isInstanceOf(ValidationFailedException.class)
        .satisfies(
            e ->
                assertThat(((ValidationFailedException) e).getErrors())
                    .containsExactly("Job id SHOOT-01 is already in use"));
  }

  @Test
  void updateJob_leavesNullFieldsUnchanged() {
    var updated = storage.updateJob(job.getId(), new JobUpdate("99 New Rd", null, null));

    assertThat(updated)
        .hasValueSatisfying(
            j -> {
              assertThat(j.getAddress()).isEqualTo("99 New Rd");
              assertThat(j.getCustomerId()).isEqualTo(customer.getId());
            });
    assertThat(storage.updateJob(UUID.randomUUID(), new JobUpdate("x", null, null))).isEmpty();
  }

  @Test
  void updateJob_rejectsCustomerOfAnotherTenant() {
    var foreign = fixture.customer(OTHER_PARTNER);

    assertThatThrownBy(
            () -> storage.updateJob(job.getId(), new JobUpdate(null, foreign.getId(), null)))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void updateJobStatus_rejectsInvalidTransition() {
    storage.updateJobStatus(job.getId(), JobStatus.CANCELLED, "ops");

    assertThatThrownBy(() -> storage.updateJobStatus(job.getId(), JobStatus.IN_PROGRESS, "ops"))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("cancelled → in_progress");
    assertThat(storage.getJob(job.getId()))
        .hasValueSatisfying(j -> assertThat(j.getStatus()).isEqualTo(JobStatus.CANCELLED));
  }

  @Test
  void updateJobStatus_scheduledToCompletedPassesThroughInProgress() {
    var completed = storage.updateJobStatus(job.getId(), JobStatus.COMPLETED, "ops");

    assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(storage.listJobActivity(job.getId()))
        .filteredOn(e -> e.getAction().equals("status_change"))
        .extracting(AuditEvent::getMetadata, AuditEvent::getActorId)
        .containsExactly(
            tuple("{\"from\":\"scheduled\",\"to\":\"in_progress\"}", "ops"),
            tuple("{\"from\":\"in_progress\",\"to\":\"completed\"}", "ops"));
  }

  @Test
  void updateJobStatus_unknownJobIsNotFound() {
    assertThatThrownBy(() -> storage.updateJobStatus(UUID.randomUUID(), JobStatus.IN_PROGRESS, "x"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void updateJobStatusAfterUpload_insertsInProgressStepFromScheduled() {
    var result = storage.updateJobStatusAfterUpload(job.getJobId(), JobStatus.COMPLETED);

    assertThat(result)
        .hasValueSatisfying(
            j -> {
              assertThat(j.getStatus()).isEqualTo(JobStatus.COMPLETED);
              assertThat(j.getDeliveredAt()).isNotNull();
            });
    assertThat(storage.listJobActivity(job.getId()))
        .filteredOn(e -> e.getAction().equals("status_change"))
        .extracting(AuditEvent::getMetadata)
        .containsExactly(
            "{\"from\":\"scheduled\",\"to\":\"in_progress\"}",
            "{\"from\":\"in_progress\",\"to\":\"completed\"}");
  }

  @Test
  void updateJobStatusAfterUpload_unknownPublicIdIsEmpty() {
    assertThat(storage.updateJobStatusAfterUpload("nope", JobStatus.COMPLETED)).isEmpty();
  }

  @Test
  void generateDeliveryToken_isStableAndResolvable() {
    String token = storage.generateDeliveryToken(job.getJobId());

    assertThat(token).hasSize(32);
    assertThat(storage.generateDeliveryToken(job.getJobId())).isEqualTo(token);
    assertThat(storage.getJobByDeliveryToken(token))
        .hasValueSatisfying(j -> assertThat(j.getId()).isEqualTo(job.getId()));
    assertThatThrownBy(() -> storage.generateDeliveryToken("missing"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void listCustomerJobs_filtersByCustomerWithinTenant() {
    var otherCustomer = fixture.customer(PARTNER);
    fixture.job(PARTNER, otherCustomer);

    assertThat(storage.listCustomerJobs(customer.getId(), PARTNER))
        .extracting(Job::getId)
        .containsExactly(job.getId());
  }

  // --- orders ---

  @Test
  void createOrder_appliesDefaultsFromJobAndConfiguration() {
    var order = fixture.order(job);

    assertThat(order.getOrderNumber()).isEqualTo("#00001");
    assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
    assertThat(order.getCustomerId()).isEqualTo(customer.getId());
    assertThat(order.getMaxRevisionRounds()).isEqualTo(2);
    assertThat(order.getFilesExpiryDate())
        .isEqualTo(fixture.clock.instant().plus(Duration.ofDays(30)));
  }

  @Test
  void createOrder_consumesReservationForSameJob() {
    var reservation = storage.reserveOrderNumber("admin-1", job.getId());

    var order =
        storage.createOrder(
            new NewOrder(PARTNER, job.getId(), null, EDITOR, "admin-1", 3),
            reservation.getOrderNumber());

    assertThat(order.getOrderNumber()).isEqualTo(reservation.getOrderNumber());
    assertThat(order.getMaxRevisionRounds()).isEqualTo(3);
    assertThat(storage.getReservation(reservation.getOrderNumber()))
        .hasValueSatisfying(r -> assertThat(r.getStatus()).isEqualTo(ReservationStatus.CONFIRMED));
  }

  @Test
  void createOrder_rejectsReservationMadeForAnotherJob() {
    var otherJob = fixture.job(PARTNER, customer);
    var reservation = storage.reserveOrderNumber("admin-1", otherJob.getId());

    assertThatThrownBy(
            () ->
                storage.createOrder(
                    new NewOrder(PARTNER, job.getId(), null, EDITOR, "admin-1", null),
                    reservation.getOrderNumber()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(storage.getReservation(reservation.getOrderNumber()))
        .hasValueSatisfying(r -> assertThat(r.getStatus()).isEqualTo(ReservationStatus.RESERVED));
  }

  @Test
  void createOrder_rejectsExpiredReservation() {
    var reservation = storage.reserveOrderNumber("admin-1", job.getId());
    fixture.clock.advance(Duration.ofHours(3));

    assertThatThrownBy(
            () ->
                storage.createOrder(
                    new NewOrder(PARTNER, job.getId(), null, EDITOR, "admin-1", null),
                    reservation.getOrderNumber()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(storage.listOrdersForJob(job.getId())).isEmpty();
  }

  @Test
  void createOrder_rejectsUnknownJob() {
    assertThatThrownBy(
            () ->
                storage.createOrder(
                    new NewOrder(PARTNER, UUID.randomUUID(), null, EDITOR, "admin-1", null), null))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void getOrderByNumber_isScopedToTenant() {
    var order = fixture.order(job);

    assertThat(storage.getOrderByNumber(order.getOrderNumber(), PARTNER)).isPresent();
    assertThat(storage.getOrderByNumber(order.getOrderNumber(), OTHER_PARTNER)).isEmpty();
  }

  @Test
  void updateOrderStatus_onlyAssignedEditorMayMoveOrder() {
    var order = fixture.order(job);

    assertThatThrownBy(
            () -> storage.updateOrderStatus(order.getId(), OrderStatus.PROCESSING, "intruder"))
        .isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(
            () -> storage.updateOrderStatus(order.getId(), OrderStatus.COMPLETED, EDITOR))
        .isInstanceOf(InvalidStateException.class);

    var accepted = storage.updateOrderStatus(order.getId(), OrderStatus.PROCESSING, EDITOR);

    assertThat(accepted.getDateAccepted()).isEqualTo(fixture.clock.instant());
    assertThat(storage.listOrderActivity(order.getId()))
        .extracting(AuditEvent::getAction)
        .containsExactly("create", "status_change");
  }

  @Test
  void assignOrderToEditor_reassignsAndListsForEditor() {
    var order = fixture.order(job);

    storage.assignOrderToEditor(order.getId(), "editor-2");

    assertThat(storage.listOrdersForEditor("editor-2"))
        .extracting("id")
        .containsExactly(order.getId());
    assertThat(storage.listOrdersForEditor(EDITOR)).isEmpty();
    assertThat(storage.listPendingOrders(PARTNER)).hasSize(1);
    assertThatThrownBy(() -> storage.assignOrderToEditor(UUID.randomUUID(), "editor-2"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void assignOrderToEditor_rejectsMissingEditorWithoutChangingOrder() {
    var order = fixture.order(job);

    assertThatThrownBy(() -> storage.assignOrderToEditor(order.getId(), null))
        .isInstanceOf(ValidationFailedException.class);
    assertThatThrownBy(() -> storage.assignOrderToEditor(order.getId(), "  "))
        .isInstanceOf(ValidationFailedException.class);
    assertThat(storage.getOrder(order.getId()))
        .hasValueSatisfying(o -> assertThat(o.getAssignedTo()).isEqualTo(EDITOR));
    assertThat(storage.listOrderActivity(order.getId()))
        .extracting(AuditEvent::getAction)
        .doesNotContain("assign");
  }

  @Test
  void markOrderUploaded_completesOrderInProgress() {
    var order = fixture.order(job);
    storage.updateOrderStatus(order.getId(), OrderStatus.PROCESSING, EDITOR);
    storage.updateOrderStatus(order.getId(), OrderStatus.IN_PROGRESS, EDITOR);

    var completed = storage.markOrderUploaded(order.getId(), EDITOR);

    assertThat(completed.getStatus()).isEqualTo(OrderStatus.COMPLETED);
    assertThat(completed.getDateCompleted()).isNotNull();
  }

  @Test
  void incrementRevisionRound_stopsAtConfiguredMaximum() {
    var order = fixture.order(job);

    storage.incrementRevisionRound(order.getId());
    storage.incrementRevisionRound(order.getId());

    assertThat(storage.getOrderRevisionStatus(order.getId()))
        .contains(new RevisionStatus(2, 2, 0));
    assertThatThrownBy(() -> storage.incrementRevisionRound(order.getId()))
        .isInstanceOf(InvalidStateException.class);
    assertThat(storage.getOrderRevisionStatus(UUID.randomUUID())).isEmpty();
  }

  @Test
  void createOrderLine_requiresExistingOrderAndService() {
    var order = fixture.order(job);
    var offering = storage.createServiceOffering(EDITOR, "HDR Photos");

    var line = storage.createOrderLine(order.getId(), offering.getId(), 25);

    assertThat(storage.listOrderLines(order.getId()))
        .extracting("id")
        .containsExactly(line.getId());
    assertThatThrownBy(() -> storage.createOrderLine(order.getId(), UUID.randomUUID(), 0))
        .isInstanceOf(ValidationFailedException.class)
        .satisfies(
            e ->
                assertThat(((ValidationFailedException) e).getErrors())
                    .containsExactly(
                        "Service offering not found", "quantity must be at least 1"));
  }

  // --- uploads ---

  @Test
  void createEditorUpload_defaultsExpiryAndFindsExpiredOnes() {
    var order = fixture.order(job);
    var editing = fixture.upload(job, null, "Raw", null, "Raw");
    fixture.upload(job, order, "Final", "tok", "Final");

    assertThat(editing.getExpiresAt())
        .isEqualTo(fixture.clock.instant().plus(Duration.ofDays(30)));
    assertThat(storage.listExpiredForEditingUploads(fixture.clock.instant())).isEmpty();
    var later = fixture.clock.instant().plus(Duration.ofDays(31));
    assertThat(storage.listExpiredForEditingUploads(later))
        .extracting("id")
        .containsExactly(editing.getId());
  }

  @Test
  void deleteEditorUpload_removesOnce() {
    var upload = fixture.upload(job, null, "Raw", null, "Raw");

    assertThat(storage.deleteEditorUpload(upload.getId())).isTrue();
    assertThat(storage.deleteEditorUpload(upload.getId())).isFalse();
    assertThat(storage.getEditorUploads(job.getId())).isEmpty();
  }

  // --- folders ---

  @Test
  void createFolder_isRecordedInJobActivity() {
    storage.createFolder(job.getId(), "Twilight", null, null, null);

    assertThat(storage.listJobActivity(job.getId()))
        .extracting(AuditEvent::getCategory)
        .containsExactly("job", "folder");
    assertThatThrownBy(() -> storage.createFolder(UUID.randomUUID(), "X", null, null, null))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void updateFolderName_recordsKeyAndRenamedUploadCount() {
    var folder = storage.createFolder(job.getId(), "Twilight", null, null, null);

    int renamed = storage.updateFolderName(job.getId(), folder.uniqueKey(), "Dusk");

    assertThat(renamed).isZero();
    assertThat(storage.listJobActivity(job.getId()))
        .filteredOn(e -> e.getAction().equals("rename"))
        .singleElement()
        .satisfies(
            e ->
                assertThat(e.getMetadata())
                    .contains(folder.uniqueKey())
                    .contains("\"uploads_renamed\":0"));
  }
}
