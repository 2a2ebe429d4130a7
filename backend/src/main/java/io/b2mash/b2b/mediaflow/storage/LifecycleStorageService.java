package io.b2mash.b2b.mediaflow.storage;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.audit.AuditEventBuilder;
import io.b2mash.b2b.mediaflow.audit.AuditService;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.customer.NewCustomer;
import io.b2mash.b2b.mediaflow.exception.ForbiddenException;
import io.b2mash.b2b.mediaflow.exception.InvalidStateException;
import io.b2mash.b2b.mediaflow.exception.ResourceNotFoundException;
import io.b2mash.b2b.mediaflow.exception.ValidationFailedException;
import io.b2mash.b2b.mediaflow.folder.CreatedFolder;
import io.b2mash.b2b.mediaflow.folder.FolderOrder;
import io.b2mash.b2b.mediaflow.folder.FolderOrganizer;
import io.b2mash.b2b.mediaflow.folder.UploadFolder;
import io.b2mash.b2b.mediaflow.integrity.CreationValidator;
import io.b2mash.b2b.mediaflow.integrity.EditorAccessDecision;
import io.b2mash.b2b.mediaflow.integrity.HealthReport;
import io.b2mash.b2b.mediaflow.integrity.IntegrityRepairService;
import io.b2mash.b2b.mediaflow.integrity.IntegrityValidator;
import io.b2mash.b2b.mediaflow.integrity.JobIntegrityReport;
import io.b2mash.b2b.mediaflow.integrity.OrderIntegrityReport;
import io.b2mash.b2b.mediaflow.integrity.RepairResult;
import io.b2mash.b2b.mediaflow.integrity.ValidationResult;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.job.JobUpdate;
import io.b2mash.b2b.mediaflow.job.NewJob;
import io.b2mash.b2b.mediaflow.lifecycle.StatusTransitionValidator;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.NewOrder;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderNumberAllocator;
import io.b2mash.b2b.mediaflow.order.OrderProperties;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.RevisionStatus;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.support.TokenGenerator;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import io.b2mash.b2b.mediaflow.upload.NewEditorUpload;
import io.b2mash.b2b.mediaflow.upload.UploadProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default {@link LifecycleStorage}. Raw reads and writes go to the active {@link EntityStore};
 * numbering, transitions, integrity and folders are delegated to their components. Every
 * lifecycle mutation is recorded through {@link AuditService}.
 */
@Service
public class LifecycleStorageService implements LifecycleStorage {

  private static final Logger log = LoggerFactory.getLogger(LifecycleStorageService.class);

  private static final int PUBLIC_ID_ATTEMPTS = 10;

  private final EntityStore store;
  private final OrderNumberAllocator orderNumberAllocator;
  private final StatusTransitionValidator transitionValidator;
  private final IntegrityValidator integrityValidator;
  private final IntegrityRepairService repairService;
  private final CreationValidator creationValidator;
  private final FolderOrganizer folderOrganizer;
  private final AuditService auditService;
  private final OrderProperties orderProperties;
  private final UploadProperties uploadProperties;
  private final Clock clock;

  public LifecycleStorageService(
      EntityStore store,
      OrderNumberAllocator orderNumberAllocator,
      StatusTransitionValidator transitionValidator,
      IntegrityValidator integrityValidator,
      IntegrityRepairService repairService,
      CreationValidator creationValidator,
      FolderOrganizer folderOrganizer,
      AuditService auditService,
      OrderProperties orderProperties,
      UploadProperties uploadProperties,
      Clock clock) {
    this.store = store;
    this.orderNumberAllocator = orderNumberAllocator;
    this.transitionValidator = transitionValidator;
    this.integrityValidator = integrityValidator;
    this.repairService = repairService;
    this.creationValidator = creationValidator;
    this.folderOrganizer = folderOrganizer;
    this.auditService = auditService;
    this.orderProperties = orderProperties;
    this.uploadProperties = uploadProperties;
    this.clock = clock;
  }

  // --- Customers ---

  @Override
  public Customer createCustomer(NewCustomer customer) {
    var errors = new ArrayList<String>();
    if (isBlank(customer.partnerId())) {
      errors.add("partnerId is required");
    }
    if (isBlank(customer.firstName())) {
      errors.add("firstName is required");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException("Customer", errors);
    }
    var created =
        store.createCustomer(
            new Customer(
                customer.partnerId(),
                customer.firstName(),
                Objects.requireNonNullElse(customer.lastName(), ""),
                Objects.requireNonNullElse(customer.email(), "")));
    log.info("Created customer {} for tenant {}", created.getId(), created.getPartnerId());
    return created;
  }

  @Override
  public Optional<Customer> getCustomer(UUID id) {
    return store.findCustomer(id);
  }

  @Override
  public List<Customer> listCustomers(String partnerId) {
    return store.listCustomers(partnerId);
  }

  // --- Jobs ---

  @Override
  public Job createJob(NewJob job) {
    require("Job", creationValidator.validateJobCreation(job));
    String publicId = isBlank(job.jobId()) ? newPublicJobId() : job.jobId().trim();
    var created =
        store.createJob(
            new Job(
                publicId,
                job.partnerId(),
                job.customerId(),
                job.address(),
                job.status(),
                job.assignedTo()));
    log.info(
        "Created job {} ({}) for tenant {}", created.getJobId(), created.getId(), job.partnerId());
    record(
        AuditEventBuilder.builder()
            .partnerId(created.getPartnerId())
            .jobId(created.getId())
            .customerId(created.getCustomerId())
            .action("create")
            .category("job")
            .title("Job " + created.getJobId() + " created")
            .details(detail("address", created.getAddress())));
    return created;
  }

  private String newPublicJobId() {
    for (int attempt = 0; attempt < PUBLIC_ID_ATTEMPTS; attempt++) {
      String candidate = TokenGenerator.generate(TokenGenerator.PUBLIC_JOB_ID_LENGTH);
      if (store.findJobByPublicId(candidate).isEmpty()) {
        return candidate;
      }
    }
    throw new IllegalStateException(
        "Could not find a free public job id after " + PUBLIC_ID_ATTEMPTS + " attempts");
  }

  @Override
  public Optional<Job> getJob(UUID id) {
    return store.findJob(id);
  }

  @Override
  public Optional<Job> getJobByPublicId(String publicJobId) {
    return store.findJobByPublicId(publicJobId);
  }

  @Override
  public Optional<Job> getJobByDeliveryToken(String deliveryToken) {
    if (isBlank(deliveryToken)) {
      return Optional.empty();
    }
    return store.findJobByDeliveryToken(deliveryToken);
  }

  @Override
  public List<Job> listJobs(String partnerId) {
    return store.listJobs(partnerId);
  }

  @Override
  public List<Job> listCustomerJobs(UUID customerId, String partnerId) {
    return store.listJobs(partnerId).stream()
        .filter(job -> customerId.equals(job.getCustomerId()))
        .toList();
  }

  @Override
  public Optional<Job> updateJob(UUID id, JobUpdate update) {
    if (update.customerId() != null) {
      var job = store.findJob(id);
      if (job.isEmpty()) {
        return Optional.empty();
      }
      var customer = store.findCustomer(update.customerId());
      if (customer.isEmpty()
          || !Objects.equals(customer.get().getPartnerId(), job.get().getPartnerId())) {
        throw new ValidationFailedException(
            "Job", List.of("Customer not found in the job's tenant"));
      }
    }
    return store.updateJob(
        id,
        job ->
            job.updateDetails(
                update.address() != null ? update.address() : job.getAddress(),
                update.customerId() != null ? update.customerId() : job.getCustomerId(),
                update.assignedTo() != null ? update.assignedTo() : job.getAssignedTo()));
  }

  @Override
  public Job updateJobStatus(UUID id, JobStatus status, String actorId) {
    var job = store.findJob(id).orElseThrow(() -> new ResourceNotFoundException("Job", id));
    return advanceJob(job, status, actorId);
  }

  @Override
  public Optional<Job> updateJobStatusAfterUpload(String publicJobId, JobStatus status) {
    var found = store.findJobByPublicId(publicJobId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(advanceJob(found.get(), status, null));
  }

  /**
   * Moves a job to {@code target}. A scheduled job asked to complete is first moved to in_progress,
   * so the activity log records both steps.
   */
  private Job advanceJob(Job job, JobStatus target, String actorId) {
    if (job.getStatus() == JobStatus.SCHEDULED && target == JobStatus.COMPLETED) {
      log.warn(
          "Job {} asked to go scheduled → completed; inserting in_progress first",
          job.getJobId());
      job = transitionJob(job, JobStatus.IN_PROGRESS, actorId);
    }
    return transitionJob(job, target, actorId);
  }

  private Job transitionJob(Job job, JobStatus target, String actorId) {
    JobStatus from = job.getStatus();
    transitionValidator.requireTransition(from, target);
    var updated =
        store
            .transitionJobStatus(job.getId(), from, j -> j.changeStatus(target, clock.instant()))
            .orElseThrow(() -> new ResourceNotFoundException("Job", job.getId()));
    log.info("Job {} status {} → {}", updated.getJobId(), from.wireValue(), target.wireValue());
    record(
        AuditEventBuilder.builder()
            .partnerId(updated.getPartnerId())
            .jobId(updated.getId())
            .customerId(updated.getCustomerId())
            .actorId(actorId)
            .action("status_change")
            .category("job")
            .title("Job " + updated.getJobId() + " moved to " + target.wireValue())
            .details(transitionDetails(from.wireValue(), target.wireValue())));
    return updated;
  }

  @Override
  public String generateDeliveryToken(String publicJobId) {
    var job =
        store
            .findJobByPublicId(publicJobId)
            .orElseThrow(() -> new ResourceNotFoundException("Job", publicJobId));
    if (job.getDeliveryToken() != null) {
      return job.getDeliveryToken();
    }
    String token = TokenGenerator.generate(TokenGenerator.DELIVERY_TOKEN_LENGTH);
    var updated =
        store
            .updateJob(
                job.getId(),
                j -> {
                  if (j.getDeliveryToken() == null) {
                    j.assignDeliveryToken(token);
                  }
                })
            .orElseThrow(() -> new ResourceNotFoundException("Job", publicJobId));
    log.info("Issued delivery token for job {}", publicJobId);
    return updated.getDeliveryToken();
  }

  // --- Orders ---

  @Override
  public Order createOrder(NewOrder order, String reservedOrderNumber) {
    require("Order", creationValidator.validateOrderCreation(order));
    var job =
        store
            .findJob(order.jobId())
            .orElseThrow(() -> new ResourceNotFoundException("Job", order.jobId()));

    String orderNumber;
    if (isBlank(reservedOrderNumber)) {
      orderNumber = orderNumberAllocator.generateOrderNumber();
    } else {
      orderNumber = claimReservation(reservedOrderNumber.trim(), job);
    }

    Instant now = clock.instant();
    int maxRounds =
        order.maxRevisionRounds() != null
            ? order.maxRevisionRounds()
            : orderProperties.defaultMaxRevisionRounds();
    var created =
        store.createOrder(
            new Order(
                order.partnerId(),
                orderNumber,
                job.getId(),
                order.customerId() != null ? order.customerId() : job.getCustomerId(),
                order.assignedTo(),
                order.createdBy(),
                maxRounds,
                now,
                now.plus(orderProperties.filesRetention())));
    log.info("Created order {} for job {}", orderNumber, job.getJobId());
    record(
        AuditEventBuilder.builder()
            .partnerId(created.getPartnerId())
            .jobId(job.getId())
            .orderId(created.getId())
            .customerId(created.getCustomerId())
            .actorId(order.createdBy())
            .action("create")
            .category("order")
            .title("Order " + orderNumber + " created")
            .details(
                Map.of("order_number", orderNumber, "reserved", !isBlank(reservedOrderNumber))));
    return created;
  }

  private String claimReservation(String orderNumber, Job job) {
    var reservation =
        orderNumberAllocator
            .getReservation(orderNumber)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Invalid order number reservation",
                        "No reservation found for " + orderNumber));
    if (!Objects.equals(reservation.getJobId(), job.getId())) {
      throw new InvalidStateException(
          "Invalid order number reservation",
          "Reservation " + orderNumber + " was made for a different job");
    }
    var confirmation = orderNumberAllocator.confirm(orderNumber);
    if (!confirmation.confirmed()) {
      throw new InvalidStateException("Invalid order number reservation", confirmation.message());
    }
    return orderNumber;
  }

  @Override
  public Optional<Order> getOrder(UUID id) {
    return store.findOrder(id);
  }

  @Override
  public Optional<Order> getOrderByNumber(String orderNumber, String partnerId) {
    return store
        .findOrderByNumber(orderNumber)
        .filter(order -> Objects.equals(order.getPartnerId(), partnerId));
  }

  @Override
  public List<Order> listOrders(String partnerId) {
    return store.listOrders(partnerId);
  }

  @Override
  public List<Order> listOrdersForJob(UUID jobId) {
    return store.listOrdersForJob(jobId);
  }

  @Override
  public List<Order> listOrdersForEditor(String editorId) {
    return store.listOrdersForEditor(editorId);
  }

  @Override
  public List<Order> listPendingOrders(String partnerId) {
    return store.listOrders(partnerId).stream()
        .filter(order -> order.getStatus() == OrderStatus.PENDING)
        .toList();
  }

  @Override
  public Order assignOrderToEditor(UUID orderId, String editorId) {
    if (isBlank(editorId)) {
      throw new ValidationFailedException("Order", List.of("editorId is required"));
    }
    var updated =
        store
            .updateOrder(orderId, order -> order.assignTo(editorId))
            .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    log.info("Assigned order {} to editor {}", updated.getOrderNumber(), editorId);
    record(
        AuditEventBuilder.builder()
            .partnerId(updated.getPartnerId())
            .jobId(updated.getJobId())
            .orderId(updated.getId())
            .action("assign")
            .category("order")
            .title("Order " + updated.getOrderNumber() + " assigned")
            .details(detail("editor_id", editorId)));
    return updated;
  }

  @Override
  public Order updateOrderStatus(UUID orderId, OrderStatus status, String editorId) {
    var order =
        store.findOrder(orderId).orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    if (editorId == null || !editorId.equals(order.getAssignedTo())) {
      throw new ForbiddenException(
          "Order not assigned to editor",
          "Order " + order.getOrderNumber() + " is not assigned to editor " + editorId);
    }
    OrderStatus from = order.getStatus();
    transitionValidator.requireTransition(from, status);
    var updated =
        store
            .transitionOrderStatus(orderId, from, o -> o.changeStatus(status, clock.instant()))
            .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    log.info(
        "Order {} status {} → {}",
        updated.getOrderNumber(),
        from.wireValue(),
        status.wireValue());
    record(
        AuditEventBuilder.builder()
            .partnerId(updated.getPartnerId())
            .jobId(updated.getJobId())
            .orderId(updated.getId())
            .customerId(updated.getCustomerId())
            .actorId(editorId)
            .action("status_change")
            .category("order")
            .title("Order " + updated.getOrderNumber() + " moved to " + status.wireValue())
            .details(transitionDetails(from.wireValue(), status.wireValue())));
    return updated;
  }

  @Override
  public Order markOrderUploaded(UUID orderId, String editorId) {
    return updateOrderStatus(orderId, OrderStatus.COMPLETED, editorId);
  }

  @Override
  public Order incrementRevisionRound(UUID orderId) {
    Order updated;
    try {
      updated =
          store
              .updateOrder(orderId, Order::consumeRevisionRound)
              .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
    } catch (IllegalStateException e) {
      throw new InvalidStateException("Revision limit reached", e.getMessage());
    }
    log.info(
        "Order {} used revision round {}/{}",
        updated.getOrderNumber(),
        updated.getUsedRevisionRounds(),
        updated.getMaxRevisionRounds());
    record(
        AuditEventBuilder.builder()
            .partnerId(updated.getPartnerId())
            .jobId(updated.getJobId())
            .orderId(updated.getId())
            .action("revision")
            .category("order")
            .title("Order " + updated.getOrderNumber() + " revision round used")
            .details(
                Map.of(
                    "used_rounds", updated.getUsedRevisionRounds(),
                    "max_rounds", updated.getMaxRevisionRounds())));
    return updated;
  }

  @Override
  public Optional<RevisionStatus> getOrderRevisionStatus(UUID orderId) {
    return store.findOrder(orderId).map(RevisionStatus::of);
  }

  @Override
  public String generateOrderNumber() {
    return orderNumberAllocator.generateOrderNumber();
  }

  @Override
  public OrderReservation reserveOrderNumber(String userId, UUID jobId) {
    return orderNumberAllocator.reserveOrderNumber(userId, jobId);
  }

  @Override
  public boolean confirmReservation(String orderNumber) {
    return orderNumberAllocator.confirmReservation(orderNumber);
  }

  @Override
  public Optional<OrderReservation> getReservation(String orderNumber) {
    return orderNumberAllocator.getReservation(orderNumber);
  }

  @Override
  public int cleanupExpiredReservations() {
    return orderNumberAllocator.cleanupExpiredReservations();
  }

  // --- Catalogue ---

  @Override
  public ServiceOffering createServiceOffering(String editorId, String name) {
    var errors = new ArrayList<String>();
    if (isBlank(editorId)) {
      errors.add("editorId is required");
    }
    if (isBlank(name)) {
      errors.add("name is required");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException("ServiceOffering", errors);
    }
    return store.createServiceOffering(new ServiceOffering(editorId, name));
  }

  @Override
  public OrderLine createOrderLine(UUID orderId, UUID serviceId, int quantity) {
    var errors = new ArrayList<String>();
    if (store.findOrder(orderId).isEmpty()) {
      errors.add("Order not found");
    }
    if (serviceId == null || store.findServiceOffering(serviceId).isEmpty()) {
      errors.add("Service offering not found");
    }
    if (quantity < 1) {
      errors.add("quantity must be at least 1");
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException("OrderLine", errors);
    }
    return store.createOrderLine(new OrderLine(orderId, serviceId, quantity));
  }

  @Override
  public List<OrderLine> listOrderLines(UUID orderId) {
    return store.listOrderLines(orderId);
  }

  // --- Uploads ---

  @Override
  public EditorUpload createEditorUpload(NewEditorUpload upload) {
    require("EditorUpload", creationValidator.validateEditorUpload(upload));
    Instant now = clock.instant();
    var entity =
        new EditorUpload(
            upload.jobId(),
            upload.orderId(),
            upload.editorId(),
            upload.fileName(),
            upload.storagePath(),
            upload.downloadUrl(),
            upload.status(),
            now,
            upload.expiresAt() != null
                ? upload.expiresAt()
                : now.plus(uploadProperties.defaultExpiry()));
    entity.placeInFolder(
        upload.folderPath(),
        upload.folderToken(),
        upload.editorFolderName(),
        upload.partnerFolderName());
    var created = store.createUpload(entity);
    log.debug(
        "Recorded upload {} ({}) for job {}",
        created.getId(),
        created.getFileName(),
        upload.jobId());
    return created;
  }

  @Override
  public List<EditorUpload> getEditorUploads(UUID jobId) {
    return store.listUploadsForJob(jobId);
  }

  @Override
  public List<EditorUpload> getEditorUploadsForOrder(UUID orderId) {
    return store.listUploadsForOrder(orderId);
  }

  @Override
  public boolean deleteEditorUpload(UUID id) {
    boolean deleted = store.deleteUpload(id);
    if (deleted) {
      log.info("Deleted upload {}", id);
    }
    return deleted;
  }

  @Override
  public List<EditorUpload> listExpiredForEditingUploads(Instant now) {
    return store.listUploads().stream().filter(upload -> upload.isExpiredForEditing(now)).toList();
  }

  // --- Integrity ---

  @Override
  public JobIntegrityReport validateJobIntegrity(UUID jobId) {
    return integrityValidator.validateJobIntegrity(jobId);
  }

  @Override
  public OrderIntegrityReport validateOrderIntegrity(UUID orderId) {
    return integrityValidator.validateOrderIntegrity(orderId);
  }

  @Override
  public EditorAccessDecision validateEditorWorkflowAccess(String editorId, UUID jobId) {
    return integrityValidator.validateEditorWorkflowAccess(editorId, jobId);
  }

  @Override
  public HealthReport performHealthCheck(String partnerId) {
    return integrityValidator.performHealthCheck(partnerId);
  }

  @Override
  public RepairResult repairOrphanedOrder(UUID orderId, UUID correctJobId) {
    return repairService.repairOrphanedOrder(orderId, correctJobId);
  }

  @Override
  public ValidationResult validateJobCreation(NewJob job) {
    return creationValidator.validateJobCreation(job);
  }

  @Override
  public ValidationResult validateOrderCreation(NewOrder order) {
    return creationValidator.validateOrderCreation(order);
  }

  @Override
  public ValidationResult validateEditorUpload(NewEditorUpload upload) {
    return creationValidator.validateEditorUpload(upload);
  }

  // --- Folders ---

  @Override
  public List<UploadFolder> getUploadFolders(UUID jobId) {
    return folderOrganizer.getUploadFolders(jobId);
  }

  @Override
  public CreatedFolder createFolder(
      UUID jobId,
      String partnerFolderName,
      String parentFolderPath,
      UUID orderId,
      String folderToken) {
    var job = store.findJob(jobId).orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    var created =
        folderOrganizer.createFolder(
            jobId, partnerFolderName, parentFolderPath, orderId, folderToken);
    record(
        AuditEventBuilder.builder()
            .partnerId(job.getPartnerId())
            .jobId(jobId)
            .orderId(orderId)
            .action("create")
            .category("folder")
            .title("Folder " + partnerFolderName + " created")
            .details(detail("folder_path", created.folderPath())));
    return created;
  }

  @Override
  public int updateFolderName(UUID jobId, String uniqueKey, String partnerFolderName) {
    int renamed = folderOrganizer.updateFolderName(jobId, uniqueKey, partnerFolderName);
    var details = detail("unique_key", uniqueKey);
    details.put("uploads_renamed", renamed);
    record(
        AuditEventBuilder.builder()
            .partnerId(store.findJob(jobId).map(Job::getPartnerId).orElse(null))
            .jobId(jobId)
            .action("rename")
            .category("folder")
            .title("Folder renamed to " + partnerFolderName)
            .details(details));
    return renamed;
  }

  @Override
  public void updateFolderVisibility(UUID jobId, String uniqueKey, boolean visible) {
    folderOrganizer.updateFolderVisibility(jobId, uniqueKey, visible);
  }

  @Override
  public void updateFolderOrder(UUID jobId, List<FolderOrder> positions) {
    folderOrganizer.updateFolderOrder(jobId, positions);
  }

  // --- Activity ---

  @Override
  public List<AuditEvent> listJobActivity(UUID jobId) {
    return auditService.findByJob(jobId);
  }

  @Override
  public List<AuditEvent> listOrderActivity(UUID orderId) {
    return auditService.findByOrder(orderId);
  }

  // --- helpers ---

  private void record(AuditEventBuilder builder) {
    auditService.log(builder.build());
  }

  // Accepts null values
  private static LinkedHashMap<String, Object> detail(String key, Object value) {
    var details = new LinkedHashMap<String, Object>();
    details.put(key, value);
    return details;
  }

  private static Map<String, Object> transitionDetails(String from, String to) {
    var details = new LinkedHashMap<String, Object>();
    details.put("from", from);
    details.put("to", to);
    return details;
  }

  private static void require(String entityType, ValidationResult result) {
    if (!result.valid()) {
      throw new ValidationFailedException(entityType, result.errors());
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
