package io.b2mash.b2b.mediaflow.storage;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.customer.NewCustomer;
import io.b2mash.b2b.mediaflow.folder.CreatedFolder;
import io.b2mash.b2b.mediaflow.folder.FolderOrder;
import io.b2mash.b2b.mediaflow.folder.UploadFolder;
import io.b2mash.b2b.mediaflow.integrity.EditorAccessDecision;
import io.b2mash.b2b.mediaflow.integrity.HealthReport;
import io.b2mash.b2b.mediaflow.integrity.JobIntegrityReport;
import io.b2mash.b2b.mediaflow.integrity.OrderIntegrityReport;
import io.b2mash.b2b.mediaflow.integrity.RepairResult;
import io.b2mash.b2b.mediaflow.integrity.ValidationResult;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.job.JobUpdate;
import io.b2mash.b2b.mediaflow.job.NewJob;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.NewOrder;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.RevisionStatus;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import io.b2mash.b2b.mediaflow.upload.NewEditorUpload;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point of the lifecycle engine for route handlers and admin tooling. Reads return
 * {@link Optional#empty()} for unknown ids; mutations that need an explicit answer throw the
 * exceptions in {@code io.b2mash.b2b.mediaflow.exception}.
 *
 * <p>Tenant-scoped reads take a {@code partnerId}; callers are responsible for authenticating it.
 */
public interface LifecycleStorage {

  // --- Customers ---

  Customer createCustomer(NewCustomer customer);

  Optional<Customer> getCustomer(UUID id);

  List<Customer> listCustomers(String partnerId);

  // --- Jobs ---

  /**
   * @throws io.b2mash.b2b.mediaflow.exception.ValidationFailedException if the preventive check
   *     fails
   */
  Job createJob(NewJob job);

  Optional<Job> getJob(UUID id);

  Optional<Job> getJobByPublicId(String publicJobId);

  Optional<Job> getJobByDeliveryToken(String deliveryToken);

  List<Job> listJobs(String partnerId);

  List<Job> listCustomerJobs(UUID customerId, String partnerId);

  Optional<Job> updateJob(UUID id, JobUpdate update);

  /**
   * Validated status change by internal id. A {@code scheduled → completed} request goes through
   * {@code in_progress} first.
   */
  Job updateJobStatus(UUID id, JobStatus status, String actorId);

  /**
   * Status change triggered by the upload pipeline. A {@code scheduled → completed} request is
   * applied as two recorded transitions through {@code in_progress}.
   *
   * @return empty when no job has that public id
   */
  Optional<Job> updateJobStatusAfterUpload(String publicJobId, JobStatus status);

  /** Returns the job's delivery token, minting one on first call. */
  String generateDeliveryToken(String publicJobId);

  // --- Orders ---

  /**
   * Creates an order. A supplied reservation must confirm and belong to the same job; without one
   * a fresh number is minted.
   */
  Order createOrder(NewOrder order, String reservedOrderNumber);

  Optional<Order> getOrder(UUID id);

  Optional<Order> getOrderByNumber(String orderNumber, String partnerId);

  List<Order> listOrders(String partnerId);

  List<Order> listOrdersForJob(UUID jobId);

  List<Order> listOrdersForEditor(String editorId);

  List<Order> listPendingOrders(String partnerId);

  /** Rejects a blank {@code editorId} before anything is written. */
  Order assignOrderToEditor(UUID orderId, String editorId);

  /**
   * @throws io.b2mash.b2b.mediaflow.exception.ForbiddenException if the order is not assigned to
   *     {@code editorId}
   * @throws io.b2mash.b2b.mediaflow.exception.InvalidStateException if the transition is not
   *     allowed
   */
  Order updateOrderStatus(UUID orderId, OrderStatus status, String editorId);

  Order markOrderUploaded(UUID orderId, String editorId);

  Order incrementRevisionRound(UUID orderId);

  Optional<RevisionStatus> getOrderRevisionStatus(UUID orderId);

  String generateOrderNumber();

  OrderReservation reserveOrderNumber(String userId, UUID jobId);

  boolean confirmReservation(String orderNumber);

  Optional<OrderReservation> getReservation(String orderNumber);

  int cleanupExpiredReservations();

  // --- Catalogue ---

  ServiceOffering createServiceOffering(String editorId, String name);

  OrderLine createOrderLine(UUID orderId, UUID serviceId, int quantity);

  List<OrderLine> listOrderLines(UUID orderId);

  // --- Uploads ---

  EditorUpload createEditorUpload(NewEditorUpload upload);

  List<EditorUpload> getEditorUploads(UUID jobId);

  List<EditorUpload> getEditorUploadsForOrder(UUID orderId);

  boolean deleteEditorUpload(UUID id);

  /** {@code for_editing} uploads whose expiry has passed, for the external cleanup sweep. */
  List<EditorUpload> listExpiredForEditingUploads(Instant now);

  // --- Integrity ---

  JobIntegrityReport validateJobIntegrity(UUID jobId);

  OrderIntegrityReport validateOrderIntegrity(UUID orderId);

  EditorAccessDecision validateEditorWorkflowAccess(String editorId, UUID jobId);

  HealthReport performHealthCheck(String partnerId);

  RepairResult repairOrphanedOrder(UUID orderId, UUID correctJobId);

  ValidationResult validateJobCreation(NewJob job);

  ValidationResult validateOrderCreation(NewOrder order);

  ValidationResult validateEditorUpload(NewEditorUpload upload);

  // --- Folders ---

  List<UploadFolder> getUploadFolders(UUID jobId);

  CreatedFolder createFolder(
      UUID jobId,
      String partnerFolderName,
      String parentFolderPath,
      UUID orderId,
      String folderToken);

  int updateFolderName(UUID jobId, String uniqueKey, String partnerFolderName);

  void updateFolderVisibility(UUID jobId, String uniqueKey, boolean visible);

  void updateFolderOrder(UUID jobId, List<FolderOrder> positions);

  // --- Activity ---

  List<AuditEvent> listJobActivity(UUID jobId);

  List<AuditEvent> listOrderActivity(UUID orderId);
}
