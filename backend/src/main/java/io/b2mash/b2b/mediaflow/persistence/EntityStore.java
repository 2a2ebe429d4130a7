package io.b2mash.b2b.mediaflow.persistence;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.folder.FolderRecord;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.ReservationStatus;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Raw persistence contract shared by every storage backend. Lifecycle rules live above this
 * interface; implementations only guarantee atomicity of each individual call.
 *
 * <p>Conventions:
 *
 * <ul>
 *   <li>{@code create*} stores a freshly constructed entity and never conflicts.
 *   <li>{@code update*} applies {@code changes} to the stored entity and returns it, or {@link
 *       Optional#empty()} when the id is unknown.
 *   <li>{@code list*(partnerId)} returns every tenant's rows when {@code partnerId} is null.
 *   <li>Lists come back in creation order.
 * </ul>
 */
public interface EntityStore {

  /**
   * Atomically increments the named counter and returns the new value. The first call for a name
   * returns 1.
   */
  long incrementCounter(String name);

  // --- Customers ---

  Customer createCustomer(Customer customer);

  Optional<Customer> findCustomer(UUID id);

  List<Customer> listCustomers(String partnerId);

  // --- Jobs ---

  Job createJob(Job job);

  Optional<Job> findJob(UUID id);

  Optional<Job> findJobByPublicId(String publicJobId);

  Optional<Job> findJobByDeliveryToken(String deliveryToken);

  List<Job> listJobs(String partnerId);

  Optional<Job> updateJob(UUID id, Consumer<Job> changes);

  /**
   * Applies {@code changes} only if the job is still in {@code expectedStatus}.
   *
   * @return the updated job, or empty when the id is unknown
   * @throws io.b2mash.b2b.mediaflow.exception.ResourceConflictException if the status changed
   */
  Optional<Job> transitionJobStatus(UUID id, JobStatus expectedStatus, Consumer<Job> changes);

  // --- Orders ---

  Order createOrder(Order order);

  Optional<Order> findOrder(UUID id);

  Optional<Order> findOrderByNumber(String orderNumber);

  List<Order> listOrders(String partnerId);

  List<Order> listOrdersForJob(UUID jobId);

  List<Order> listOrdersForEditor(String editorId);

  Optional<Order> updateOrder(UUID id, Consumer<Order> changes);

  /**
   * Applies {@code changes} only if the order is still in {@code expectedStatus}.
   *
   * @return the updated order, or empty when the id is unknown
   * @throws io.b2mash.b2b.mediaflow.exception.ResourceConflictException if the status changed
   */
  Optional<Order> transitionOrderStatus(
      UUID id, OrderStatus expectedStatus, Consumer<Order> changes);

  // --- Order lines & service offerings ---

  OrderLine createOrderLine(OrderLine line);

  List<OrderLine> listOrderLines(UUID orderId);

  ServiceOffering createServiceOffering(ServiceOffering offering);

  Optional<ServiceOffering> findServiceOffering(UUID id);

  // --- Reservations ---

  OrderReservation createReservation(OrderReservation reservation);

  Optional<OrderReservation> findReservation(String orderNumber);

  List<OrderReservation> listReservations(ReservationStatus status);

  Optional<OrderReservation> updateReservation(
      String orderNumber, Consumer<OrderReservation> changes);

  // --- Editor uploads ---

  EditorUpload createUpload(EditorUpload upload);

  Optional<EditorUpload> findUpload(UUID id);

  List<EditorUpload> listUploads();

  List<EditorUpload> listUploadsForJob(UUID jobId);

  List<EditorUpload> listUploadsForOrder(UUID orderId);

  Optional<EditorUpload> updateUpload(UUID id, Consumer<EditorUpload> changes);

  /** Returns whether an upload was removed. */
  boolean deleteUpload(UUID id);

  // --- Folder metadata ---

  FolderRecord createFolder(FolderRecord folder);

  List<FolderRecord> listFoldersForJob(UUID jobId);

  Optional<FolderRecord> updateFolder(UUID id, Consumer<FolderRecord> changes);

  // --- Activity log ---

  AuditEvent appendAuditEvent(AuditEvent event);

  List<AuditEvent> listAuditEventsForJob(UUID jobId);

  List<AuditEvent> listAuditEventsForOrder(UUID orderId);
}
