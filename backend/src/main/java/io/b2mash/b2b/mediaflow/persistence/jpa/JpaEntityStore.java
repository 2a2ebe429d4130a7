package io.b2mash.b2b.mediaflow.persistence.jpa;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.audit.AuditEventRepository;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.customer.CustomerRepository;
import io.b2mash.b2b.mediaflow.exception.ResourceConflictException;
import io.b2mash.b2b.mediaflow.folder.FolderRecord;
import io.b2mash.b2b.mediaflow.folder.FolderRecordRepository;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobRepository;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.offering.ServiceOfferingRepository;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderLineRepository;
import io.b2mash.b2b.mediaflow.order.OrderRepository;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.order.OrderReservationRepository;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.ReservationStatus;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import io.b2mash.b2b.mediaflow.upload.EditorUploadRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL-backed {@link EntityStore}. Every method runs in its own transaction, so there is no
 * separate flush step. Entities get their ids at construction and are inserted with {@code
 * persist} rather than {@code merge}.
 */
@Transactional
public class JpaEntityStore implements EntityStore {

  @PersistenceContext private EntityManager entityManager;

  private final CustomerRepository customerRepository;
  private final JobRepository jobRepository;
  private final OrderRepository orderRepository;
  private final OrderLineRepository orderLineRepository;
  private final ServiceOfferingRepository serviceOfferingRepository;
  private final OrderReservationRepository reservationRepository;
  private final EditorUploadRepository uploadRepository;
  private final FolderRecordRepository folderRepository;
  private final AuditEventRepository auditEventRepository;

  public JpaEntityStore(
      CustomerRepository customerRepository,
      JobRepository jobRepository,
      OrderRepository orderRepository,
      OrderLineRepository orderLineRepository,
      ServiceOfferingRepository serviceOfferingRepository,
      OrderReservationRepository reservationRepository,
      EditorUploadRepository uploadRepository,
      FolderRecordRepository folderRepository,
      AuditEventRepository auditEventRepository) {
    this.customerRepository = customerRepository;
    this.jobRepository = jobRepository;
    this.orderRepository = orderRepository;
    this.orderLineRepository = orderLineRepository;
    this.serviceOfferingRepository = serviceOfferingRepository;
    this.reservationRepository = reservationRepository;
    this.uploadRepository = uploadRepository;
    this.folderRepository = folderRepository;
    this.auditEventRepository = auditEventRepository;
  }

  /**
   * Increments the named counter with a single atomic UPSERT. Concurrent callers serialize on the
   * row lock taken by {@code ON CONFLICT DO UPDATE}, so no two of them see the same value.
   */
  @Override
  public long incrementCounter(String name) {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO order_counters (name, current_value) VALUES (:name, 1)"
                    + " ON CONFLICT (name)"
                    + " DO UPDATE SET current_value = order_counters.current_value + 1"
                    + " RETURNING current_value")
            .setParameter("name", name)
            .getSingleResult();
    return ((Number) result).longValue();
  }

  private <T> T insert(T entity) {
    entityManager.persist(entity);
    return entity;
  }

  // --- Customers ---

  @Override
  public Customer createCustomer(Customer customer) {
    return insert(customer);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Customer> findCustomer(UUID id) {
    return customerRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Customer> listCustomers(String partnerId) {
    return customerRepository.findForPartner(partnerId);
  }

  // --- Jobs ---

  @Override
  public Job createJob(Job job) {
    return insert(job);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Job> findJob(UUID id) {
    return jobRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Job> findJobByPublicId(String publicJobId) {
    return jobRepository.findByJobId(publicJobId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Job> findJobByDeliveryToken(String deliveryToken) {
    return jobRepository.findByDeliveryToken(deliveryToken);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Job> listJobs(String partnerId) {
    return jobRepository.findForPartner(partnerId);
  }

  @Override
  public Optional<Job> updateJob(UUID id, Consumer<Job> changes) {
    return jobRepository.findById(id).map(job -> apply(job, changes));
  }

  @Override
  public Optional<Job> transitionJobStatus(
      UUID id, JobStatus expectedStatus, Consumer<Job> changes) {
    return jobRepository
        .findWithLockById(id)
        .map(
            job -> {
              if (job.getStatus() != expectedStatus) {
                throw new ResourceConflictException(
                    "Job status changed",
                    "Job "
                        + id
                        + " is "
                        + job.getStatus().wireValue()
                        + ", expected "
                        + expectedStatus.wireValue());
              }
              return apply(job, changes);
            });
  }

  // --- Orders ---

  @Override
  public Order createOrder(Order order) {
    return insert(order);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Order> findOrder(UUID id) {
    return orderRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Order> findOrderByNumber(String orderNumber) {
    return orderRepository.findByOrderNumber(orderNumber);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Order> listOrders(String partnerId) {
    return orderRepository.findForPartner(partnerId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Order> listOrdersForJob(UUID jobId) {
    return orderRepository.findByJobId(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Order> listOrdersForEditor(String editorId) {
    return orderRepository.findByAssignedTo(editorId);
  }

  @Override
  public Optional<Order> updateOrder(UUID id, Consumer<Order> changes) {
    return orderRepository.findById(id).map(order -> apply(order, changes));
  }

  @Override
  public Optional<Order> transitionOrderStatus(
      UUID id, OrderStatus expectedStatus, Consumer<Order> changes) {
    return orderRepository
        .findWithLockById(id)
        .map(
            order -> {
              if (order.getStatus() != expectedStatus) {
                throw new ResourceConflictException(
                    "Order status changed",
                    "Order "
                        + order.getOrderNumber()
                        + " is "
                        + order.getStatus().wireValue()
                        + ", expected "
                        + expectedStatus.wireValue());
              }
              return apply(order, changes);
            });
  }

  // --- Order lines & service offerings ---

  @Override
  public OrderLine createOrderLine(OrderLine line) {
    return insert(line);
  }

  @Override
  @Transactional(readOnly = true)
  public List<OrderLine> listOrderLines(UUID orderId) {
    return orderLineRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
  }

  @Override
  public ServiceOffering createServiceOffering(ServiceOffering offering) {
    return insert(offering);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<ServiceOffering> findServiceOffering(UUID id) {
    return serviceOfferingRepository.findById(id);
  }

  // --- Reservations ---

  @Override
  public OrderReservation createReservation(OrderReservation reservation) {
    return insert(reservation);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<OrderReservation> findReservation(String orderNumber) {
    return reservationRepository.findById(orderNumber);
  }

  @Override
  @Transactional(readOnly = true)
  public List<OrderReservation> listReservations(ReservationStatus status) {
    return reservationRepository.findByStatusOrderByReservedAtAsc(status);
  }

  @Override
  public Optional<OrderReservation> updateReservation(
      String orderNumber, Consumer<OrderReservation> changes) {
    return reservationRepository
        .findWithLockByOrderNumber(orderNumber)
        .map(reservation -> apply(reservation, changes));
  }

  // --- Editor uploads ---

  @Override
  public EditorUpload createUpload(EditorUpload upload) {
    return insert(upload);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EditorUpload> findUpload(UUID id) {
    return uploadRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public List<EditorUpload> listUploads() {
    return uploadRepository.findAllByOrderByUploadedAtAsc();
  }

  @Override
  @Transactional(readOnly = true)
  public List<EditorUpload> listUploadsForJob(UUID jobId) {
    return uploadRepository.findByJobIdOrderByUploadedAtAsc(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<EditorUpload> listUploadsForOrder(UUID orderId) {
    return uploadRepository.findByOrderIdOrderByUploadedAtAsc(orderId);
  }

  @Override
  public Optional<EditorUpload> updateUpload(UUID id, Consumer<EditorUpload> changes) {
    return uploadRepository.findById(id).map(upload -> apply(upload, changes));
  }

  @Override
  public boolean deleteUpload(UUID id) {
    return uploadRepository
        .findById(id)
        .map(
            upload -> {
              uploadRepository.delete(upload);
              return true;
            })
        .orElse(false);
  }

  // --- Folder metadata ---

  @Override
  public FolderRecord createFolder(FolderRecord folder) {
    return insert(folder);
  }

  @Override
  @Transactional(readOnly = true)
  public List<FolderRecord> listFoldersForJob(UUID jobId) {
    return folderRepository.findByJobIdOrderByCreatedAtAsc(jobId);
  }

  @Override
  public Optional<FolderRecord> updateFolder(UUID id, Consumer<FolderRecord> changes) {
    return folderRepository.findById(id).map(folder -> apply(folder, changes));
  }

  // --- Activity log ---

  @Override
  public AuditEvent appendAuditEvent(AuditEvent event) {
    return insert(event);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> listAuditEventsForJob(UUID jobId) {
    return auditEventRepository.findByJobIdOrderByOccurredAtAsc(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> listAuditEventsForOrder(UUID orderId) {
    return auditEventRepository.findByOrderIdOrderByOccurredAtAsc(orderId);
  }

  // Dirty checking writes the change at commit
  private static <T> T apply(T entity, Consumer<T> changes) {
    changes.accept(entity);
    return entity;
  }
}
