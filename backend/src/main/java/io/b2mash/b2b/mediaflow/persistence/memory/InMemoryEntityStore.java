package io.b2mash.b2b.mediaflow.persistence.memory;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.exception.ResourceConflictException;
import io.b2mash.b2b.mediaflow.folder.FolderRecord;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.job.JobStatus;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.order.OrderStatus;
import io.b2mash.b2b.mediaflow.order.ReservationStatus;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link EntityStore}. All state sits in insertion-ordered maps behind a single lock.
 * When a snapshot file is configured, every mutation rewrites it before returning and the store
 * reloads it on construction.
 *
 * <p>Entities go in and come out as copies. Changing a returned instance has no effect on the
 * store; changes go through the {@code update*} and {@code transition*} methods, which apply them
 * under the lock and persist them.
 *
 * <p>The lock is process-local: two JVMs pointed at the same snapshot file will overwrite each
 * other's changes.
 */
public class InMemoryEntityStore implements EntityStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Path snapshotFile;
  private final SnapshotCodec codec = new SnapshotCodec();

  private final Map<String, Long> counters = new LinkedHashMap<>();
  private final Map<UUID, Customer> customers = new LinkedHashMap<>();
  private final Map<UUID, Job> jobs = new LinkedHashMap<>();
  private final Map<UUID, Order> orders = new LinkedHashMap<>();
  private final Map<UUID, OrderLine> orderLines = new LinkedHashMap<>();
  private final Map<UUID, ServiceOffering> serviceOfferings = new LinkedHashMap<>();
  private final Map<String, OrderReservation> reservations = new LinkedHashMap<>();
  private final Map<UUID, EditorUpload> uploads = new LinkedHashMap<>();
  private final Map<UUID, FolderRecord> folders = new LinkedHashMap<>();
  private final Map<UUID, AuditEvent> auditEvents = new LinkedHashMap<>();

  /** Store without persistence; state is lost with the process. */
  public InMemoryEntityStore() {
    this(null);
  }

  /**
   * @param snapshotFile where to load and save state; {@code null} disables persistence
   */
  public InMemoryEntityStore(Path snapshotFile) {
    this.snapshotFile = snapshotFile;
    if (snapshotFile != null) {
      codec.read(snapshotFile).ifPresent(this::restore);
    }
  }

  private void restore(StoreSnapshot snapshot) {
    counters.putAll(snapshot.counters());
    snapshot.customers().forEach(c -> customers.put(c.getId(), c));
    snapshot.jobs().forEach(j -> jobs.put(j.getId(), j));
    snapshot.orders().forEach(o -> orders.put(o.getId(), o));
    snapshot.orderLines().forEach(l -> orderLines.put(l.getId(), l));
    snapshot.serviceOfferings().forEach(s -> serviceOfferings.put(s.getId(), s));
    snapshot.reservations().forEach(r -> reservations.put(r.getOrderNumber(), r));
    snapshot.uploads().forEach(u -> uploads.put(u.getId(), u));
    snapshot.folders().forEach(f -> folders.put(f.getId(), f));
    snapshot.auditEvents().forEach(a -> auditEvents.put(a.getId(), a));
    log.info(
        "Loaded snapshot {} (schema v{}, saved {}): {} jobs, {} orders, counters={}",
        snapshotFile,
        snapshot.schemaVersion(),
        snapshot.savedAt(),
        jobs.size(),
        orders.size(),
        counters);
  }

  private StoreSnapshot capture() {
    return new StoreSnapshot(
        StoreSnapshot.CURRENT_SCHEMA_VERSION,
        Instant.now(),
        new LinkedHashMap<>(counters),
        new ArrayList<>(customers.values()),
        new ArrayList<>(jobs.values()),
        new ArrayList<>(orders.values()),
        new ArrayList<>(orderLines.values()),
        new ArrayList<>(serviceOfferings.values()),
        new ArrayList<>(reservations.values()),
        new ArrayList<>(uploads.values()),
        new ArrayList<>(folders.values()),
        new ArrayList<>(auditEvents.values()));
  }

  private <T> T read(Supplier<T> query) {
    lock.lock();
    try {
      return query.get();
    } finally {
      lock.unlock();
    }
  }

  private <T> T write(Supplier<T> mutation) {
    lock.lock();
    try {
      T result = mutation.get();
      if (snapshotFile != null) {
        codec.write(snapshotFile, capture());
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  private <K, T> Optional<T> update(Map<K, T> table, K id, Consumer<T> changes) {
    return write(
        () -> {
          T entity = table.get(id);
          if (entity == null) {
            return Optional.<T>empty();
          }
          changes.accept(entity);
          return Optional.of(codec.copy(entity));
        });
  }

  private <T> List<T> select(Map<?, T> table, Predicate<T> filter) {
    return table.values().stream().filter(filter).map(codec::copy).toList();
  }

  private <K, T> T insert(Map<K, T> table, K id, T entity) {
    return write(
        () -> {
          table.put(id, codec.copy(entity));
          return entity;
        });
  }

  private static <T> Predicate<T> tenant(String partnerId, Function<T, String> partnerOf) {
    return entity -> partnerId == null || partnerId.equals(partnerOf.apply(entity));
  }

  @Override
  public long incrementCounter(String name) {
    return write(() -> counters.merge(name, 1L, Long::sum));
  }

  // --- Customers ---

  @Override
  public Customer createCustomer(Customer customer) {
    return insert(customers, customer.getId(), customer);
  }

  @Override
  public Optional<Customer> findCustomer(UUID id) {
    return read(() -> Optional.ofNullable(customers.get(id)).map(codec::copy));
  }

  @Override
  public List<Customer> listCustomers(String partnerId) {
    return read(() -> select(customers, tenant(partnerId, Customer::getPartnerId)));
  }

  // --- Jobs ---

  @Override
  public Job createJob(Job job) {
    return insert(jobs, job.getId(), job);
  }

  @Override
  public Optional<Job> findJob(UUID id) {
    return read(() -> Optional.ofNullable(jobs.get(id)).map(codec::copy));
  }

  @Override
  public Optional<Job> findJobByPublicId(String publicJobId) {
    return read(
        () ->
            jobs.values().stream()
                .filter(j -> Objects.equals(j.getJobId(), publicJobId))
                .findFirst()
                .map(codec::copy));
  }

  @Override
  public Optional<Job> findJobByDeliveryToken(String deliveryToken) {
    return read(
        () ->
            jobs.values().stream()
                .filter(j -> deliveryToken != null && deliveryToken.equals(j.getDeliveryToken()))
                .findFirst()
                .map(codec::copy));
  }

  @Override
  public List<Job> listJobs(String partnerId) {
    return read(() -> select(jobs, tenant(partnerId, Job::getPartnerId)));
  }

  @Override
  public Optional<Job> updateJob(UUID id, Consumer<Job> changes) {
    return update(jobs, id, changes);
  }

  @Override
  public Optional<Job> transitionJobStatus(
      UUID id, JobStatus expectedStatus, Consumer<Job> changes) {
    return update(
        jobs,
        id,
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
          changes.accept(job);
        });
  }

  // --- Orders ---

  @Override
  public Order createOrder(Order order) {
    return insert(orders, order.getId(), order);
  }

  @Override
  public Optional<Order> findOrder(UUID id) {
    return read(() -> Optional.ofNullable(orders.get(id)).map(codec::copy));
  }

  @Override
  public Optional<Order> findOrderByNumber(String orderNumber) {
    return read(
        () ->
            orders.values().stream()
                .filter(o -> o.getOrderNumber().equals(orderNumber))
                .findFirst()
                .map(codec::copy));
  }

  @Override
  public List<Order> listOrders(String partnerId) {
    return read(() -> select(orders, tenant(partnerId, Order::getPartnerId)));
  }

  @Override
  public List<Order> listOrdersForJob(UUID jobId) {
    return read(() -> select(orders, o -> Objects.equals(o.getJobId(), jobId)));
  }

  @Override
  public List<Order> listOrdersForEditor(String editorId) {
    return read(() -> select(orders, o -> Objects.equals(o.getAssignedTo(), editorId)));
  }

  @Override
  public Optional<Order> updateOrder(UUID id, Consumer<Order> changes) {
    return update(orders, id, changes);
  }

  @Override
  public Optional<Order> transitionOrderStatus(
      UUID id, OrderStatus expectedStatus, Consumer<Order> changes) {
    return update(
        orders,
        id,
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
          changes.accept(order);
        });
  }

  // --- Order lines & service offerings ---

  @Override
  public OrderLine createOrderLine(OrderLine line) {
    return insert(orderLines, line.getId(), line);
  }

  @Override
  public List<OrderLine> listOrderLines(UUID orderId) {
    return read(() -> select(orderLines, l -> l.getOrderId().equals(orderId)));
  }

  @Override
  public ServiceOffering createServiceOffering(ServiceOffering offering) {
    return insert(serviceOfferings, offering.getId(), offering);
  }

  @Override
  public Optional<ServiceOffering> findServiceOffering(UUID id) {
    return read(() -> Optional.ofNullable(serviceOfferings.get(id)).map(codec::copy));
  }

  // --- Reservations ---

  @Override
  public OrderReservation createReservation(OrderReservation reservation) {
    return insert(reservations, reservation.getOrderNumber(), reservation);
  }

  @Override
  public Optional<OrderReservation> findReservation(String orderNumber) {
    return read(() -> Optional.ofNullable(reservations.get(orderNumber)).map(codec::copy));
  }

  @Override
  public List<OrderReservation> listReservations(ReservationStatus status) {
    return read(() -> select(reservations, r -> r.getStatus() == status));
  }

  @Override
  public Optional<OrderReservation> updateReservation(
      String orderNumber, Consumer<OrderReservation> changes) {
    return update(reservations, orderNumber, changes);
  }

  // --- Editor uploads ---

  @Override
  public EditorUpload createUpload(EditorUpload upload) {
    return insert(uploads, upload.getId(), upload);
  }

  @Override
  public Optional<EditorUpload> findUpload(UUID id) {
    return read(() -> Optional.ofNullable(uploads.get(id)).map(codec::copy));
  }

  @Override
  public List<EditorUpload> listUploads() {
    return read(() -> select(uploads, u -> true));
  }

  @Override
  public List<EditorUpload> listUploadsForJob(UUID jobId) {
    return read(() -> select(uploads, u -> u.getJobId().equals(jobId)));
  }

  @Override
  public List<EditorUpload> listUploadsForOrder(UUID orderId) {
    return read(() -> select(uploads, u -> Objects.equals(u.getOrderId(), orderId)));
  }

  @Override
  public Optional<EditorUpload> updateUpload(UUID id, Consumer<EditorUpload> changes) {
    return update(uploads, id, changes);
  }

  @Override
  public boolean deleteUpload(UUID id) {
    return write(() -> uploads.remove(id) != null);
  }

  // --- Folder metadata ---

  @Override
  public FolderRecord createFolder(FolderRecord folder) {
    return insert(folders, folder.getId(), folder);
  }

  @Override
  public List<FolderRecord> listFoldersForJob(UUID jobId) {
    return read(() -> select(folders, f -> f.getJobId().equals(jobId)));
  }

  @Override
  public Optional<FolderRecord> updateFolder(UUID id, Consumer<FolderRecord> changes) {
    return update(folders, id, changes);
  }

  // --- Activity log ---

  @Override
  public AuditEvent appendAuditEvent(AuditEvent event) {
    return insert(auditEvents, event.getId(), event);
  }

  @Override
  public List<AuditEvent> listAuditEventsForJob(UUID jobId) {
    return read(() -> select(auditEvents, a -> Objects.equals(a.getJobId(), jobId)));
  }

  @Override
  public List<AuditEvent> listAuditEventsForOrder(UUID orderId) {
    return read(() -> select(auditEvents, a -> Objects.equals(a.getOrderId(), orderId)));
  }
}
