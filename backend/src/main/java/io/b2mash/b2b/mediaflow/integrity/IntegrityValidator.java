package io.b2mash.b2b.mediaflow.integrity;

import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import io.b2mash.b2b.mediaflow.upload.UploadStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only checks over the job ↔ order ↔ customer ↔ upload reference graph. Violations are
 * reported as data, never thrown.
 */
@Service
public class IntegrityValidator {

  private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

  private final EntityStore store;

  public IntegrityValidator(EntityStore store) {
    this.store = store;
  }

  /**
   * Checks that the job's public id resolves back to it, that its customer exists in the same
   * tenant, that at least one order references it, and that every deliverable uploaded to it
   * belongs to one of those orders.
   */
  public JobIntegrityReport validateJobIntegrity(UUID jobId) {
    var maybeJob = store.findJob(jobId);
    if (maybeJob.isEmpty()) {
      return new JobIntegrityReport(jobId, false, List.of("Job not found"), null);
    }
    Job job = maybeJob.get();
    var issues = new ArrayList<String>();

    if (job.getJobId() == null || job.getJobId().isBlank()) {
      issues.add("Job has no public id");
    } else {
      var byPublicId = store.findJobByPublicId(job.getJobId());
      if (byPublicId.isEmpty() || !byPublicId.get().getId().equals(job.getId())) {
        issues.add("Public id " + job.getJobId() + " does not resolve to this job");
      }
      long sharing =
          store.listJobs(null).stream().filter(j -> job.getJobId().equals(j.getJobId())).count();
      if (sharing > 1) {
        issues.add("Public id " + job.getJobId() + " is shared by " + sharing + " jobs");
      }
    }

    if (job.getCustomerId() != null) {
      var customer = store.findCustomer(job.getCustomerId());
      if (customer.isEmpty()) {
        issues.add("Customer " + job.getCustomerId() + " not found");
      } else if (!Objects.equals(job.getPartnerId(), customer.get().getPartnerId())) {
        issues.add("Customer " + job.getCustomerId() + " belongs to another tenant");
      }
    }

    var orders = store.listOrdersForJob(job.getId());
    if (orders.isEmpty()) {
      issues.add("No orders reference this job");
    }
    Set<UUID> orderIds = orders.stream().map(Order::getId).collect(Collectors.toSet());

    var uploads = store.listUploadsForJob(job.getId());
    for (EditorUpload upload : uploads) {
      if (upload.getOrderId() == null) {
        if (upload.getStatus() == UploadStatus.COMPLETED) {
          issues.add("Deliverable " + upload.getId() + " is not linked to an order");
        }
      } else if (!orderIds.contains(upload.getOrderId())) {
        issues.add(
            "Upload "
                + upload.getId()
                + " references order "
                + upload.getOrderId()
                + " which does not belong to this job");
      }
    }

    return new JobIntegrityReport(
        jobId,
        issues.isEmpty(),
        issues,
        new JobIntegrityReport.Connections(
            job.getCustomerId(), orders.stream().map(Order::getId).toList(), uploads.size()));
  }

  /**
   * Checks that the order's job and customer exist, that tenant and customer agree with the job,
   * and that every order line points at an existing service offering.
   */
  public OrderIntegrityReport validateOrderIntegrity(UUID orderId) {
    var maybeOrder = store.findOrder(orderId);
    if (maybeOrder.isEmpty()) {
      return new OrderIntegrityReport(orderId, false, List.of("Order not found"), 0, 0);
    }
    Order order = maybeOrder.get();
    var issues = new ArrayList<String>();

    if (order.getJobId() == null) {
      issues.add("Order is not linked to a job");
    } else {
      var job = store.findJob(order.getJobId());
      if (job.isEmpty()) {
        issues.add("Referenced job " + order.getJobId() + " not found");
      } else {
        if (!Objects.equals(order.getPartnerId(), job.get().getPartnerId())) {
          issues.add("Order tenant does not match job tenant");
        }
        if (!Objects.equals(order.getCustomerId(), job.get().getCustomerId())) {
          issues.add("Order customer does not match job customer");
        }
      }
    }

    if (order.getCustomerId() != null) {
      var customer = store.findCustomer(order.getCustomerId());
      if (customer.isEmpty()) {
        issues.add("Referenced customer " + order.getCustomerId() + " not found");
      } else if (!Objects.equals(order.getPartnerId(), customer.get().getPartnerId())) {
        issues.add("Customer " + order.getCustomerId() + " belongs to another tenant");
      }
    }

    var lines = store.listOrderLines(order.getId());
    for (var line : lines) {
      if (store.findServiceOffering(line.getServiceId()).isEmpty()) {
        issues.add(
            "Order line " + line.getId() + " references unknown service " + line.getServiceId());
      }
    }

    int uploadCount = store.listUploadsForOrder(order.getId()).size();
    return new OrderIntegrityReport(orderId, issues.isEmpty(), issues, lines.size(), uploadCount);
  }

  /**
   * An editor may work on a job while one of the job's orders is assigned to them and is in
   * {@code processing} or {@code in_progress}.
   */
  public EditorAccessDecision validateEditorWorkflowAccess(String editorId, UUID jobId) {
    if (editorId == null || editorId.isBlank()) {
      return EditorAccessDecision.denied("No editor given");
    }
    var assigned =
        store.listOrdersForJob(jobId).stream()
            .filter(o -> Objects.equals(o.getAssignedTo(), editorId))
            .toList();
    if (assigned.isEmpty()) {
      return EditorAccessDecision.denied("No order assigned to this editor for this job");
    }
    var actionable = assigned.stream().filter(o -> o.getStatus().isActionable()).findFirst();
    if (actionable.isPresent()) {
      var order = actionable.get();
      return new EditorAccessDecision(
          true, "Editor has access", order.getOrderNumber(), order.getStatus());
    }
    var order = assigned.get(0);
    return new EditorAccessDecision(
        false,
        "Order "
            + order.getOrderNumber()
            + " is "
            + order.getStatus().wireValue()
            + "; editing requires processing or in_progress",
        order.getOrderNumber(),
        order.getStatus());
  }

  /**
   * Scans jobs, orders and uploads (of one tenant, or all when {@code partnerId} is null) for
   * dangling references. Jobs without any order count as orphans.
   */
  public HealthReport performHealthCheck(String partnerId) {
    Map<UUID, Job> allJobs = indexById(store.listJobs(null), Job::getId);
    Map<UUID, Order> allOrders = indexById(store.listOrders(null), Order::getId);
    Set<UUID> customerIds =
        store.listCustomers(null).stream().map(Customer::getId).collect(Collectors.toSet());

    var jobs = store.listJobs(partnerId);
    var orders = store.listOrders(partnerId);
    Set<UUID> tenantJobIds = jobs.stream().map(Job::getId).collect(Collectors.toSet());
    Set<UUID> tenantOrderIds = orders.stream().map(Order::getId).collect(Collectors.toSet());
    var uploads =
        store.listUploads().stream()
            .filter(
                u ->
                    partnerId == null
                        || tenantJobIds.contains(u.getJobId())
                        || (u.getOrderId() != null && tenantOrderIds.contains(u.getOrderId())))
            .toList();

    Set<UUID> referencedJobIds =
        allOrders.values().stream()
            .map(Order::getJobId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    var orphanedJobs =
        jobs.stream().map(Job::getId).filter(id -> !referencedJobIds.contains(id)).toList();

    var orphanedOrders =
        orders.stream()
            .filter(
                o ->
                    o.getJobId() == null
                        || !allJobs.containsKey(o.getJobId())
                        || (o.getCustomerId() != null && !customerIds.contains(o.getCustomerId())))
            .map(Order::getId)
            .toList();

    var orphanedUploads =
        uploads.stream()
            .filter(
                u ->
                    !allJobs.containsKey(u.getJobId())
                        || (u.getOrderId() != null && !allOrders.containsKey(u.getOrderId())))
            .map(EditorUpload::getId)
            .toList();

    var issues = new ArrayList<String>();
    if (!orphanedJobs.isEmpty()) {
      issues.add("Found " + orphanedJobs.size() + " job(s) without orders");
    }
    if (!orphanedOrders.isEmpty()) {
      issues.add("Found " + orphanedOrders.size() + " orphaned order(s)");
    }
    if (!orphanedUploads.isEmpty()) {
      issues.add("Found " + orphanedUploads.size() + " orphaned upload(s)");
    }

    var report =
        new HealthReport(
            issues.isEmpty(),
            issues,
            new HealthReport.Statistics(jobs.size(), orders.size(), uploads.size()),
            new HealthReport.OrphanedRecords(orphanedJobs, orphanedOrders, orphanedUploads));
    if (report.healthy()) {
      log.debug("Health check passed for tenant {}", partnerId);
    } else {
      log.info("Health check for tenant {} found issues: {}", partnerId, issues);
    }
    return report;
  }

  private static <T> Map<UUID, T> indexById(List<T> entities, Function<T, UUID> id) {
    return entities.stream().collect(Collectors.toMap(id, Function.identity()));
  }
}
