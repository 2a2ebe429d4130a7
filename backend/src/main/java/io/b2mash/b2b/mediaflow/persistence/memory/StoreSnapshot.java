package io.b2mash.b2b.mediaflow.persistence.memory;

import io.b2mash.b2b.mediaflow.audit.AuditEvent;
import io.b2mash.b2b.mediaflow.customer.Customer;
import io.b2mash.b2b.mediaflow.folder.FolderRecord;
import io.b2mash.b2b.mediaflow.job.Job;
import io.b2mash.b2b.mediaflow.offering.ServiceOffering;
import io.b2mash.b2b.mediaflow.order.Order;
import io.b2mash.b2b.mediaflow.order.OrderLine;
import io.b2mash.b2b.mediaflow.order.OrderReservation;
import io.b2mash.b2b.mediaflow.upload.EditorUpload;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Versioned on-disk envelope of the in-memory store. Bump {@link #CURRENT_SCHEMA_VERSION} whenever
 * an entity gains or loses a persisted field.
 */
public record StoreSnapshot(
    int schemaVersion,
    Instant savedAt,
    Map<String, Long> counters,
    List<Customer> customers,
    List<Job> jobs,
    List<Order> orders,
    List<OrderLine> orderLines,
    List<ServiceOffering> serviceOfferings,
    List<OrderReservation> reservations,
    List<EditorUpload> uploads,
    List<FolderRecord> folders,
    List<AuditEvent> auditEvents) {

  public static final int CURRENT_SCHEMA_VERSION = 1;

  public StoreSnapshot {
    counters = counters != null ? counters : Map.of();
    customers = customers != null ? customers : List.of();
    jobs = jobs != null ? jobs : List.of();
    orders = orders != null ? orders : List.of();
    orderLines = orderLines != null ? orderLines : List.of();
    serviceOfferings = serviceOfferings != null ? serviceOfferings : List.of();
    reservations = reservations != null ? reservations : List.of();
    uploads = uploads != null ? uploads : List.of();
    folders = folders != null ? folders : List.of();
    auditEvents = auditEvents != null ? auditEvents : List.of();
  }
}
