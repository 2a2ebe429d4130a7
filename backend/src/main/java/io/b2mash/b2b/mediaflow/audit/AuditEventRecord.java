package io.b2mash.b2b.mediaflow.audit;

import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}, which serializes the details map into {@code metadata}.
 *
 * @param partnerId tenant the activity belongs to
 * @param jobId affected job, if any (not a FK, the job may be repaired away later)
 * @param orderId affected order, if any
 * @param customerId affected customer, if any
 * @param actorId user or editor id; null for system-initiated activity
 * @param action what happened, e.g. {@code status_change}, {@code create}, {@code repair}
 * @param category entity family, e.g. {@code job}, {@code order}, {@code folder}
 * @param title short human-readable summary
 * @param description longer human-readable text; nullable
 * @param metadata JSON object string; nullable
 */
public record AuditEventRecord(
    String partnerId,
    UUID jobId,
    UUID orderId,
    UUID customerId,
    String actorId,
    String action,
    String category,
    String title,
    String description,
    String metadata) {}
