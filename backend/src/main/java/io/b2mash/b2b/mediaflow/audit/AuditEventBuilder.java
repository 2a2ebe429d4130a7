package io.b2mash.b2b.mediaflow.audit;

import java.util.Map;
import java.util.UUID;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Builder that constructs an {@link AuditEventRecord}. The details map is serialized to a JSON
 * object string for the {@code metadata} column.
 *
 * <p>Required fields: {@code action}, {@code category}, {@code title}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .action("status_change")
 *     .category("order")
 *     .title("Order #00042 moved to processing")
 *     .order(order)
 *     .details(Map.of("from", "pending", "to", "processing"))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final JsonMapper METADATA_MAPPER = JsonMapper.builder().build();

  private String partnerId;
  private UUID jobId;
  private UUID orderId;
  private UUID customerId;
  private String actorId;
  private String action;
  private String category;
  private String title;
  private String description;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder partnerId(String partnerId) {
    this.partnerId = partnerId;
    return this;
  }

  public AuditEventBuilder jobId(UUID jobId) {
    this.jobId = jobId;
    return this;
  }

  public AuditEventBuilder orderId(UUID orderId) {
    this.orderId = orderId;
    return this;
  }

  public AuditEventBuilder customerId(UUID customerId) {
    this.customerId = customerId;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    return this;
  }

  public AuditEventBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditEventBuilder category(String category) {
    this.category = category;
    return this;
  }

  public AuditEventBuilder title(String title) {
    this.title = title;
    return this;
  }

  public AuditEventBuilder description(String description) {
    this.description = description;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (action == null || category == null || title == null) {
      throw new IllegalStateException("action, category and title are required");
    }
    return new AuditEventRecord(
        partnerId,
        jobId,
        orderId,
        customerId,
        actorId,
        action,
        category,
        title,
        description,
        toMetadata(details));
  }

  private static String toMetadata(Map<String, Object> details) {
    if (details == null || details.isEmpty()) {
      return null;
    }
    try {
      return METADATA_MAPPER.writeValueAsString(details);
    } catch (JacksonException e) {
      throw new IllegalArgumentException("Audit details are not serializable to JSON", e);
    }
  }
}
