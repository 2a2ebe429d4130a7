package io.b2mash.b2b.mediaflow.order;

import java.util.UUID;

/**
 * Input for creating an order. The order number is never part of the input; it comes from a
 * confirmed reservation or is minted on creation.
 *
 * @param jobId internal id of the job the order belongs to
 * @param maxRevisionRounds revision allowance; the configured default when null
 */
public record NewOrder(
    String partnerId,
    UUID jobId,
    UUID customerId,
    String assignedTo,
    String createdBy,
    Integer maxRevisionRounds) {}
