package io.b2mash.b2b.mediaflow.job;

import java.util.UUID;

/** Partial edit of a job. Null fields are left unchanged. */
public record JobUpdate(String address, UUID customerId, String assignedTo) {}
