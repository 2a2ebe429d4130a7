package io.b2mash.b2b.mediaflow.job;

import java.util.UUID;

/**
 * Input for creating a job.
 *
 * @param jobId public short id; generated when null or blank
 * @param status initial status; {@code scheduled} when null
 */
public record NewJob(
    String partnerId,
    String jobId,
    UUID customerId,
    String address,
    String assignedTo,
    JobStatus status) {}
