/*
 * Where: recommendation service domain model
 * What: one row of job_slots
 * Why: the slot row is the single source of truth for "is the job running"
 */
package com.cplite.recommendation.model;

import java.time.Instant;
import java.util.UUID;

/**
 * @param runId id of the current or most recent run, null before the first run
 * @param leaseUntil set while RUNNING; a passed lease means the owning process died
 * @param lastOutcome COMPLETED or FAILED of the last released run, null before the first run
 */
public record JobSlot(
    String jobType,
    JobStatus status,
    UUID runId,
    Instant startedAt,
    Instant finishedAt,
    Instant leaseUntil,
    JobStatus lastOutcome,
    String lastError) {

  public boolean isRunning(Instant now) {
    return status == JobStatus.RUNNING && leaseUntil != null && leaseUntil.isAfter(now);
  }
}
