package com.cplite.recommendation.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of the job slot.
 *
 * @param lastOutcome outcome of the last finished run, null before the first run
 */
public record JobStatusView(
    boolean running,
    UUID runId,
    JobStatus lastOutcome,
    Instant startedAt,
    Instant finishedAt,
    String lastError) {}
