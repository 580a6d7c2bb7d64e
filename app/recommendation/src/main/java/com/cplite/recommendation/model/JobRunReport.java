package com.cplite.recommendation.model;

import java.time.Instant;
import java.util.UUID;

public record JobRunReport(UUID runId, Instant startedAt, Instant finishedAt, JobRunResult result) {}
