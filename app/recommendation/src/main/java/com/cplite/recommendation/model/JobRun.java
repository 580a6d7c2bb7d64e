package com.cplite.recommendation.model;

import java.time.Instant;
import java.util.UUID;

/** A run that won the job slot. */
public record JobRun(UUID runId, Instant startedAt) {}
