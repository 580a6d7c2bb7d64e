package com.cplite.notification.model;

import java.time.Instant;

/**
 * One row of the contests catalog.
 *
 * @param durationSeconds null when the reminder did not carry it
 * @param notificationSent true once the broadcast notification for the contest was stored
 */
public record Contest(
    long contestId,
    String name,
    Instant startTime,
    Long durationSeconds,
    String websiteUrl,
    boolean notificationSent,
    Instant createdAt,
    Instant updatedAt) {}
