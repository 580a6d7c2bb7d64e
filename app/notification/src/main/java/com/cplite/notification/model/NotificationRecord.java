package com.cplite.notification.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of the notifications table.
 *
 * @param eventId event the row was written for, unique across the table
 * @param relatedId task or contest id; null for notifications without a target
 */
public record NotificationRecord(
    UUID notificationId,
    String eventId,
    String userId,
    String eventType,
    String content,
    String relatedType,
    String relatedId,
    Instant createdAt,
    boolean read) {}
