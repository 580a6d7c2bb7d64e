/*
 * Where: shared event contract
 * What: derives the idempotency key (event_id) of each notification event type
 * Why: a retried producer or a second cron tick must regenerate the exact same key
 */
package com.cplite.common.event;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

public final class NotificationEventKeys {

  private NotificationEventKeys() {}

  /** One broadcast per contest, however many times the contest list is polled. */
  public static String contestReminder(long contestId) {
    if (contestId <= 0) {
      throw new IllegalArgumentException("contestId must be positive");
    }
    return "contest-reminder:" + contestId;
  }

  public static String taskAssigned(String taskId, String userId) {
    return "task-assigned:" + requireText(taskId, "taskId") + ":" + requireText(userId, "userId");
  }

  /** One event per assignment batch; every task of the batch rides in the same payload. */
  public static String tasksBatchCreated(String batchId) {
    return "tasks-batch-created:" + requireText(batchId, "batchId");
  }

  /** At most one task-of-day notification per user and UTC day. */
  public static String taskOfDay(String userId, LocalDate day) {
    if (day == null) {
      throw new IllegalArgumentException("day is required");
    }
    return "task-of-day:"
        + requireText(userId, "userId")
        + ":"
        + day.format(DateTimeFormatter.ISO_LOCAL_DATE);
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
    return value.trim();
  }
}
