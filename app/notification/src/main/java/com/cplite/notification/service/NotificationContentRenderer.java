/*
 * Where: notification service layer
 * What: turns an event payload into the rows stored for it, with text and target
 * Why: producers send data, the user-facing wording is owned here
 */
package com.cplite.notification.service;

import static com.cplite.notification.service.PayloadFields.requireField;
import static com.cplite.notification.service.PayloadFields.requireLong;
import static com.cplite.notification.service.PayloadFields.requireObject;
import static com.cplite.notification.service.PayloadFields.requireText;

import com.cplite.common.event.NotificationEvent;
import com.cplite.notification.model.RenderedNotification;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class NotificationContentRenderer {

  static final String RELATED_TYPE_TASK = "task";
  static final String RELATED_TYPE_CONTEST = "contest";
  static final String RELATED_TYPE_TASKS_SUMMARY = "tasks_summary";

  private static final String TASK_ASSIGNED_PREFIX = "New task assigned: ";

  private static final DateTimeFormatter CONTEST_START_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  /**
   * Renders every row the event produces, in storage order. Single events give one row; a task
   * batch gives one row per task plus a summary per user who got more than one task.
   *
   * @throws NotificationEventPermanentException when a field the wording needs is missing
   */
  public List<RenderedNotification> render(NotificationEvent event) {
    if (event.eventType() == null) {
      throw new NotificationEventPermanentException("event_type is required");
    }
    final JsonNode payload = requireObject(event.payload(), event.eventId());
    return switch (event.eventType()) {
      case TASK_ASSIGNED -> List.of(
          renderTask(requireText(event.userId(), "user_id"), payload, TASK_ASSIGNED_PREFIX));
      case TASK_OF_DAY -> List.of(
          renderTask(requireText(event.userId(), "user_id"), payload, "Task of the day: "));
      case CONTEST_REMINDER -> List.of(renderContest(payload));
      case TASKS_BATCH_CREATED -> renderBatch(payload);
    };
  }

  private RenderedNotification renderTask(String userId, JsonNode payload, String prefix) {
    final String taskId = requireField(payload, "task_id");
    final String title = requireField(payload, "title");
    final StringBuilder content = new StringBuilder(prefix).append(title);
    final String dueDate = PayloadFields.optionalField(payload, "due_date");
    if (dueDate != null) {
      content.append(" (due: ").append(dueDate).append(')');
    }
    return new RenderedNotification(userId, content.toString(), RELATED_TYPE_TASK, taskId);
  }

  private List<RenderedNotification> renderBatch(JsonNode payload) {
    final JsonNode tasks = payload.get("tasks");
    if (tasks == null || !tasks.isArray() || tasks.isEmpty()) {
      throw new NotificationEventPermanentException("tasks must be a non-empty array");
    }
    // users keep the order of their first task in the batch
    final Map<String, List<RenderedNotification>> byUser = new LinkedHashMap<>();
    for (JsonNode task : tasks) {
      if (!task.isObject()) {
        throw new NotificationEventPermanentException("tasks must contain objects");
      }
      final String userId = requireField(task, "user_id");
      byUser
          .computeIfAbsent(userId, ignored -> new ArrayList<>())
          .add(renderTask(userId, task, TASK_ASSIGNED_PREFIX));
    }
    final List<RenderedNotification> rendered = new ArrayList<>();
    byUser.forEach(
        (userId, rows) -> {
          rendered.addAll(rows);
          if (rows.size() > 1) {
            rendered.add(
                new RenderedNotification(
                    userId,
                    rows.size() + " new tasks have been assigned to you",
                    RELATED_TYPE_TASKS_SUMMARY,
                    null));
          }
        });
    return rendered;
  }

  private RenderedNotification renderContest(JsonNode payload) {
    final String contestId = requireField(payload, "contest_id");
    final String name = requireField(payload, "name");
    final String startsAt =
        CONTEST_START_FORMAT.format(
            Instant.ofEpochSecond(requireLong(payload, "start_time_seconds")));
    final String content =
        "Upcoming Codeforces contest: " + name + " starting at " + startsAt + ".";
    // contest reminders are broadcasts whatever user_id the producer sent
    return new RenderedNotification(
        NotificationEvent.SYSTEM_USER_ID, content, RELATED_TYPE_CONTEST, contestId);
  }
}
