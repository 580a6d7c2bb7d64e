/*
 * Where: shared event contract
 * What: builds notification envelopes with derived keys and publishes them on the channel
 * Why: every producer writes the payload fields the notification consumer renders
 */
package com.cplite.common.event;

import com.cplite.common.messaging.EventChannel;
import com.cplite.common.messaging.PublishReceipt;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NotificationEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventPublisher.class);

  private final EventChannel<NotificationEvent> channel;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  private final Clock clock;

  public NotificationEventPublisher(
      EventChannel<NotificationEvent> channel, ObjectMapper objectMapper, Clock clock) {
    this.channel = channel;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /** One task inside a {@code TasksBatchCreated} payload. */
  public record AssignedTask(String taskId, String userId, String title, String dueDate) {}

  public PublishReceipt publishContestReminder(long contestId, String name, Instant startTime) {
    return publishContestReminder(contestId, name, startTime, null, null);
  }

  /**
   * @param durationSeconds contest length, null when the source does not say
   * @param websiteUrl contest page, null when absent
   */
  public PublishReceipt publishContestReminder(
      long contestId, String name, Instant startTime, Long durationSeconds, String websiteUrl) {
    final ObjectNode payload = objectMapper.createObjectNode();
    payload.put("contest_id", contestId);
    payload.put("name", name);
    payload.put("start_time_seconds", startTime.getEpochSecond());
    if (durationSeconds != null) {
      payload.put("duration_seconds", durationSeconds);
    }
    if (websiteUrl != null && !websiteUrl.isBlank()) {
      payload.put("website_url", websiteUrl);
    }
    return publish(
        NotificationEventKeys.contestReminder(contestId),
        NotificationEventType.CONTEST_REMINDER,
        NotificationEvent.SYSTEM_USER_ID,
        payload);
  }

  public PublishReceipt publishTaskAssigned(
      String taskId, String userId, String title, String dueDate) {
    final ObjectNode payload = taskPayload(taskId, title, dueDate);
    return publish(
        NotificationEventKeys.taskAssigned(taskId, userId),
        NotificationEventType.TASK_ASSIGNED,
        userId,
        payload);
  }

  public PublishReceipt publishTaskOfDay(
      String userId, LocalDate day, String taskId, String title, String dueDate) {
    final ObjectNode payload = taskPayload(taskId, title, dueDate);
    return publish(
        NotificationEventKeys.taskOfDay(userId, day),
        NotificationEventType.TASK_OF_DAY,
        userId,
        payload);
  }

  /**
   * Publishes a whole assignment batch as one event. The envelope carries no user; each task names
   * its own.
   */
  public PublishReceipt publishTasksBatchCreated(String batchId, List<AssignedTask> tasks) {
    if (tasks == null || tasks.isEmpty()) {
      throw new IllegalArgumentException("tasks must not be empty");
    }
    final ObjectNode payload = objectMapper.createObjectNode();
    payload.put("batch_id", batchId);
    final ArrayNode taskNodes = payload.putArray("tasks");
    for (AssignedTask task : tasks) {
      final ObjectNode node = taskPayload(task.taskId(), task.title(), task.dueDate());
      node.put("user_id", task.userId());
      taskNodes.add(node);
    }
    return publish(
        NotificationEventKeys.tasksBatchCreated(batchId),
        NotificationEventType.TASKS_BATCH_CREATED,
        null,
        payload);
  }

  private ObjectNode taskPayload(String taskId, String title, String dueDate) {
    final ObjectNode payload = objectMapper.createObjectNode();
    payload.put("task_id", taskId);
    payload.put("title", title);
    if (dueDate != null && !dueDate.isBlank()) {
      payload.put("due_date", dueDate);
    }
    return payload;
  }

  private PublishReceipt publish(
      String eventId, NotificationEventType eventType, String userId, ObjectNode payload) {
    final NotificationEvent event =
        new NotificationEvent(eventId, eventType, userId, payload, Instant.now(clock));
    final PublishReceipt receipt = channel.publish(event);
    logger.debug(
        "notification event published eventId={} type={} seq={} duplicate={}",
        eventId,
        eventType.wireName(),
        receipt.sequence(),
        receipt.duplicate());
    return receipt;
  }
}
