/*
 * Where: NotificationEventHandler unit test
 * What: claim-then-write order, duplicate short-circuit and the stored rows
 * Why: a duplicate must never reach the notifications table
 */
package com.cplite.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.event.NotificationEventType;
import com.cplite.notification.model.ConsumeOutcome;
import com.cplite.notification.model.NotificationRecord;
import com.cplite.notification.repository.NotificationRepository;
import com.cplite.notification.repository.ProcessedEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEventHandlerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T03:00:05Z");
  private static final String EVENT_ID = "task-of-day:user-1:2026-03-02";
  private static final String CONTEST_EVENT_ID = "contest-reminder:1999";
  private static final String BATCH_EVENT_ID = "tasks-batch-created:b-7";

  @Mock private ProcessedEventRepository processedEventRepository;

  @Mock private NotificationRepository notificationRepository;

  @Mock private ContestCatalogService contestCatalogService;

  @Captor private ArgumentCaptor<NotificationRecord> recordCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private NotificationEventHandler handler;

  @BeforeEach
  void setUp() {
    handler =
        new NotificationEventHandler(
            processedEventRepository,
            notificationRepository,
            contestCatalogService,
            new NotificationContentRenderer(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void firstDeliveryClaimsThenWritesNotification() {
    when(processedEventRepository.insertIfAbsent(EVENT_ID, "TaskOfDay", FIXED_NOW))
        .thenReturn(true);
    when(notificationRepository.insertIfAbsent(any(NotificationRecord.class), eq(0)))
        .thenReturn(true);

    final ConsumeOutcome outcome = handler.handle(taskOfDay());

    assertThat(outcome).isEqualTo(ConsumeOutcome.PERSISTED);
    final InOrder order = inOrder(processedEventRepository, notificationRepository);
    order.verify(processedEventRepository).insertIfAbsent(EVENT_ID, "TaskOfDay", FIXED_NOW);
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(0));

    final NotificationRecord record = recordCaptor.getValue();
    assertThat(record.notificationId()).isNotNull();
    assertThat(record.eventId()).isEqualTo(EVENT_ID);
    assertThat(record.userId()).isEqualTo("user-1");
    assertThat(record.eventType()).isEqualTo("TaskOfDay");
    assertThat(record.content()).isEqualTo("Task of the day: Two Sum (due: 2026-03-09)");
    assertThat(record.relatedType()).isEqualTo("task");
    assertThat(record.relatedId()).isEqualTo("42");
    assertThat(record.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(record.read()).isFalse();
    verifyNoInteractions(contestCatalogService);
  }

  @Test
  void duplicateDeliveryWritesNothing() {
    when(processedEventRepository.insertIfAbsent(EVENT_ID, "TaskOfDay", FIXED_NOW))
        .thenReturn(false);

    assertThat(handler.handle(taskOfDay())).isEqualTo(ConsumeOutcome.DUPLICATE);
    verify(notificationRepository, never()).insertIfAbsent(any(NotificationRecord.class), anyInt());
  }

  @Test
  void redeliveryAfterClaimWasPurgedFindsStoredRowsAndIsDuplicate() {
    // retention removed the claim but kept the unread row
    when(processedEventRepository.insertIfAbsent(EVENT_ID, "TaskOfDay", FIXED_NOW))
        .thenReturn(true);
    when(notificationRepository.insertIfAbsent(any(NotificationRecord.class), eq(0)))
        .thenReturn(false);

    assertThat(handler.handle(taskOfDay())).isEqualTo(ConsumeOutcome.DUPLICATE);
  }

  @Test
  void batchWritesEveryRowAtItsPosition() {
    when(processedEventRepository.insertIfAbsent(
            BATCH_EVENT_ID, "TasksBatchCreated", FIXED_NOW))
        .thenReturn(true);
    when(notificationRepository.insertIfAbsent(any(NotificationRecord.class), anyInt()))
        .thenReturn(true);

    assertThat(handler.handle(batch())).isEqualTo(ConsumeOutcome.PERSISTED);

    final InOrder order = inOrder(notificationRepository);
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(0));
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(1));
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(2));
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(3));
    order.verifyNoMoreInteractions();

    final List<NotificationRecord> records = recordCaptor.getAllValues();
    assertThat(records).extracting(NotificationRecord::eventId).containsOnly(BATCH_EVENT_ID);
    assertThat(records)
        .extracting(NotificationRecord::userId)
        .containsExactly("user-1", "user-1", "user-1", "user-2");
    assertThat(records)
        .extracting(NotificationRecord::relatedType)
        .containsExactly("task", "task", "tasks_summary", "task");
    assertThat(records.get(2).content()).isEqualTo("2 new tasks have been assigned to you");
  }

  @Test
  void contestReminderRecordsCatalogBeforeClaimAndMarksItSent() {
    final NotificationEvent event = contestReminder();
    when(contestCatalogService.recordReminder(event)).thenReturn(1999L);
    when(processedEventRepository.insertIfAbsent(CONTEST_EVENT_ID, "ContestReminder", FIXED_NOW))
        .thenReturn(true);
    when(notificationRepository.insertIfAbsent(any(NotificationRecord.class), eq(0)))
        .thenReturn(true);

    assertThat(handler.handle(event)).isEqualTo(ConsumeOutcome.PERSISTED);

    final InOrder order =
        inOrder(contestCatalogService, processedEventRepository, notificationRepository);
    order.verify(contestCatalogService).recordReminder(event);
    order.verify(processedEventRepository)
        .insertIfAbsent(CONTEST_EVENT_ID, "ContestReminder", FIXED_NOW);
    order.verify(notificationRepository).insertIfAbsent(recordCaptor.capture(), eq(0));
    order.verify(contestCatalogService).markNotificationSent(1999L);
    assertThat(recordCaptor.getValue().userId()).isEqualTo(NotificationEvent.SYSTEM_USER_ID);
  }

  @Test
  void duplicateContestReminderStillRefreshesCatalog() {
    final NotificationEvent event = contestReminder();
    when(contestCatalogService.recordReminder(event)).thenReturn(1999L);
    when(processedEventRepository.insertIfAbsent(CONTEST_EVENT_ID, "ContestReminder", FIXED_NOW))
        .thenReturn(false);

    assertThat(handler.handle(event)).isEqualTo(ConsumeOutcome.DUPLICATE);

    verify(contestCatalogService).recordReminder(event);
    verify(contestCatalogService, never()).markNotificationSent(anyLong());
    verify(notificationRepository, never()).insertIfAbsent(any(NotificationRecord.class), anyInt());
  }

  @Test
  void blankEventIdIsRejectedBeforeClaim() {
    final NotificationEvent event =
        new NotificationEvent(
            " ", NotificationEventType.TASK_OF_DAY, "user-1", payload(), FIXED_NOW);

    assertThatThrownBy(() -> handler.handle(event))
        .isInstanceOf(NotificationEventPermanentException.class)
        .hasMessage("event_id is required");
    verifyNoInteractions(processedEventRepository, notificationRepository, contestCatalogService);
  }

  @Test
  void renderFailureAfterClaimPropagates() {
    when(processedEventRepository.insertIfAbsent(EVENT_ID, "TaskOfDay", FIXED_NOW))
        .thenReturn(true);
    final NotificationEvent event =
        new NotificationEvent(
            EVENT_ID,
            NotificationEventType.TASK_OF_DAY,
            "user-1",
            objectMapper.createObjectNode().put("task_id", "42"),
            FIXED_NOW);

    // the transaction boundary turns this into a rolled back claim
    assertThatThrownBy(() -> handler.handle(event))
        .isInstanceOf(NotificationEventPermanentException.class);
    verify(notificationRepository, never()).insertIfAbsent(any(NotificationRecord.class), anyInt());
  }

  private NotificationEvent taskOfDay() {
    return new NotificationEvent(
        EVENT_ID, NotificationEventType.TASK_OF_DAY, "user-1", payload(), FIXED_NOW);
  }

  private NotificationEvent contestReminder() {
    final ObjectNode payload =
        objectMapper
            .createObjectNode()
            .put("contest_id", 1999)
            .put("name", "Codeforces Round 900")
            .put("start_time_seconds", 1772721300L);
    return new NotificationEvent(
        CONTEST_EVENT_ID, NotificationEventType.CONTEST_REMINDER, null, payload, FIXED_NOW);
  }

  private NotificationEvent batch() {
    final ObjectNode payload = objectMapper.createObjectNode().put("batch_id", "b-7");
    final ArrayNode tasks = payload.putArray("tasks");
    tasks.addObject().put("task_id", "1").put("title", "A").put("user_id", "user-1");
    tasks.addObject().put("task_id", "2").put("title", "B").put("user_id", "user-2");
    tasks.addObject().put("task_id", "3").put("title", "C").put("user_id", "user-1");
    return new NotificationEvent(
        BATCH_EVENT_ID, NotificationEventType.TASKS_BATCH_CREATED, null, payload, FIXED_NOW);
  }

  private ObjectNode payload() {
    return objectMapper
        .createObjectNode()
        .put("task_id", "42")
        .put("title", "Two Sum")
        .put("due_date", "2026-03-09");
  }
}
