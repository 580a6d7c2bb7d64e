/*
 * Where: notification service layer
 * What: claim-and-write of one event inside a single transaction
 * Why: the claim and the notification rows commit or roll back together, so a failed write never
 *      leaves a claim that would hide the redelivery
 */
package com.cplite.notification.service;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.event.NotificationEventType;
import com.cplite.notification.model.ConsumeOutcome;
import com.cplite.notification.model.NotificationRecord;
import com.cplite.notification.model.RenderedNotification;
import com.cplite.notification.repository.NotificationRepository;
import com.cplite.notification.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class NotificationEventHandler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final ProcessedEventRepository processedEventRepository;
  private final NotificationRepository notificationRepository;
  private final ContestCatalogService contestCatalogService;
  private final NotificationContentRenderer contentRenderer;
  private final Clock clock;

  @Transactional
  public ConsumeOutcome handle(NotificationEvent event) {
    if (event == null || event.eventId() == null || event.eventId().isBlank()) {
      throw new NotificationEventPermanentException("event_id is required");
    }
    if (event.eventType() == null) {
      throw new NotificationEventPermanentException("event_type is required");
    }
    final boolean contestReminder = event.eventType() == NotificationEventType.CONTEST_REMINDER;
    // the catalog follows every reminder, including ones whose broadcast already exists
    final long contestId = contestReminder ? contestCatalogService.recordReminder(event) : 0L;

    final Instant now = Instant.now(clock);
    final String eventType = event.eventType().wireName();
    if (!processedEventRepository.insertIfAbsent(event.eventId(), eventType, now)) {
      return ConsumeOutcome.DUPLICATE;
    }
    // anything thrown from here on rolls the claim back
    final List<RenderedNotification> rendered = contentRenderer.render(event);
    int inserted = 0;
    for (int position = 0; position < rendered.size(); position++) {
      final RenderedNotification row = rendered.get(position);
      final NotificationRecord record =
          new NotificationRecord(
              UUID.randomUUID(),
              event.eventId(),
              row.userId(),
              eventType,
              row.content(),
              row.relatedType(),
              row.relatedId(),
              now,
              false);
      if (notificationRepository.insertIfAbsent(record, position)) {
        inserted++;
      }
    }
    if (inserted == 0) {
      // rows outlived a claim removed by retention
      logger.debug("notification rows already stored eventId={}", event.eventId());
      return ConsumeOutcome.DUPLICATE;
    }
    if (contestReminder) {
      contestCatalogService.markNotificationSent(contestId);
    }
    return ConsumeOutcome.PERSISTED;
  }
}
