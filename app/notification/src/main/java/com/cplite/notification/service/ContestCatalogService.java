/*
 * Where: notification service layer
 * What: keeps the contests catalog in step with contest reminders and serves it to the API
 * Why: a contest is recorded on every reminder, while its broadcast is stored only once
 */
package com.cplite.notification.service;

import static com.cplite.notification.service.PayloadFields.optionalField;
import static com.cplite.notification.service.PayloadFields.optionalLong;
import static com.cplite.notification.service.PayloadFields.requireField;
import static com.cplite.notification.service.PayloadFields.requireLong;
import static com.cplite.notification.service.PayloadFields.requireObject;

import com.cplite.common.event.NotificationEvent;
import com.cplite.notification.model.Contest;
import com.cplite.notification.repository.ContestRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ContestCatalogService {

  private static final Logger logger = LoggerFactory.getLogger(ContestCatalogService.class);

  private final ContestRepository contestRepository;
  private final Clock clock;

  /**
   * Upserts the contest a reminder describes. Runs inside the consumer transaction.
   *
   * @return the contest id
   * @throws NotificationEventPermanentException when the reminder lacks the contest fields
   */
  public long recordReminder(NotificationEvent event) {
    final JsonNode payload = requireObject(event.payload(), event.eventId());
    final long contestId = requireLong(payload, "contest_id");
    if (contestId <= 0) {
      throw new NotificationEventPermanentException("contest_id must be positive");
    }
    contestRepository.upsert(
        contestId,
        requireField(payload, "name"),
        Instant.ofEpochSecond(requireLong(payload, "start_time_seconds")),
        optionalLong(payload, "duration_seconds"),
        optionalField(payload, "website_url"),
        Instant.now(clock));
    return contestId;
  }

  public List<Contest> contests(boolean upcomingOnly) {
    return contestRepository.findAll(upcomingOnly ? Instant.now(clock) : null);
  }

  /** @throws ContestNotFoundException when the contest is unknown */
  public Contest contest(long contestId) {
    return contestRepository
        .findById(contestId)
        .orElseThrow(() -> new ContestNotFoundException(contestId));
  }

  public List<Contest> pendingNotifications() {
    return contestRepository.findPendingNotifications(Instant.now(clock));
  }

  /** @throws ContestNotFoundException when the contest is unknown */
  public void markNotificationSent(long contestId) {
    if (!contestRepository.markNotificationSent(contestId, Instant.now(clock))) {
      throw new ContestNotFoundException(contestId);
    }
    logger.info("contest notification marked sent contestId={}", contestId);
  }
}
