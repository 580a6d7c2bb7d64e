/*
 * Where: notification service layer
 * What: deletes old event claims and old read notifications
 * Why: both tables grow with every event; unread notifications are never removed
 */
package com.cplite.notification.service;

import com.cplite.notification.config.NotificationRetentionProperties;
import com.cplite.notification.repository.NotificationRepository;
import com.cplite.notification.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final ProcessedEventRepository processedEventRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public record CleanupResult(Instant threshold, int processedEvents, int readNotifications) {}

  public CleanupResult cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    // a claim older than the window can no longer meet a redelivery of its event
    final int processedEvents = processedEventRepository.deleteOlderThan(threshold);
    final int readNotifications = notificationRepository.deleteReadOlderThan(threshold);
    logger.info(
        "notification retention cleanup processedEvents={} readNotifications={} threshold={}",
        processedEvents,
        readNotifications,
        threshold);
    return new CleanupResult(threshold, processedEvents, readNotifications);
  }
}
