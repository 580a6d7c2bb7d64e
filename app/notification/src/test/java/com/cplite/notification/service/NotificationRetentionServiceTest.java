/*
 * Where: notification retention test
 * What: cleanup deletes old claims and old read notifications only
 * Why: an unread notification must survive however old it is
 */
package com.cplite.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.cplite.notification.AbstractPostgresContainerTest;
import com.cplite.notification.config.NotificationRetentionProperties;
import com.cplite.notification.model.NotificationRecord;
import com.cplite.notification.repository.NotificationRepository;
import com.cplite.notification.repository.ProcessedEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRetentionServiceTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T00:00:00Z");

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private NotificationRetentionService retentionService;

  @Autowired private NotificationRetentionProperties retentionProperties;

  @Autowired private ProcessedEventRepository processedEventRepository;

  @Autowired private NotificationRepository notificationRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM processed_events", new MapSqlParameterSource());
  }

  @Test
  void cleanupRemovesOldClaimsAndOldReadNotifications() {
    final int retentionDays = retentionProperties.retentionDays();
    final Instant old = FIXED_NOW.minus(Duration.ofDays(retentionDays + 1L));
    final Instant recent = FIXED_NOW.minus(Duration.ofDays(retentionDays - 1L));

    processedEventRepository.insertIfAbsent("old-claim", "TaskOfDay", old);
    processedEventRepository.insertIfAbsent("recent-claim", "TaskOfDay", recent);
    notificationRepository.insertIfAbsent(notification("old-read", old, true), 0);
    notificationRepository.insertIfAbsent(notification("old-unread", old, false), 0);
    notificationRepository.insertIfAbsent(notification("recent-read", recent, true), 0);

    final NotificationRetentionService.CleanupResult result = retentionService.cleanup();

    assertThat(result.threshold()).isEqualTo(FIXED_NOW.minus(Duration.ofDays(retentionDays)));
    assertThat(result.processedEvents()).isEqualTo(1);
    assertThat(result.readNotifications()).isEqualTo(1);
    assertThat(claimExists("recent-claim")).isTrue();
    assertThat(notificationRepository.findByEventId("old-unread")).hasSize(1);
    assertThat(notificationRepository.findByEventId("recent-read")).hasSize(1);
  }

  @Test
  void cleanupKeepsRowsExactlyAtThreshold() {
    final Instant threshold = FIXED_NOW.minus(Duration.ofDays(retentionProperties.retentionDays()));
    processedEventRepository.insertIfAbsent("at-threshold", "TaskOfDay", threshold);
    notificationRepository.insertIfAbsent(notification("read-at-threshold", threshold, true), 0);

    final NotificationRetentionService.CleanupResult result = retentionService.cleanup();

    assertThat(result.processedEvents()).isZero();
    assertThat(result.readNotifications()).isZero();
  }

  private NotificationRecord notification(String eventId, Instant createdAt, boolean read) {
    return new NotificationRecord(
        UUID.randomUUID(),
        eventId,
        "user-1",
        "TaskOfDay",
        "Task of the day: Two Sum",
        "task",
        "42",
        createdAt,
        read);
  }

  private boolean claimExists(String eventId) {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM processed_events WHERE event_id = :eventId",
            new MapSqlParameterSource("eventId", eventId),
            Integer.class);
    return count != null && count > 0;
  }
}
