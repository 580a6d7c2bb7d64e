package com.cplite.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs retention cleanup every {@code notification.retention.cleanup-interval} when enabled. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(
      initialDelayString = "${notification.retention.cleanup-interval}",
      fixedDelayString = "${notification.retention.cleanup-interval}")
  public void cleanupExpired() {
    retentionService.cleanup();
  }
}
