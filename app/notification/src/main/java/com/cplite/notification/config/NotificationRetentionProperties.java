/*
 * Where: notification service configuration
 * What: retention window and cleanup interval of the idempotency store and read notifications
 * Why: processed_events grows with every event and only needs to outlive redelivery
 */
package com.cplite.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.retention")
@Validated
public record NotificationRetentionProperties(
    boolean enabled, @Positive int retentionDays, Duration cleanupInterval) {

  public NotificationRetentionProperties {
    if (retentionDays == 0) {
      retentionDays = 30;
    }
    if (cleanupInterval == null) {
      cleanupInterval = Duration.ofHours(1);
    }
  }

  @AssertTrue(message = "notification.retention.cleanup-interval must be positive")
  public boolean isCleanupIntervalPositive() {
    return NotificationNatsProperties.isPositive(cleanupInterval);
  }
}
