/*
 * Where: notification service configuration
 * What: stream, durable consumer and redelivery settings of the notification event subscription
 * Why: ack-wait and max-deliver decide how long a failing event keeps coming back
 */
package com.cplite.notification.config;

import com.cplite.common.messaging.JetStreamChannelSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats")
@Validated
public record NotificationNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @Positive int maxDeliver,
    Duration shutdownTimeout) {

  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  public NotificationNatsProperties {
    if (shutdownTimeout == null) {
      shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    }
  }

  @AssertTrue(message = "notification.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositive(duplicateWindow);
  }

  @AssertTrue(message = "notification.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositive(ackWait);
  }

  @AssertTrue(message = "notification.nats.shutdown-timeout must not be negative")
  public boolean isShutdownTimeoutValid() {
    return !shutdownTimeout.isNegative();
  }

  public JetStreamChannelSettings toChannelSettings() {
    return new JetStreamChannelSettings(
        subject, stream, durable, duplicateWindow, ackWait, maxDeliver);
  }

  static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
