/*
 * Where: notification service configuration
 * What: subject, stream and durable consumer of the max-deliveries advisory
 * Why: events that exhausted redelivery are recorded for replay instead of vanishing
 */
package com.cplite.notification.config;

import com.cplite.common.messaging.JetStreamChannelSettings;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.nats.advisory")
@Validated
public record NotificationNatsAdvisoryProperties(
    @NotBlank String subject, @NotBlank String stream, @NotBlank String durable) {

  // advisories carry no Nats-Msg-Id, so the window only has to satisfy the stream definition
  private static final Duration ADVISORY_DUPLICATE_WINDOW = Duration.ofMinutes(2);

  /** Advisory deliveries reuse the ack-wait and max-deliver of the event subscription. */
  public JetStreamChannelSettings toChannelSettings(NotificationNatsProperties eventProperties) {
    return new JetStreamChannelSettings(
        subject,
        stream,
        durable,
        ADVISORY_DUPLICATE_WINDOW,
        eventProperties.ackWait(),
        eventProperties.maxDeliver());
  }
}
