/*
 * Where: recommendation service configuration
 * What: subject, stream and duplicate window of the notification events it publishes
 * Why: publisher and notification consumer must point at the same stream
 */
package com.cplite.recommendation.config;

import com.cplite.common.messaging.JetStreamChannelSettings;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "recommendation.nats")
@Validated
public record RecommendationNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "recommendation.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }

  public JetStreamChannelSettings toChannelSettings() {
    return JetStreamChannelSettings.forPublisher(subject, stream, duplicateWindow);
  }
}
