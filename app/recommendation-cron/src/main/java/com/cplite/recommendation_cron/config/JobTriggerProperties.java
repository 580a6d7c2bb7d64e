/*
 * Where: recommendation cron configuration
 * What: target URL, retry budget and HTTP timeouts of the trigger
 * Why: MAX_RETRIES / RETRY_DELAY / RECOMMENDATION_SERVICE_URL stay tunable per deployment
 */
package com.cplite.recommendation_cron.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * @param retryDelay pause between run-sync attempts; a bare number is read as seconds
 * @param readTimeout must exceed the longest expected run, run-sync blocks until the job ends
 */
@ConfigurationProperties(prefix = "job-trigger")
@Validated
public record JobTriggerProperties(
    @NotBlank String baseUrl,
    String statusPath,
    String runSyncPath,
    @NotNull @Positive Integer maxRetries,
    @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration retryDelay,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout) {

  public JobTriggerProperties {
    baseUrl = baseUrl == null ? "http://recommendation-service:8000" : baseUrl;
    statusPath = statusPath == null || statusPath.isBlank() ? "/status" : statusPath;
    runSyncPath = runSyncPath == null || runSyncPath.isBlank() ? "/run-sync" : runSyncPath;
    maxRetries = maxRetries == null ? 3 : maxRetries;
    retryDelay = retryDelay == null ? Duration.ofSeconds(60) : retryDelay;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofHours(2) : readTimeout;
  }

  @AssertTrue(message = "job-trigger.retry-delay must not be negative")
  public boolean isRetryDelayNotNegative() {
    return retryDelay != null && !retryDelay.isNegative();
  }

  @AssertTrue(message = "job-trigger.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return readTimeout != null && !readTimeout.isZero() && !readTimeout.isNegative();
  }
}
