/*
 * Where: recommendation service configuration
 * What: job type and lease of the single job slot
 * Why: a crashed run must release the slot once its lease has passed
 */
package com.cplite.recommendation.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "recommendation.job")
@Validated
public record JobProperties(@NotBlank String jobType, @NotNull Duration lease) {

  public JobProperties {
    jobType = jobType == null || jobType.isBlank() ? "weekly-recommendation" : jobType;
    lease = lease == null ? Duration.ofHours(6) : lease;
  }

  @AssertTrue(message = "recommendation.job.lease must be positive")
  public boolean isLeasePositive() {
    return lease != null && !lease.isZero() && !lease.isNegative();
  }
}
