/*
 * Where: recommendation cron
 * What: status check, then bounded run-sync retries
 * Why: a tick that overlaps a running job must be a no-op, and a failing service must not be
 *      hammered forever
 */
package com.cplite.recommendation_cron.trigger;

import com.cplite.recommendation_cron.client.JobServiceIntegrationException;
import com.cplite.recommendation_cron.client.JobStatusSnapshot;
import com.cplite.recommendation_cron.client.RecommendationJobClient;
import com.cplite.recommendation_cron.client.RunSyncOutcome;
import com.cplite.recommendation_cron.config.JobTriggerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JobTrigger {

  private static final Logger logger = LoggerFactory.getLogger(JobTrigger.class);

  private final RecommendationJobClient client;
  private final JobTriggerProperties properties;
  private final Sleeper sleeper;

  public JobTrigger(
      RecommendationJobClient client, JobTriggerProperties properties, Sleeper sleeper) {
    this.client = client;
    this.properties = properties;
    this.sleeper = sleeper;
  }

  public TriggerOutcome trigger() {
    final JobStatusSnapshot status;
    try {
      status = client.getStatus();
    } catch (JobServiceIntegrationException ex) {
      // no retry: the service is unreachable or confused, the next tick tries again
      logger.error(
          "recommendation status check failed reason={} baseUrl={}",
          ex.reason(),
          properties.baseUrl(),
          ex);
      return TriggerOutcome.STATUS_UNAVAILABLE;
    }
    if (Boolean.TRUE.equals(status.running())) {
      logger.info("recommendation job already running startedAt={}, skipping", status.startedAt());
      return TriggerOutcome.ALREADY_RUNNING;
    }
    return runWithRetries();
  }

  private TriggerOutcome runWithRetries() {
    final int maxRetries = properties.maxRetries();
    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      logger.info("triggering recommendation job attempt={} maxRetries={}", attempt, maxRetries);
      try {
        final RunSyncOutcome outcome = client.runSync();
        if (outcome == RunSyncOutcome.CONFLICT) {
          logger.info("recommendation job started by another trigger attempt={}", attempt);
          return TriggerOutcome.CONFLICT;
        }
        logger.info("recommendation job completed attempt={}", attempt);
        return TriggerOutcome.COMPLETED;
      } catch (JobServiceIntegrationException ex) {
        logger.warn(
            "recommendation job attempt failed attempt={} reason={} message={}",
            attempt,
            ex.reason(),
            ex.getMessage());
      }
      if (attempt < maxRetries) {
        logger.info("retrying recommendation job in {}", properties.retryDelay());
        try {
          sleeper.sleep(properties.retryDelay());
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          logger.error("recommendation trigger interrupted while waiting attempt={}", attempt);
          return TriggerOutcome.INTERRUPTED;
        }
      }
    }
    logger.error("recommendation job failed after {} attempts", maxRetries);
    return TriggerOutcome.RETRIES_EXHAUSTED;
  }
}
