/*
 * Where: recommendation service layer
 * What: IDLE -> RUNNING -> COMPLETED|FAILED -> IDLE lifecycle of the weekly recommendation job
 * Why: overlapping triggers must resolve to one run and a failed run must never wedge the slot
 */
package com.cplite.recommendation.service;

import com.cplite.recommendation.config.JobProperties;
import com.cplite.recommendation.model.JobRun;
import com.cplite.recommendation.model.JobRunReport;
import com.cplite.recommendation.model.JobRunResult;
import com.cplite.recommendation.model.JobSlot;
import com.cplite.recommendation.model.JobStatus;
import com.cplite.recommendation.model.JobStatusView;
import com.cplite.recommendation.model.UserRecommendation;
import com.cplite.recommendation.repository.JobSlotRepository;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Service
public class JobStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(JobStateMachine.class);
  private static final int MAX_ERROR_LENGTH = 1000;
  private static final int RELEASE_ATTEMPTS = 2;

  private final JobSlotRepository jobSlotRepository;
  private final RecommendationComputation computation;
  private final RecommendationEventPublisher eventPublisher;
  private final JobMetrics metrics;
  private final JobProperties properties;
  private final TaskExecutor taskExecutor;
  private final Clock clock;

  public JobStateMachine(
      JobSlotRepository jobSlotRepository,
      RecommendationComputation computation,
      RecommendationEventPublisher eventPublisher,
      JobMetrics metrics,
      JobProperties properties,
      TaskExecutor taskExecutor,
      Clock clock) {
    this.jobSlotRepository = jobSlotRepository;
    this.computation = computation;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.properties = properties;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
  }

  @PostConstruct
  void initializeSlot() {
    if (jobSlotRepository.ensureSlot(properties.jobType())) {
      logger.info("job slot created jobType={}", properties.jobType());
    }
  }

  public JobStatusView getStatus() {
    final Instant now = Instant.now(clock);
    final JobSlot slot =
        jobSlotRepository
            .find(properties.jobType())
            .orElseThrow(
                () -> new IllegalStateException("job slot is missing " + properties.jobType()));
    return new JobStatusView(
        slot.isRunning(now),
        slot.runId(),
        slot.status().isTerminal() ? slot.status() : slot.lastOutcome(),
        slot.startedAt(),
        slot.finishedAt(),
        slot.lastError());
  }

  /**
   * Acquires the slot and runs the computation on the calling thread.
   *
   * @throws JobAlreadyRunningException when another run holds the slot
   * @throws JobExecutionFailedException when the computation failed; the slot is released
   */
  public JobRunReport runSync() {
    final JobRun run = acquire();
    return execute(run);
  }

  /** Acquires the slot on the calling thread and runs the computation on the task executor. */
  public JobRun runAsync() {
    final JobRun run = acquire();
    try {
      taskExecutor.execute(() -> executeDetached(run));
    } catch (TaskRejectedException ex) {
      logger.error("job run rejected by executor runId={}", run.runId(), ex);
      finishAndRelease(run, JobStatus.FAILED, "rejected by executor");
      metrics.recordRun(JobMetrics.RESULT_FAILED);
      throw new JobExecutionFailedException(run.runId(), "job could not be scheduled", ex);
    }
    return run;
  }

  private JobRun acquire() {
    final String jobType = properties.jobType();
    final Instant now = Instant.now(clock);
    if (jobSlotRepository.recoverExpired(jobType, now)) {
      logger.warn("job slot lease expired, slot recovered jobType={}", jobType);
    }
    final UUID runId = UUID.randomUUID();
    if (!jobSlotRepository.tryAcquire(jobType, runId, now, now.plus(properties.lease()))) {
      metrics.recordRun(JobMetrics.RESULT_CONFLICT);
      final Instant startedAt =
          jobSlotRepository.find(jobType).map(JobSlot::startedAt).orElse(null);
      logger.info("job already running jobType={} startedAt={}", jobType, startedAt);
      throw new JobAlreadyRunningException(startedAt);
    }
    logger.info("job started jobType={} runId={}", jobType, runId);
    return new JobRun(runId, now);
  }

  private JobRunReport execute(JobRun run) {
    final JobRunResult result;
    try {
      result = computeAndPublish(run);
    } catch (RuntimeException ex) {
      final String error = describe(ex);
      logger.error("job failed runId={} error={}", run.runId(), error, ex);
      final Instant finishedAt = finishAndRelease(run, JobStatus.FAILED, error);
      metrics.recordRun(JobMetrics.RESULT_FAILED);
      metrics.recordDuration(Duration.between(run.startedAt(), finishedAt));
      throw new JobExecutionFailedException(run.runId(), error, ex);
    }
    final Instant finishedAt = finishAndRelease(run, JobStatus.COMPLETED, null);
    metrics.recordRun(JobMetrics.RESULT_COMPLETED);
    metrics.recordDuration(Duration.between(run.startedAt(), finishedAt));
    logger.info(
        "job completed runId={} recommendations={} eventsPublished={} eventsFailed={}",
        run.runId(),
        result.recommendationCount(),
        result.eventsPublished(),
        result.eventsFailed());
    return new JobRunReport(run.runId(), run.startedAt(), finishedAt, result);
  }

  private void executeDetached(JobRun run) {
    try {
      execute(run);
    } catch (JobExecutionFailedException ex) {
      // already logged and recorded on the slot
      logger.debug("detached job run ended with failure runId={}", ex.runId());
    }
  }

  private JobRunResult computeAndPublish(JobRun run) {
    final List<UserRecommendation> recommendations = computation.compute();
    final LocalDate day = LocalDate.ofInstant(run.startedAt(), ZoneOffset.UTC);
    int published = 0;
    int failed = 0;
    for (UserRecommendation recommendation : recommendations) {
      try {
        eventPublisher.publishTaskOfDay(day, recommendation);
        published++;
      } catch (RuntimeException ex) {
        failed++;
        metrics.recordPublishFailure();
        logger.warn(
            "task of day publish failed runId={} userId={} taskId={}",
            run.runId(),
            recommendation.userId(),
            recommendation.taskId(),
            ex);
      }
    }
    final int users =
        (int) recommendations.stream().map(UserRecommendation::userId).distinct().count();
    return new JobRunResult(recommendations.size(), users, published, failed);
  }

  private Instant finishAndRelease(JobRun run, JobStatus outcome, String error) {
    final Instant finishedAt = Instant.now(clock);
    for (int attempt = 1; attempt <= RELEASE_ATTEMPTS; attempt++) {
      try {
        if (!jobSlotRepository.complete(
            properties.jobType(), run.runId(), outcome, finishedAt, error)) {
          logger.warn("job slot no longer owned by run runId={} outcome={}", run.runId(), outcome);
        }
        return finishedAt;
      } catch (DataAccessException ex) {
        if (attempt == RELEASE_ATTEMPTS) {
          // the row stays RUNNING; recoverExpired frees it once the lease passes
          logger.error(
              "job slot release failed runId={} outcome={} recoveryAfter={}",
              run.runId(),
              outcome,
              run.startedAt().plus(properties.lease()),
              ex);
          metrics.recordReleaseFailure();
        } else {
          logger.warn(
              "job slot release failed, retrying runId={} attempt={}", run.runId(), attempt);
        }
      }
    }
    return finishedAt;
  }

  private String describe(RuntimeException ex) {
    final String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
  }
}
