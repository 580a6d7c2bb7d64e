package com.cplite.recommendation.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class JobMetrics {

  static final String RESULT_COMPLETED = "completed";
  static final String RESULT_FAILED = "failed";
  static final String RESULT_CONFLICT = "conflict";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final Timer durationTimer;
  private final Counter publishFailureCounter;
  private final Counter releaseFailureCounter;

  public JobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.durationTimer =
        Timer.builder("recommendation.job.duration")
            .description("Duration of recommendation runs that acquired the job slot")
            .register(meterRegistry);
    this.publishFailureCounter =
        Counter.builder("recommendation.events.publish.failure.total")
            .description("TaskOfDay events that could not be published")
            .register(meterRegistry);
    this.releaseFailureCounter =
        Counter.builder("recommendation.job.release.failure.total")
            .description("Runs whose job slot could only be freed by lease expiry")
            .register(meterRegistry);
  }

  public void recordRun(String result) {
    runCounters.computeIfAbsent(result, this::registerRunCounter).increment();
  }

  public void recordDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    durationTimer.record(duration);
  }

  public void recordPublishFailure() {
    publishFailureCounter.increment();
  }

  public void recordReleaseFailure() {
    releaseFailureCounter.increment();
  }

  private Counter registerRunCounter(String result) {
    return Counter.builder("recommendation.job.runs.total")
        .description("Recommendation job trigger outcomes")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }
}
