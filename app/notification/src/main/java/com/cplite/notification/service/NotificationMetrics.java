/*
 * Where: notification service layer
 * What: consume outcomes, claim rollback failures and dead letters as Micrometer meters
 * Why: duplicates and dead letters are normal at low rates and only visible as trends
 */
package com.cplite.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  static final String RESULT_REJECTED = "rejected";
  static final String RESULT_FAILED = "failed";

  private static final String METRIC_EVENTS_TOTAL = "notification.events.total";
  private static final String METRIC_CLAIM_ROLLBACK_FAILURE_TOTAL =
      "notification.claim.rollback.failure.total";
  private static final String METRIC_DEAD_LETTER_TOTAL = "notification.dead_letter.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
  private final Counter claimRollbackFailureCounter;
  private final Counter deadLetterCounter;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.claimRollbackFailureCounter =
        Counter.builder(METRIC_CLAIM_ROLLBACK_FAILURE_TOTAL)
            .description("Claims whose rollback failed and may be orphaned")
            .register(meterRegistry);
    this.deadLetterCounter =
        Counter.builder(METRIC_DEAD_LETTER_TOTAL)
            .description("Events that exhausted max-deliver")
            .register(meterRegistry);
  }

  public void recordEvent(String result) {
    eventCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_EVENTS_TOTAL)
                    .description("Notification event consume outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordClaimRollbackFailure() {
    claimRollbackFailureCounter.increment();
  }

  public void recordDeadLetter() {
    deadLetterCounter.increment();
  }
}
