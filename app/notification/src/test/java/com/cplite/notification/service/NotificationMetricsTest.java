package com.cplite.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  @Test
  void countersAreRegisteredPerResultTag() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordEvent("persisted");
    metrics.recordEvent("persisted");
    metrics.recordEvent("duplicate");
    metrics.recordDeadLetter();

    assertThat(eventCount(registry, "persisted"))
        .isEqualTo(2.0d);
    assertThat(eventCount(registry, "duplicate"))
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.dead_letter.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.claim.rollback.failure.total").counter().count())
        .isZero();
  }

  private double eventCount(SimpleMeterRegistry registry, String result) {
    return registry.get("notification.events.total").tag("result", result).counter().count();
  }
}
