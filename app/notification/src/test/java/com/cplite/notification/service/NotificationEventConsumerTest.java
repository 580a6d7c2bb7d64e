/*
 * Where: NotificationEventConsumer unit test
 * What: outcome counting and the classification that drives ack, nak and term
 * Why: a failed claim rollback must surface as an operator alert and a redelivery
 */
package com.cplite.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.event.NotificationEventType;
import com.cplite.common.messaging.EventPermanentException;
import com.cplite.notification.model.ConsumeOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.TransactionSystemException;

@ExtendWith(MockitoExtension.class)
class NotificationEventConsumerTest {

  private static final NotificationEvent EVENT =
      new NotificationEvent(
          "task-assigned:42:user-1",
          NotificationEventType.TASK_ASSIGNED,
          "user-1",
          new ObjectMapper().createObjectNode().put("task_id", "42").put("title", "Two Sum"),
          Instant.parse("2026-03-02T03:00:00Z"));

  @Mock private NotificationEventHandler eventHandler;

  private SimpleMeterRegistry meterRegistry;
  private NotificationEventConsumer consumer;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    consumer = new NotificationEventConsumer(eventHandler, new NotificationMetrics(meterRegistry));
  }

  @Test
  void persistedAndDuplicateAreAcknowledged() {
    when(eventHandler.handle(EVENT)).thenReturn(ConsumeOutcome.PERSISTED, ConsumeOutcome.DUPLICATE);

    assertThatCode(() -> consumer.handle(EVENT)).doesNotThrowAnyException();
    assertThatCode(() -> consumer.handle(EVENT)).doesNotThrowAnyException();

    assertThat(eventCount("persisted")).isEqualTo(1.0);
    assertThat(eventCount("duplicate")).isEqualTo(1.0);
  }

  @Test
  void permanentFailureIsRethrownForTermination() {
    when(eventHandler.handle(EVENT))
        .thenThrow(new NotificationEventPermanentException("title is required"));

    assertThatThrownBy(() -> consumer.handle(EVENT)).isInstanceOf(EventPermanentException.class);
    assertThat(eventCount("rejected")).isEqualTo(1.0);
  }

  @Test
  void transientFailureIsRethrownForRedelivery() {
    final DataAccessResourceFailureException failure =
        new DataAccessResourceFailureException("connection reset");
    when(eventHandler.handle(EVENT)).thenThrow(failure);

    assertThatThrownBy(() -> consumer.handle(EVENT)).isSameAs(failure);
    assertThat(eventCount("failed")).isEqualTo(1.0);
  }

  @Test
  void rollbackFailureRaisesAlertAndIsNotPermanent() {
    final TransactionSystemException rollbackFailure =
        new TransactionSystemException("rollback failed");
    rollbackFailure.initApplicationException(
        new DataAccessResourceFailureException("insert failed"));
    when(eventHandler.handle(EVENT)).thenThrow(rollbackFailure);

    assertThatThrownBy(() -> consumer.handle(EVENT))
        .isInstanceOf(ClaimRollbackFailedException.class)
        .isNotInstanceOf(EventPermanentException.class)
        .hasCause(rollbackFailure);
    assertThat(
            meterRegistry.get("notification.claim.rollback.failure.total").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void commitFailureWithoutApplicationExceptionIsTransient() {
    final TransactionSystemException commitFailure =
        new TransactionSystemException("commit failed");
    when(eventHandler.handle(EVENT)).thenThrow(commitFailure);

    assertThatThrownBy(() -> consumer.handle(EVENT)).isSameAs(commitFailure);
    assertThat(
            meterRegistry.get("notification.claim.rollback.failure.total").counter().count())
        .isZero();
    assertThat(eventCount("failed")).isEqualTo(1.0);
  }

  private double eventCount(String result) {
    return meterRegistry.get("notification.events.total").tag("result", result).counter().count();
  }
}
