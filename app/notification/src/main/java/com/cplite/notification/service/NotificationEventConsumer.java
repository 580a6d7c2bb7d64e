/*
 * Where: notification service layer
 * What: channel callback that runs claim-and-write and classifies its failures
 * Why: the channel decides ack/nak/term from what this callback throws
 */
package com.cplite.notification.service;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.messaging.EventHandler;
import com.cplite.common.messaging.EventPermanentException;
import com.cplite.notification.model.ConsumeOutcome;
import lombok.RequiredArgsConstructor;
import net.logstash.logback.marker.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionSystemException;

/**
 * Returns normally for persisted and duplicate events. Rethrows permanent failures so the
 * delivery is terminated, and everything else so it is redelivered.
 */
@Component
@RequiredArgsConstructor
public class NotificationEventConsumer implements EventHandler<NotificationEvent> {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventConsumer.class);
  static final String OPERATOR_ALERT = "operator_alert";

  private final NotificationEventHandler eventHandler;
  private final NotificationMetrics metrics;

  @Override
  public void handle(NotificationEvent event) {
    final String eventId = event == null ? null : event.eventId();
    try {
      final ConsumeOutcome outcome = eventHandler.handle(event);
      metrics.recordEvent(outcome.metricTag());
      if (outcome == ConsumeOutcome.DUPLICATE) {
        logger.debug("duplicate notification event skipped eventId={}", eventId);
      } else {
        logger.info(
            "notification persisted eventId={} type={}", eventId, event.eventType().wireName());
      }
    } catch (EventPermanentException ex) {
      metrics.recordEvent(NotificationMetrics.RESULT_REJECTED);
      logger.warn("notification event rejected eventId={} reason={}", eventId, ex.getMessage());
      throw ex;
    } catch (TransactionSystemException ex) {
      if (ex.getApplicationException() == null) {
        // commit failure, nothing was written
        metrics.recordEvent(NotificationMetrics.RESULT_FAILED);
        throw ex;
      }
      metrics.recordClaimRollbackFailure();
      logger.error(
          Markers.append(OPERATOR_ALERT, true),
          "claim rollback failed, processed_events may hold an orphan claim eventId={} cause={}",
          eventId,
          ex.getApplicationException().getMessage(),
          ex);
      throw new ClaimRollbackFailedException(eventId, ex);
    } catch (RuntimeException ex) {
      metrics.recordEvent(NotificationMetrics.RESULT_FAILED);
      logger.warn("notification event failed, will be redelivered eventId={}", eventId, ex);
      throw ex;
    }
  }
}
