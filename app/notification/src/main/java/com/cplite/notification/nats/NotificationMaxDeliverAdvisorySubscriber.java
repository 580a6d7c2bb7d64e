/*
 * Where: notification NATS subscription
 * What: records events that exhausted max-deliver from the JetStream advisory
 * Why: JetStream stops redelivering them silently; the stream sequence is kept for replay
 */
package com.cplite.notification.nats;

import com.cplite.common.messaging.EventChannel;
import com.cplite.common.messaging.EventPermanentException;
import com.cplite.common.messaging.EventSubscription;
import com.cplite.notification.config.NotificationNatsProperties;
import com.cplite.notification.repository.DeadLetterRepository;
import com.cplite.notification.service.NotificationMetrics;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationMaxDeliverAdvisorySubscriber {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationMaxDeliverAdvisorySubscriber.class);

  private final EventChannel<MaxDeliverAdvisory> maxDeliverAdvisoryChannel;
  private final DeadLetterRepository deadLetterRepository;
  private final NotificationMetrics metrics;
  private final NotificationNatsProperties natsProperties;
  private final Clock clock;
  private final AtomicReference<EventSubscription> subscription = new AtomicReference<>();

  public NotificationMaxDeliverAdvisorySubscriber(
      EventChannel<MaxDeliverAdvisory> maxDeliverAdvisoryChannel,
      DeadLetterRepository deadLetterRepository,
      NotificationMetrics metrics,
      NotificationNatsProperties natsProperties,
      Clock clock) {
    this.maxDeliverAdvisoryChannel = maxDeliverAdvisoryChannel;
    this.deadLetterRepository = deadLetterRepository;
    this.metrics = metrics;
    this.natsProperties = natsProperties;
    this.clock = clock;
  }

  @PostConstruct
  public void start() {
    if (subscription.get() != null) {
      return;
    }
    subscription.set(maxDeliverAdvisoryChannel.subscribe(this::handleAdvisory));
    logger.info(
        "max-deliver advisory subscriber started eventStream={}", natsProperties.stream());
  }

  @PreDestroy
  public void stop() {
    final EventSubscription current = subscription.getAndSet(null);
    if (current != null) {
      current.close(natsProperties.shutdownTimeout());
    }
  }

  /**
   * A DataAccessException escapes so the advisory is redelivered; an advisory without a stream
   * sequence can never be recorded and is terminated.
   */
  @VisibleForTesting
  void handleAdvisory(MaxDeliverAdvisory advisory) {
    if (advisory.streamSeq() == null || advisory.streamSeq() <= 0) {
      throw new EventPermanentException(
          "max-deliver advisory without stream_seq id=" + advisory.id());
    }
    if (!deadLetterRepository.insert(advisory.streamSeq(), Instant.now(clock))) {
      logger.debug("dead letter already recorded streamSeq={}", advisory.streamSeq());
      return;
    }
    metrics.recordDeadLetter();
    logger.error(
        "notification event exhausted max-deliver streamSeq={} stream={} consumer={} deliveries={}",
        advisory.streamSeq(),
        advisory.stream(),
        advisory.consumer(),
        advisory.deliveries());
  }
}
