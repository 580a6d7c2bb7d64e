/*
 * Where: notification NATS subscription
 * What: subscribes the notification consumer to the event channel for the bean's lifetime
 * Why: shutdown must drain in-flight handlers before the connection closes
 */
package com.cplite.notification.nats;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.messaging.EventChannel;
import com.cplite.common.messaging.EventSubscription;
import com.cplite.notification.config.NotificationNatsProperties;
import com.cplite.notification.service.NotificationEventConsumer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NotificationEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(NotificationEventSubscriber.class);

  private final EventChannel<NotificationEvent> notificationEventChannel;
  private final NotificationEventConsumer consumer;
  private final NotificationNatsProperties properties;
  private final AtomicReference<EventSubscription> subscription = new AtomicReference<>();

  public NotificationEventSubscriber(
      EventChannel<NotificationEvent> notificationEventChannel,
      NotificationEventConsumer consumer,
      NotificationNatsProperties properties) {
    this.notificationEventChannel = notificationEventChannel;
    this.consumer = consumer;
    this.properties = properties;
  }

  @PostConstruct
  public void start() {
    if (subscription.get() != null) {
      return;
    }
    subscription.set(notificationEventChannel.subscribe(consumer));
    logger.info(
        "notification subscriber started subject={} durable={} ackWait={} maxDeliver={}",
        properties.subject(),
        properties.durable(),
        properties.ackWait(),
        properties.maxDeliver());
  }

  @PreDestroy
  public void stop() {
    final EventSubscription current = subscription.getAndSet(null);
    if (current == null) {
      return;
    }
    current.close(properties.shutdownTimeout());
    logger.info("notification subscriber stopped inFlight={}", current.inFlight());
  }
}
