/*
 * Where: shared messaging
 * What: one JetStream push subscription with ack/nak/term mapping and graceful drain
 * Why: an event is acknowledged only after its handler unit completed
 */
package com.cplite.common.messaging;

import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JetStreamEventSubscription<T> implements EventSubscription {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamEventSubscription.class);

  private final Connection connection;
  private final EventCodec<T> codec;
  private final EventHandler<T> handler;
  private final String subject;
  private final Object gate = new Object();
  private boolean accepting = true;
  private int inFlight;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  JetStreamEventSubscription(
      Connection connection, EventCodec<T> codec, EventHandler<T> handler, String subject) {
    this.connection = connection;
    this.codec = codec;
    this.handler = handler;
    this.subject = subject;
  }

  void attach(Dispatcher dispatcher, JetStreamSubscription subscription) {
    synchronized (gate) {
      this.dispatcher = dispatcher;
      this.subscription = subscription;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    if (!enter()) {
      // closing: leave the event for redelivery to another instance
      nakSilently(message);
      return;
    }
    try {
      dispatch(message);
    } finally {
      exit();
    }
  }

  private void dispatch(Message message) {
    final T event;
    try {
      event = codec.decode(message.getData());
    } catch (EventPermanentException ex) {
      logger.warn("failed to decode event payload subject={}", subject, ex);
      termSilently(message);
      return;
    }
    try {
      handler.handle(event);
      message.ack();
    } catch (EventPermanentException ex) {
      logger.warn("permanent failure while handling event subject={}", subject, ex);
      termSilently(message);
    } catch (RuntimeException ex) {
      // unknown failures go back to the broker rather than risk losing the event
      logger.warn("failed to handle event subject={}", subject, ex);
      nakSilently(message);
    }
  }

  @Override
  public boolean isActive() {
    synchronized (gate) {
      return accepting && subscription != null;
    }
  }

  @Override
  public int inFlight() {
    synchronized (gate) {
      return inFlight;
    }
  }

  @Override
  public void close(Duration drainTimeout) {
    final JetStreamSubscription currentSubscription;
    final Dispatcher currentDispatcher;
    synchronized (gate) {
      if (!accepting) {
        return;
      }
      accepting = false;
      currentSubscription = subscription;
      currentDispatcher = dispatcher;
      subscription = null;
      dispatcher = null;
    }
    unsubscribe(currentDispatcher, currentSubscription);
    awaitInFlight(drainTimeout);
    if (currentDispatcher != null) {
      connection.closeDispatcher(currentDispatcher);
    }
    logger.info("event subscription closed subject={}", subject);
  }

  private void unsubscribe(
      Dispatcher currentDispatcher, JetStreamSubscription currentSubscription) {
    if (currentSubscription == null) {
      return;
    }
    try {
      // a dispatcher-owned subscription rejects a direct unsubscribe()
      if (currentDispatcher != null) {
        currentDispatcher.unsubscribe(currentSubscription);
      } else {
        currentSubscription.unsubscribe();
      }
    } catch (IllegalStateException ex) {
      // connection already closed; in-flight handlers still get their drain window
      logger.warn("failed to unsubscribe event subscription subject={}", subject, ex);
    }
  }

  private boolean enter() {
    synchronized (gate) {
      if (!accepting) {
        return false;
      }
      inFlight++;
      return true;
    }
  }

  private void exit() {
    synchronized (gate) {
      inFlight--;
      if (inFlight == 0) {
        gate.notifyAll();
      }
    }
  }

  private void awaitInFlight(Duration drainTimeout) {
    final long deadline = System.nanoTime() + drainTimeout.toNanos();
    synchronized (gate) {
      while (inFlight > 0) {
        final long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
          logger.warn(
              "event subscription drain timed out subject={} inFlight={}", subject, inFlight);
          return;
        }
        try {
          gate.wait(Math.max(1L, Duration.ofNanos(remainingNanos).toMillis()));
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          logger.warn("event subscription drain interrupted subject={}", subject);
          return;
        }
      }
    }
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nak event message subject={}", subject, ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term event message subject={}", subject, ex);
    }
  }
}
