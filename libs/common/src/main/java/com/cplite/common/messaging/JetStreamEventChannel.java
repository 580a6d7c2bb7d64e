/*
 * Where: shared messaging
 * What: EventChannel on top of NATS JetStream (durable stream, explicit-ack push consumer)
 * Why: producers get a persisted puback and consumers get at-least-once redelivery
 */
package com.cplite.common.messaging;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.PublishAck;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JetStreamEventChannel<T> implements EventChannel<T> {

  private static final Logger logger = LoggerFactory.getLogger(JetStreamEventChannel.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Connection is a shared Spring-managed component")
  private final Connection connection;

  private final JetStreamChannelSettings settings;
  private final EventCodec<T> codec;
  private final AtomicBoolean streamEnsured = new AtomicBoolean(false);

  public JetStreamEventChannel(
      Connection connection, JetStreamChannelSettings settings, EventCodec<T> codec) {
    this.connection = connection;
    this.settings = settings;
    this.codec = codec;
  }

  /** Creates or updates the backing stream once per channel instance. */
  public void ensureStream() {
    if (streamEnsured.get()) {
      return;
    }
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(settings.stream())
            .subjects(settings.subject())
            .duplicateWindow(settings.duplicateWindow())
            .build();
    try {
      JetStreamStreams.upsert(connection.jetStreamManagement(), streamConfiguration);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
    streamEnsured.set(true);
    logger.info(
        "event stream ensured stream={} subject={} duplicateWindow={}",
        settings.stream(),
        settings.subject(),
        settings.duplicateWindow());
  }

  @Override
  public PublishReceipt publish(T event) {
    ensureStream();
    final String messageId = codec.messageId(event);
    final Headers headers = new Headers();
    // the stream drops a second publish with the same id inside the duplicate window
    headers.add(HEADER_MESSAGE_ID, messageId);
    final PublishAck ack;
    try {
      ack = connection.jetStream().publish(settings.subject(), headers, codec.encode(event));
    } catch (IOException | JetStreamApiException ex) {
      throw new EventPublishException(
          "failed to publish event subject=" + settings.subject() + " messageId=" + messageId, ex);
    }
    if (ack == null) {
      throw new EventPublishException("puback is missing messageId=" + messageId);
    }
    if (ack.isDuplicate()) {
      logger.info(
          "event publish deduplicated by stream messageId={} stream={}", messageId, ack.getStream());
    }
    return new PublishReceipt(ack.getStream(), ack.getSeqno(), ack.isDuplicate());
  }

  @Override
  public EventSubscription subscribe(EventHandler<T> handler) {
    requireDurable();
    ensureStream();
    final JetStreamEventSubscription<T> subscription =
        new JetStreamEventSubscription<>(connection, codec, handler, settings.subject());
    try {
      final Dispatcher dispatcher = connection.createDispatcher();
      final JetStreamSubscription jetStreamSubscription =
          connection
              .jetStream()
              .subscribe(
                  settings.subject(),
                  dispatcher,
                  subscription::handleMessage,
                  false,
                  buildPushSubscribeOptions());
      subscription.attach(dispatcher, jetStreamSubscription);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
    logger.info(
        "event subscription started subject={} stream={} durable={}",
        settings.subject(),
        settings.stream(),
        settings.durable());
    return subscription;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(settings.ackWait())
            .maxDeliver(settings.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(settings.stream())
        .durable(settings.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void requireDurable() {
    if (settings.durable() == null || settings.durable().isBlank()) {
      throw new IllegalStateException("a durable consumer name is required to subscribe");
    }
  }
}
