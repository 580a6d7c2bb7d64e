/*
 * Where: notification service infrastructure
 * What: NATS connection plus the event and max-deliveries advisory channels
 * Why: both subscribers reuse one connection managed by Spring
 */
package com.cplite.notification.config;

import com.cplite.common.event.NotificationEvent;
import com.cplite.common.messaging.JacksonEventCodec;
import com.cplite.common.messaging.JetStreamEventChannel;
import com.cplite.notification.nats.MaxDeliverAdvisory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStreamEventChannel<NotificationEvent> notificationEventChannel(
      Connection connection, NotificationNatsProperties properties, ObjectMapper objectMapper) {
    return new JetStreamEventChannel<>(
        connection,
        properties.toChannelSettings(),
        new JacksonEventCodec<>(objectMapper, NotificationEvent.class, NotificationEvent::eventId));
  }

  @Bean
  public JetStreamEventChannel<MaxDeliverAdvisory> maxDeliverAdvisoryChannel(
      Connection connection,
      NotificationNatsProperties eventProperties,
      NotificationNatsAdvisoryProperties advisoryProperties,
      ObjectMapper objectMapper) {
    return new JetStreamEventChannel<>(
        connection,
        advisoryProperties.toChannelSettings(eventProperties),
        new JacksonEventCodec<>(objectMapper, MaxDeliverAdvisory.class, MaxDeliverAdvisory::id));
  }
}
