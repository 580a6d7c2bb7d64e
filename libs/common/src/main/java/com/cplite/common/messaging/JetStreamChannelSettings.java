/*
 * Where: shared messaging
 * What: subject / stream / durable consumer settings of one JetStream channel
 * Why: publisher and subscriber of a channel must agree on the same stream definition
 */
package com.cplite.common.messaging;

import java.time.Duration;

public record JetStreamChannelSettings(
    String subject,
    String stream,
    String durable,
    Duration duplicateWindow,
    Duration ackWait,
    int maxDeliver) {

  private static final Duration PUBLISHER_ACK_WAIT = Duration.ofSeconds(30);

  public JetStreamChannelSettings {
    requireText(subject, "subject");
    requireText(stream, "stream");
    requirePositive(duplicateWindow, "duplicateWindow");
    requirePositive(ackWait, "ackWait");
    if (maxDeliver <= 0) {
      throw new IllegalArgumentException("maxDeliver must be positive");
    }
  }

  /** Settings for a channel that only publishes; it cannot be subscribed to. */
  public static JetStreamChannelSettings forPublisher(
      String subject, String stream, Duration duplicateWindow) {
    return new JetStreamChannelSettings(
        subject, stream, null, duplicateWindow, PUBLISHER_ACK_WAIT, 1);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
