/*
 * Where: shared messaging
 * What: JSON codec for channel events backed by Jackson
 * Why: events stay readable on the wire and in broker tooling
 */
package com.cplite.common.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Objects;
import java.util.function.Function;

public class JacksonEventCodec<T> implements EventCodec<T> {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  private final ObjectMapper objectMapper;

  private final Class<T> eventClass;
  private final Function<T, String> messageIdExtractor;

  public JacksonEventCodec(
      ObjectMapper objectMapper, Class<T> eventClass, Function<T, String> messageIdExtractor) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.eventClass = Objects.requireNonNull(eventClass, "eventClass");
    this.messageIdExtractor = Objects.requireNonNull(messageIdExtractor, "messageIdExtractor");
  }

  @Override
  public byte[] encode(T event) {
    try {
      return objectMapper.writeValueAsBytes(event);
    } catch (JsonProcessingException ex) {
      // a serialization failure is a programming error, retrying cannot help
      throw new EventPermanentException("event serialization failure", ex);
    }
  }

  @Override
  public T decode(byte[] data) {
    if (data == null || data.length == 0) {
      throw new EventPermanentException("event payload is empty");
    }
    try {
      return objectMapper.readValue(data, eventClass);
    } catch (IOException ex) {
      throw new EventPermanentException("event payload decode failure", ex);
    }
  }

  @Override
  public String messageId(T event) {
    final String messageId = messageIdExtractor.apply(event);
    if (messageId == null || messageId.isBlank()) {
      throw new IllegalArgumentException("event message id is required");
    }
    return messageId;
  }
}
