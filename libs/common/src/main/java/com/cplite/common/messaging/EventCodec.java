package com.cplite.common.messaging;

/** Converts events to and from wire bytes and names the broker-level message id. */
public interface EventCodec<T> {

  byte[] encode(T event);

  /**
   * @throws EventPermanentException when the bytes can never be decoded
   */
  T decode(byte[] data);

  String messageId(T event);
}
