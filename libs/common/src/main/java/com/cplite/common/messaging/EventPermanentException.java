/*
 * Where: shared messaging
 * What: signals an event that can never be processed
 * Why: the channel terminates such deliveries instead of redelivering them
 */
package com.cplite.common.messaging;

public class EventPermanentException extends RuntimeException {

  public EventPermanentException(String message) {
    super(message);
  }

  public EventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
