package com.cplite.common.messaging;

/**
 * Callback for a delivered event.
 *
 * <p>Returning normally acknowledges the delivery. Throwing {@link EventPermanentException}
 * drops it for good; any other exception asks for redelivery.
 */
@FunctionalInterface
public interface EventHandler<T> {

  void handle(T event);
}
