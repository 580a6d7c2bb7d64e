/*
 * Where: shared messaging
 * What: durable hand-off of events between producers and consumers
 * Why: one contract for every service instead of a per-service copy of the broker plumbing
 */
package com.cplite.common.messaging;

/**
 * A durable, at-least-once event channel.
 *
 * <p>{@link #publish} returns once the broker has persisted the event; that means "delivered",
 * not "processed". {@link #subscribe} hands every event to the handler at least once and
 * redelivers when the handler does not complete. Ordering holds per producer connection only.
 *
 * @param <T> event type carried by the channel
 */
public interface EventChannel<T> {

  /**
   * Publishes an event and waits for the broker acknowledgement.
   *
   * @throws EventPublishException when the broker did not acknowledge persistence
   */
  PublishReceipt publish(T event);

  /** Starts delivering events to {@code handler}; the handler must be idempotent. */
  EventSubscription subscribe(EventHandler<T> handler);
}
