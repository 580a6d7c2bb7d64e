package com.cplite.common.messaging;

/**
 * Broker acknowledgement of a persisted event.
 *
 * @param duplicate true when the broker recognised the message id inside its duplicate window and
 *     did not store the event again
 */
public record PublishReceipt(String stream, long sequence, boolean duplicate) {}
