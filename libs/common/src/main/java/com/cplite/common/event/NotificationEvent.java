/*
 * Where: shared event contract
 * What: envelope of a notification event on the event channel
 * Why: event_id is the idempotency key the notification consumer deduplicates on
 */
package com.cplite.common.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * @param userId target user; {@link #SYSTEM_USER_ID} addresses every user. A numeric JSON value
 *     is accepted and kept as text.
 * @param payload type specific fields, see {@link NotificationEventPublisher}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEvent(
    String eventId,
    NotificationEventType eventType,
    String userId,
    JsonNode payload,
    Instant publishedAt) {

  public static final String SYSTEM_USER_ID = "system";
}
