package com.cplite.notification.api.response;

import com.cplite.notification.model.NotificationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID notificationId,
    String userId,
    String eventType,
    String content,
    String relatedType,
    String relatedId,
    Instant createdAt,
    @JsonProperty("is_read") boolean read) {

  public static NotificationResponse from(NotificationRecord record) {
    return new NotificationResponse(
        record.notificationId(),
        record.userId(),
        record.eventType(),
        record.content(),
        record.relatedType(),
        record.relatedId(),
        record.createdAt(),
        record.read());
  }
}
