package com.cplite.notification.service;

import com.fasterxml.jackson.databind.JsonNode;

/** Field access on event payloads; a missing required field is a permanent failure. */
final class PayloadFields {

  private PayloadFields() {}

  static String requireField(JsonNode payload, String name) {
    final String value = optionalField(payload, name);
    if (value == null) {
      throw new NotificationEventPermanentException(name + " is required");
    }
    return value;
  }

  static String optionalField(JsonNode payload, String name) {
    final JsonNode node = payload.get(name);
    if (node == null || node.isNull() || !node.isValueNode()) {
      return null;
    }
    final String text = node.asText();
    return text.isBlank() ? null : text;
  }

  static long requireLong(JsonNode payload, String name) {
    final Long value = optionalLong(payload, name);
    if (value == null) {
      throw new NotificationEventPermanentException(name + " is required");
    }
    return value;
  }

  static Long optionalLong(JsonNode payload, String name) {
    final JsonNode node = payload.get(name);
    if (node == null || node.isNull() || !node.canConvertToLong()) {
      return null;
    }
    return node.asLong();
  }

  static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new NotificationEventPermanentException(name + " is required");
    }
    return value;
  }

  static JsonNode requireObject(JsonNode payload, String eventId) {
    if (payload == null || !payload.isObject()) {
      throw new NotificationEventPermanentException(
          "payload must be a JSON object eventId=" + eventId);
    }
    return payload;
  }
}
