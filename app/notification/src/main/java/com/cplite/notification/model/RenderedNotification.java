package com.cplite.notification.model;

/** User-facing text of an event together with the object it points at. */
public record RenderedNotification(
    String userId, String content, String relatedType, String relatedId) {}
