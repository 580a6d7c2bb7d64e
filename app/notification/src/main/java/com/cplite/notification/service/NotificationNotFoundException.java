package com.cplite.notification.service;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  private final UUID notificationId;

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found");
    this.notificationId = notificationId;
  }

  public UUID notificationId() {
    return notificationId;
  }
}
