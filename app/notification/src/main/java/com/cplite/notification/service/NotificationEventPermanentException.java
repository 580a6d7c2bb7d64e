/*
 * Where: notification service layer
 * What: an event that can never become a notification (missing or malformed fields)
 * Why: redelivering it would fail the same way, so the channel terminates it
 */
package com.cplite.notification.service;

import com.cplite.common.messaging.EventPermanentException;

public class NotificationEventPermanentException extends EventPermanentException {

  public NotificationEventPermanentException(String message) {
    super(message);
  }

  public NotificationEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
