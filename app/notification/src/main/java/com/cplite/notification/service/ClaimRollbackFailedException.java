/*
 * Where: notification service layer
 * What: the rollback that should have removed an event claim failed itself
 * Why: processed_events may now hold a claim without a notification and an operator must look
 */
package com.cplite.notification.service;

public class ClaimRollbackFailedException extends RuntimeException {

  private final String eventId;

  public ClaimRollbackFailedException(String eventId, Throwable cause) {
    super("claim rollback failed eventId=" + eventId, cause);
    this.eventId = eventId;
  }

  public String eventId() {
    return eventId;
  }
}
