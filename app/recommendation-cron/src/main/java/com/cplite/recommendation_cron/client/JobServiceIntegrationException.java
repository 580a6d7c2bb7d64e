/*
 * Where: recommendation cron client
 * What: failed call to the recommendation service
 * Why: the trigger decides fatal versus retry from the reason, not from exception types
 */
package com.cplite.recommendation_cron.client;

public class JobServiceIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    CONNECTION_FAILED,
    UNEXPECTED_STATUS,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public JobServiceIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public JobServiceIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
