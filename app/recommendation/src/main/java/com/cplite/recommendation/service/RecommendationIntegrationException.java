/*
 * Where: recommendation service layer
 * What: failure of a call to the recommendation engine
 * Why: the job records a short, categorised last_error instead of a raw client exception
 */
package com.cplite.recommendation.service;

public class RecommendationIntegrationException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public RecommendationIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RecommendationIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
