/*
 * Where: recommendation service layer
 * What: another run owns the job slot
 * Why: the API answers 409 with the start time of the run that holds the slot
 */
package com.cplite.recommendation.service;

import java.time.Instant;

public class JobAlreadyRunningException extends RuntimeException {

  private final Instant startedAt;

  public JobAlreadyRunningException(Instant startedAt) {
    super("job already running");
    this.startedAt = startedAt;
  }

  public Instant startedAt() {
    return startedAt;
  }
}
