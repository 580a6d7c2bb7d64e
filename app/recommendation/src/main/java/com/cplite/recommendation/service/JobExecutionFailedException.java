package com.cplite.recommendation.service;

import java.util.UUID;

/** The run acquired the slot but its computation failed; the slot is already released. */
public class JobExecutionFailedException extends RuntimeException {

  private final UUID runId;

  public JobExecutionFailedException(UUID runId, String message, Throwable cause) {
    super(message, cause);
    this.runId = runId;
  }

  public UUID runId() {
    return runId;
  }
}
