package com.cplite.recommendation.model;

/** Status of the job slot. Only IDLE can be acquired. */
public enum JobStatus {
  IDLE,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
