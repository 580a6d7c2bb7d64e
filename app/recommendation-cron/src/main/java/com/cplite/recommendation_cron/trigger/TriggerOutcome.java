package com.cplite.recommendation_cron.trigger;

/** Final result of one trigger invocation and the process exit code it maps to. */
public enum TriggerOutcome {
  COMPLETED(0),
  ALREADY_RUNNING(0),
  CONFLICT(0),
  STATUS_UNAVAILABLE(1),
  RETRIES_EXHAUSTED(1),
  INTERRUPTED(1);

  private final int exitCode;

  TriggerOutcome(int exitCode) {
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}
