package com.cplite.recommendation_cron.client;

/** Successful answers of POST /run-sync. Anything else surfaces as an exception. */
public enum RunSyncOutcome {
  COMPLETED,
  CONFLICT
}
