package com.cplite.recommendation_cron.trigger;

import java.time.Duration;

/** Waits between retries. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;
}
