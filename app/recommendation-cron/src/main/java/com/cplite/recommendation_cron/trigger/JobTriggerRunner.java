package com.cplite.recommendation_cron.trigger;

import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs the trigger once at startup and reports its exit code to {@code SpringApplication.exit}. */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "job-trigger.run-on-startup", havingValue = "true", matchIfMissing = true)
public class JobTriggerRunner implements CommandLineRunner, ExitCodeGenerator {

  private final JobTrigger jobTrigger;
  private final AtomicReference<TriggerOutcome> outcome = new AtomicReference<>();

  @Override
  public void run(String... args) {
    outcome.set(jobTrigger.trigger());
  }

  @Override
  public int getExitCode() {
    final TriggerOutcome current = outcome.get();
    return current == null ? TriggerOutcome.STATUS_UNAVAILABLE.exitCode() : current.exitCode();
  }
}
