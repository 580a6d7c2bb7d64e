package com.cplite.recommendation_cron.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobTriggerRunnerTest {

  @Mock private JobTrigger jobTrigger;

  @Test
  void exitCodeFollowsTriggerOutcome() {
    when(jobTrigger.trigger()).thenReturn(TriggerOutcome.RETRIES_EXHAUSTED);
    final JobTriggerRunner runner = new JobTriggerRunner(jobTrigger);

    runner.run();

    assertThat(runner.getExitCode()).isEqualTo(1);
  }

  @Test
  void conflictExitsZero() {
    when(jobTrigger.trigger()).thenReturn(TriggerOutcome.CONFLICT);
    final JobTriggerRunner runner = new JobTriggerRunner(jobTrigger);

    runner.run();

    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  void exitCodeIsFailureWhenTriggerNeverRan() {
    assertThat(new JobTriggerRunner(jobTrigger).getExitCode()).isEqualTo(1);
  }
}
