/*
 * Where: recommendation service API
 * What: /status, /run-sync and /run endpoints of the weekly job
 * Why: the scheduled trigger client drives the job over HTTP
 */
package com.cplite.recommendation.api;

import com.cplite.recommendation.api.response.JobAcceptedResponse;
import com.cplite.recommendation.api.response.JobRunResponse;
import com.cplite.recommendation.api.response.JobStatusResponse;
import com.cplite.recommendation.model.JobRun;
import com.cplite.recommendation.service.JobStateMachine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class JobController {

  private final JobStateMachine jobStateMachine;

  @GetMapping("/status")
  public JobStatusResponse status() {
    return JobStatusResponse.from(jobStateMachine.getStatus());
  }

  @PostMapping("/run-sync")
  public JobRunResponse runSync() {
    return JobRunResponse.completed(jobStateMachine.runSync());
  }

  @PostMapping("/run")
  public ResponseEntity<JobAcceptedResponse> run() {
    final JobRun run = jobStateMachine.runAsync();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(JobAcceptedResponse.accepted(run.runId(), run.startedAt()));
  }
}
