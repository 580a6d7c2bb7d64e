/*
 * Where: recommendation service API
 * What: maps job exceptions to HTTP responses
 * Why: a failed run answers with a body, it never escapes as an unhandled error
 */
package com.cplite.recommendation.api;

import com.cplite.recommendation.service.JobAlreadyRunningException;
import com.cplite.recommendation.service.JobExecutionFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ResponseEntity<ApiErrorResponse> handleJobAlreadyRunning(JobAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            new ApiErrorResponse(ApiErrorCode.JOB_ALREADY_RUNNING, ex.getMessage(), ex.startedAt()));
  }

  @ExceptionHandler(JobExecutionFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleJobFailed(JobExecutionFailedException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.JOB_FAILED, ex.getMessage()));
  }
}
