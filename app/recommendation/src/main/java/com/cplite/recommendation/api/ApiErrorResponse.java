/*
 * Where: recommendation service API
 * What: common error body
 * Why: callers tell a lost race (409) from a failed computation (500) by code
 */
package com.cplite.recommendation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** @param startedAt start of the run holding the slot, only set for JOB_ALREADY_RUNNING */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(ApiErrorCode code, String message, Instant startedAt) {

  public ApiErrorResponse(ApiErrorCode code, String message) {
    this(code, message, null);
  }
}
