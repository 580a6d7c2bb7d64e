package com.cplite.recommendation.api.response;

import com.cplite.recommendation.model.JobRunReport;
import com.cplite.recommendation.model.JobRunResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunResponse(
    String status, UUID runId, Instant startedAt, Instant finishedAt, JobRunResult result) {

  public static final String STATUS_COMPLETED = "completed";

  public static JobRunResponse completed(JobRunReport report) {
    return new JobRunResponse(
        STATUS_COMPLETED, report.runId(), report.startedAt(), report.finishedAt(), report.result());
  }
}
