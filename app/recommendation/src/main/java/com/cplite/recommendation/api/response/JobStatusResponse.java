package com.cplite.recommendation.api.response;

import com.cplite.recommendation.model.JobStatusView;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusResponse(
    @JsonProperty("is_running") boolean running,
    UUID runId,
    String lastResult,
    Instant startedAt,
    Instant finishedAt,
    String lastError) {

  public static JobStatusResponse from(JobStatusView view) {
    return new JobStatusResponse(
        view.running(),
        view.runId(),
        view.lastOutcome() == null ? null : view.lastOutcome().name().toLowerCase(Locale.ROOT),
        view.startedAt(),
        view.finishedAt(),
        view.lastError());
  }
}
