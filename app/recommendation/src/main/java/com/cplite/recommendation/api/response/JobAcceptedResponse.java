package com.cplite.recommendation.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobAcceptedResponse(String status, UUID runId, Instant startedAt) {

  public static JobAcceptedResponse accepted(UUID runId, Instant startedAt) {
    return new JobAcceptedResponse("accepted", runId, startedAt);
  }
}
