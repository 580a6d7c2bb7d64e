package com.cplite.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** @param streamSequences event stream sequences that exhausted their deliveries, ascending */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadLetterListResponse(List<Long> streamSequences) {

  public DeadLetterListResponse {
    streamSequences = List.copyOf(streamSequences);
  }
}
