package com.cplite.recommendation_cron.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Body of GET /status. {@code running} is null when the field is absent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusSnapshot(
    @JsonProperty("is_running") Boolean running,
    String lastResult,
    String startedAt,
    String finishedAt) {}
