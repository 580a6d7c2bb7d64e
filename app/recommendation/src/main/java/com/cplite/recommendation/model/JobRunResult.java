package com.cplite.recommendation.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Summary of one completed run; failed event publishes do not fail the run. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunResult(
    int recommendationCount, int userCount, int eventsPublished, int eventsFailed) {}
