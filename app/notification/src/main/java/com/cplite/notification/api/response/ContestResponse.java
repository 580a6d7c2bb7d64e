package com.cplite.notification.api.response;

import com.cplite.notification.model.Contest;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ContestResponse(
    long contestId,
    String name,
    Instant startTime,
    Long durationSeconds,
    String websiteUrl,
    boolean notificationSent,
    Instant createdAt,
    Instant updatedAt) {

  public static ContestResponse from(Contest contest) {
    return new ContestResponse(
        contest.contestId(),
        contest.name(),
        contest.startTime(),
        contest.durationSeconds(),
        contest.websiteUrl(),
        contest.notificationSent(),
        contest.createdAt(),
        contest.updatedAt());
  }
}
