package com.cplite.recommendation.service;

import com.cplite.recommendation.model.UserRecommendation;
import java.time.LocalDate;

/** Publishes the notification events that follow a completed run. */
public interface RecommendationEventPublisher {

  void publishTaskOfDay(LocalDate day, UserRecommendation recommendation);
}
