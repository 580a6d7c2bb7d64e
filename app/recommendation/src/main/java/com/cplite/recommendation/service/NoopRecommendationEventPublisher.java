/*
 * Where: recommendation service layer
 * What: publisher used when NATS is disabled
 * Why: the service and its tests start without a broker
 */
package com.cplite.recommendation.service;

import com.cplite.recommendation.model.UserRecommendation;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopRecommendationEventPublisher implements RecommendationEventPublisher {

  private static final Logger logger =
      LoggerFactory.getLogger(NoopRecommendationEventPublisher.class);

  @Override
  public void publishTaskOfDay(LocalDate day, UserRecommendation recommendation) {
    logger.debug(
        "nats disabled, task of day event dropped userId={} day={}",
        recommendation.userId(),
        day);
  }
}
