/*
 * Where: recommendation service layer
 * What: publishes TaskOfDay notification events on the JetStream notification channel
 * Why: the key per user and UTC day lets reruns of the same day collapse into one notification
 */
package com.cplite.recommendation.service;

import com.cplite.common.event.NotificationEventPublisher;
import com.cplite.recommendation.model.UserRecommendation;
import java.time.LocalDate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JetStreamRecommendationEventPublisher implements RecommendationEventPublisher {

  private final NotificationEventPublisher notificationEventPublisher;

  public JetStreamRecommendationEventPublisher(
      NotificationEventPublisher notificationEventPublisher) {
    this.notificationEventPublisher = notificationEventPublisher;
  }

  @Override
  public void publishTaskOfDay(LocalDate day, UserRecommendation recommendation) {
    notificationEventPublisher.publishTaskOfDay(
        recommendation.userId(),
        day,
        recommendation.taskId(),
        recommendation.title(),
        recommendation.dueDate());
  }
}
