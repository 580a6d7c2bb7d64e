package com.cplite.recommendation;

import static org.assertj.core.api.Assertions.assertThat;

import com.cplite.recommendation.service.NoopRecommendationEventPublisher;
import com.cplite.recommendation.service.RecommendationEventPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RecommendationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private RecommendationEventPublisher eventPublisher;

  @Test
  void contextLoadsWithNoopPublisherWhenNatsIsDisabled() {
    assertThat(eventPublisher).isInstanceOf(NoopRecommendationEventPublisher.class);
  }
}
