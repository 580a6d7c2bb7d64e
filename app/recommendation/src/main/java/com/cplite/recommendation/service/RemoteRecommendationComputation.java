package com.cplite.recommendation.service;

import com.cplite.recommendation.config.RecommendationEngineProperties;
import com.cplite.recommendation.model.UserRecommendation;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RemoteRecommendationComputation implements RecommendationComputation {

  private static final Logger logger =
      LoggerFactory.getLogger(RemoteRecommendationComputation.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  private final RestClient recommendationEngineRestClient;

  private final RecommendationEngineProperties properties;

  public RemoteRecommendationComputation(
      @Qualifier("recommendationEngineRestClient") RestClient recommendationEngineRestClient,
      RecommendationEngineProperties properties) {
    this.recommendationEngineRestClient = recommendationEngineRestClient;
    this.properties = properties;
  }

  @Override
  public List<UserRecommendation> compute() {
    final WeeklyRecommendationsResponse response;
    try {
      response =
          recommendationEngineRestClient
              .post()
              .uri(properties.weeklyPath())
              .retrieve()
              .body(WeeklyRecommendationsResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "recommendation engine failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new RecommendationIntegrationException(
          RecommendationIntegrationException.Reason.BAD_GATEWAY,
          "recommendation engine returned " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("recommendation engine timed out");
        throw new RecommendationIntegrationException(
            RecommendationIntegrationException.Reason.TIMEOUT,
            "recommendation engine timeout",
            ex);
      }
      logger.warn("recommendation engine connection failed", ex);
      throw new RecommendationIntegrationException(
          RecommendationIntegrationException.Reason.BAD_GATEWAY,
          "recommendation engine connection failed",
          ex);
    } catch (RuntimeException ex) {
      logger.warn("recommendation engine response parse failed", ex);
      throw new RecommendationIntegrationException(
          RecommendationIntegrationException.Reason.INVALID_RESPONSE,
          "recommendation engine response parse failed",
          ex);
    }
    return requireRecommendations(response);
  }

  private List<UserRecommendation> requireRecommendations(WeeklyRecommendationsResponse response) {
    if (response == null || response.recommendations() == null) {
      throw new RecommendationIntegrationException(
          RecommendationIntegrationException.Reason.INVALID_RESPONSE,
          "recommendation engine response is invalid");
    }
    final List<UserRecommendation> valid =
        response.recommendations().stream().filter(this::isComplete).toList();
    if (valid.size() < response.recommendations().size()) {
      logger.warn(
          "recommendation engine returned incomplete entries skipped={}",
          response.recommendations().size() - valid.size());
    }
    return valid;
  }

  private boolean isComplete(UserRecommendation recommendation) {
    return recommendation != null
        && !isBlank(recommendation.userId())
        && !isBlank(recommendation.taskId())
        && !isBlank(recommendation.title());
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
