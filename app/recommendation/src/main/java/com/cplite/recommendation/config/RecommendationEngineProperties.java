/*
 * Where: recommendation service configuration
 * What: base URL, path and timeouts of the recommendation engine
 * Why: the weekly computation can take long, so its read timeout is tuned per environment
 */
package com.cplite.recommendation.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recommendation.engine")
public record RecommendationEngineProperties(
    String baseUrl, String weeklyPath, Duration connectTimeout, Duration readTimeout) {

  public RecommendationEngineProperties {
    baseUrl = baseUrl == null ? "http://recommendation-engine:8000" : baseUrl;
    weeklyPath =
        weeklyPath == null || weeklyPath.isBlank() ? "/recommendations/weekly" : weeklyPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofMinutes(30) : readTimeout;
  }
}
