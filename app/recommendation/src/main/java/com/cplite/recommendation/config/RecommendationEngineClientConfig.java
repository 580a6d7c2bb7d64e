/*
 * Where: recommendation service configuration
 * What: RestClient dedicated to the recommendation engine
 * Why: the engine gets its own base URL and timeouts, separate from other clients
 */
package com.cplite.recommendation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RecommendationEngineClientConfig {

  @Bean
  RestClient recommendationEngineRestClient(
      RestClient.Builder builder, RecommendationEngineProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
