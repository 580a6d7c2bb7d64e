/*
 * Where: recommendation cron configuration
 * What: RestClient for the recommendation service and the sleeper used between retries
 * Why: run-sync blocks for the whole job, so the client carries its own long read timeout
 */
package com.cplite.recommendation_cron.config;

import com.cplite.recommendation_cron.trigger.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class JobTriggerClientConfig {

  @Bean
  RestClient jobServiceRestClient(RestClient.Builder builder, JobTriggerProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  Sleeper sleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
