/*
 * Where: shared configuration
 * What: exposes the UTC Clock as a bean
 * Why: every service and test injects time from the same place
 */
package com.cplite.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
