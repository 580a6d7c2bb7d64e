/*
 * Where: recommendation service entry point
 * What: boots Spring and scans the typed configuration records
 * Why: the job slot, engine client and event publisher share one context
 */
package com.cplite.recommendation;

import com.cplite.common.config.TimeConfig;
import com.cplite.common.web.RequestMdcWebConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import({TimeConfig.class, RequestMdcWebConfig.class})
public class RecommendationApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecommendationApplication.class, args);
  }
}
