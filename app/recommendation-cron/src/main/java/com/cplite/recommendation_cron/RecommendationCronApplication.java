/*
 * Where: recommendation cron entry point
 * What: runs the job trigger once and exits with its exit code
 * Why: the scheduler only looks at the process exit status
 */
package com.cplite.recommendation_cron;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RecommendationCronApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(RecommendationCronApplication.class, args)));
  }
}
