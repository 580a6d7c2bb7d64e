package com.cplite.recommendation.api;

import com.cplite.recommendation.api.response.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok", "recommendation-service");
  }
}
