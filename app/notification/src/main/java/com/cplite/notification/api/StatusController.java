package com.cplite.notification.api;

import com.cplite.notification.api.response.HealthResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "notification: ok";
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("ok", "notification-service");
  }
}
