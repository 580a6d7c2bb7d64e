/*
 * Where: notification service API
 * What: contests catalog endpoints
 * Why: clients list upcoming contests and operators see which broadcasts are still pending
 */
package com.cplite.notification.api;

import com.cplite.notification.api.response.ContestResponse;
import com.cplite.notification.api.response.StatusResponse;
import com.cplite.notification.service.ContestCatalogService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/contests")
@RequiredArgsConstructor
public class ContestController {

  private final ContestCatalogService contestCatalogService;

  @GetMapping
  public List<ContestResponse> contests(
      @RequestParam(name = "upcoming_only", defaultValue = "false") boolean upcomingOnly) {
    return contestCatalogService.contests(upcomingOnly).stream()
        .map(ContestResponse::from)
        .toList();
  }

  @GetMapping("/pending-notifications")
  public List<ContestResponse> pendingNotifications() {
    return contestCatalogService.pendingNotifications().stream()
        .map(ContestResponse::from)
        .toList();
  }

  @GetMapping("/{contestId}")
  public ContestResponse contest(@PathVariable("contestId") long contestId) {
    return ContestResponse.from(contestCatalogService.contest(contestId));
  }

  @PostMapping("/{contestId}/mark-sent")
  public StatusResponse markNotificationSent(@PathVariable("contestId") long contestId) {
    contestCatalogService.markNotificationSent(contestId);
    return StatusResponse.success();
  }
}
