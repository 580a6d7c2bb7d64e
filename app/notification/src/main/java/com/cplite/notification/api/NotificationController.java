/*
 * Where: notification service API
 * What: inbox listing and read-flag endpoints
 * Why: clients poll their notifications and acknowledge them
 */
package com.cplite.notification.api;

import com.cplite.notification.api.response.NotificationResponse;
import com.cplite.notification.api.response.StatusResponse;
import com.cplite.notification.service.NotificationInboxService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notification")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationInboxService inboxService;

  @GetMapping("/user/{userId}")
  public List<NotificationResponse> inbox(@PathVariable("userId") String userId) {
    return inboxService.inbox(userId).stream().map(NotificationResponse::from).toList();
  }

  @PutMapping("/{notificationId}/read")
  public StatusResponse markRead(@PathVariable("notificationId") UUID notificationId) {
    inboxService.markRead(notificationId);
    return StatusResponse.success();
  }

  @PutMapping("/user/{userId}/read-all")
  public StatusResponse markAllRead(@PathVariable("userId") String userId) {
    return StatusResponse.success(inboxService.markAllRead(userId));
  }
}
