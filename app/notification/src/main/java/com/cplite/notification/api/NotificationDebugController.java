/*
 * Where: notification debug API
 * What: rows written for one event and the dead-lettered stream sequences
 * Why: operators trace a single event id or pick up exhausted messages for replay
 */
package com.cplite.notification.api;

import com.cplite.notification.api.response.DeadLetterListResponse;
import com.cplite.notification.api.response.NotificationResponse;
import com.cplite.notification.repository.DeadLetterRepository;
import com.cplite.notification.repository.NotificationRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationDebugController {

  private final NotificationRepository notificationRepository;
  private final DeadLetterRepository deadLetterRepository;

  @GetMapping("/events/{eventId}")
  public List<NotificationResponse> eventRows(@PathVariable("eventId") String eventId) {
    return notificationRepository.findByEventId(eventId).stream()
        .map(NotificationResponse::from)
        .toList();
  }

  @GetMapping("/dead-letters")
  public DeadLetterListResponse deadLetters() {
    return new DeadLetterListResponse(deadLetterRepository.findStreamSequences());
  }
}
