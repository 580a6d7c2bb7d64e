/*
 * Where: notification service layer
 * What: reads a user's inbox and flips read flags
 * Why: the read API stays free of SQL and of the system-broadcast rule
 */
package com.cplite.notification.service;

import com.cplite.notification.model.NotificationRecord;
import com.cplite.notification.repository.NotificationRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationInboxService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationInboxService.class);

  private final NotificationRepository notificationRepository;

  public List<NotificationRecord> inbox(String userId) {
    return notificationRepository.findForUser(requireUserId(userId));
  }

  /** @throws NotificationNotFoundException when no notification has that id */
  public void markRead(UUID notificationId) {
    if (!notificationRepository.markRead(notificationId)) {
      throw new NotificationNotFoundException(notificationId);
    }
  }

  public int markAllRead(String userId) {
    final int updated = notificationRepository.markAllRead(requireUserId(userId));
    logger.info("notifications marked read userId={} updated={}", userId, updated);
    return updated;
  }

  private static String requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("userId is required");
    }
    return userId;
  }
}
