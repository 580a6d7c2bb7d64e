/*
 * Where: notification data access
 * What: writes, lists and marks notifications as read
 * Why: backs both the event consumer and the read API
 */
package com.cplite.notification.repository;

import static com.cplite.common.JdbcTimestampUtils.toInstant;
import static com.cplite.common.JdbcTimestampUtils.toTimestamp;

import com.cplite.common.event.NotificationEvent;
import com.cplite.notification.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, event_id, user_id, event_type, content,
             related_type, related_id, created_at, is_read
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Writes one rendered row of an event. {@code position} numbers the rows of an event that renders
   * more than one.
   *
   * @return false when the row already exists; the stored row is left untouched
   */
  public boolean insertIfAbsent(NotificationRecord record, int position) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          event_id,
          position,
          user_id,
          event_type,
          content,
          related_type,
          related_id,
          created_at,
          is_read
        ) VALUES (
          :notificationId,
          :eventId,
          :position,
          :userId,
          :eventType,
          :content,
          :relatedType,
          :relatedId,
          :createdAt,
          :read
        )
        ON CONFLICT (event_id, position) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("eventId", record.eventId())
            .addValue("position", position)
            .addValue("userId", record.userId())
            .addValue("eventType", record.eventType())
            .addValue("content", record.content())
            .addValue("relatedType", record.relatedType())
            .addValue("relatedId", record.relatedId())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("read", record.read());
    return jdbcTemplate.update(sql, params) > 0;
  }

  /** Notifications addressed to {@code userId} plus system broadcasts, newest first. */
  public List<NotificationRecord> findForUser(String userId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE user_id IN (:userId, :systemUserId)
            ORDER BY created_at DESC, position DESC, notification_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("systemUserId", NotificationEvent.SYSTEM_USER_ID);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByEventId(String eventId) {
    final String sql = SELECT_COLUMNS + "WHERE event_id = :eventId\nORDER BY position\n";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("eventId", eventId), this::mapRow);
  }

  /** @return false when no notification has that id */
  public boolean markRead(UUID notificationId) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE
        WHERE notification_id = :notificationId
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("notificationId", notificationId))
        > 0;
  }

  /**
   * Marks the user's own unread notifications as read. System broadcasts are shared rows and stay
   * untouched.
   */
  public int markAllRead(String userId) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE
        WHERE user_id = :userId
          AND is_read = FALSE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("userId", userId));
  }

  public int deleteReadOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE created_at < :threshold
          AND is_read = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getObject("notification_id", UUID.class),
        rs.getString("event_id"),
        rs.getString("user_id"),
        rs.getString("event_type"),
        rs.getString("content"),
        rs.getString("related_type"),
        rs.getString("related_id"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getBoolean("is_read"));
  }
}
