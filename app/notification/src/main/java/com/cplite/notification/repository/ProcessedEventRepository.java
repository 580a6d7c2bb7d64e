/*
 * Where: notification data access
 * What: claims event ids in processed_events and prunes old claims
 * Why: the primary key on event_id is what makes redelivered events harmless
 */
package com.cplite.notification.repository;

import static com.cplite.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Claims {@code eventId}.
   *
   * @return false when the id was claimed before; the existing row is left untouched
   */
  public boolean insertIfAbsent(String eventId, String eventType, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_events (event_id, event_type, processed_at)
        VALUES (:eventId, :eventType, :processedAt)
        ON CONFLICT (event_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("processedAt", toTimestamp(processedAt));
    // ON CONFLICT instead of catching the key violation: a failed statement would abort the
    // surrounding transaction
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_events
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
