/*
 * Where: notification data access
 * What: records stream sequences of events that exhausted max-deliver
 * Why: operators replay them from the stream by sequence
 */
package com.cplite.notification.repository;

import static com.cplite.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeadLetterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** @return false when the sequence was recorded before (advisory redelivered) */
  public boolean insert(long streamSeq, Instant createdAt) {
    final String sql =
        """
        INSERT INTO notification_dead_letters (stream_seq, created_at)
        VALUES (:streamSeq, :createdAt)
        ON CONFLICT (stream_seq) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("streamSeq", streamSeq)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<Long> findStreamSequences() {
    final String sql = "SELECT stream_seq FROM notification_dead_letters ORDER BY stream_seq";
    return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(), Long.class);
  }
}
