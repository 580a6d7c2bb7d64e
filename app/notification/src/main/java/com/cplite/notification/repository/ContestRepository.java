/*
 * Where: notification data access
 * What: upserts and queries the contests catalog fed by contest reminders
 * Why: clients list upcoming contests and see which ones were already announced
 */
package com.cplite.notification.repository;

import static com.cplite.common.JdbcTimestampUtils.toInstant;
import static com.cplite.common.JdbcTimestampUtils.toTimestamp;

import com.cplite.notification.model.Contest;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ContestRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT contest_id, name, start_time, duration_seconds, website_url,
             notification_sent, created_at, updated_at
      FROM contests
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Inserts the contest or refreshes its details. notification_sent is never reset. */
  public void upsert(
      long contestId,
      String name,
      Instant startTime,
      Long durationSeconds,
      String websiteUrl,
      Instant now) {
    final String sql =
        """
        INSERT INTO contests (
          contest_id, name, start_time, duration_seconds, website_url,
          notification_sent, created_at, updated_at
        ) VALUES (
          :contestId, :name, :startTime, :durationSeconds, :websiteUrl,
          FALSE, :now, :now
        )
        ON CONFLICT (contest_id) DO UPDATE
        SET name = EXCLUDED.name,
            start_time = EXCLUDED.start_time,
            duration_seconds = COALESCE(EXCLUDED.duration_seconds, contests.duration_seconds),
            website_url = COALESCE(EXCLUDED.website_url, contests.website_url),
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("contestId", contestId)
            .addValue("name", name)
            .addValue("startTime", toTimestamp(startTime))
            .addValue("durationSeconds", durationSeconds)
            .addValue("websiteUrl", websiteUrl)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** @param upcomingAfter when non-null, only contests starting after this instant */
  public List<Contest> findAll(Instant upcomingAfter) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS);
    if (upcomingAfter != null) {
      sql.append("WHERE start_time > :now\n");
      params.addValue("now", toTimestamp(upcomingAfter));
    }
    sql.append("ORDER BY start_time, contest_id\n");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public Optional<Contest> findById(long contestId) {
    final String sql = SELECT_COLUMNS + "WHERE contest_id = :contestId\n";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("contestId", contestId), this::mapRow)
        .stream()
        .findFirst();
  }

  /** Upcoming contests whose broadcast has not been stored yet. */
  public List<Contest> findPendingNotifications(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE notification_sent = FALSE
              AND start_time > :now
            ORDER BY start_time, contest_id
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("now", toTimestamp(now)), this::mapRow);
  }

  /** @return false when the contest is unknown */
  public boolean markNotificationSent(long contestId, Instant now) {
    final String sql =
        """
        UPDATE contests
        SET notification_sent = TRUE,
            updated_at = :now
        WHERE contest_id = :contestId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("contestId", contestId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  private Contest mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Contest(
        rs.getLong("contest_id"),
        rs.getString("name"),
        toInstant(rs.getTimestamp("start_time")),
        rs.getObject("duration_seconds", Long.class),
        rs.getString("website_url"),
        rs.getBoolean("notification_sent"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
