/*
 * Where: recommendation service data access
 * What: conditional state transitions of the job_slots row
 * Why: at most one run per job type, decided by the database rather than by process memory
 */
package com.cplite.recommendation.repository;

import static com.cplite.common.JdbcTimestampUtils.toInstant;
import static com.cplite.common.JdbcTimestampUtils.toTimestamp;

import com.cplite.recommendation.model.JobSlot;
import com.cplite.recommendation.model.JobStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobSlotRepository {

  static final String LEASE_EXPIRED_ERROR = "lease expired";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Creates the IDLE slot if it does not exist yet. Returns true when a row was inserted. */
  public boolean ensureSlot(String jobType) {
    final String sql =
        """
        INSERT INTO job_slots (job_type, status)
        VALUES (:jobType, 'IDLE')
        ON CONFLICT (job_type) DO NOTHING
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("jobType", jobType)) > 0;
  }

  /** Moves a RUNNING slot whose lease has passed back to IDLE, recording the lost run as FAILED. */
  public boolean recoverExpired(String jobType, Instant now) {
    final String sql =
        """
        UPDATE job_slots
        SET status = 'IDLE',
            finished_at = :now,
            lease_until = NULL,
            last_outcome = 'FAILED',
            last_error = :error
        WHERE job_type = :jobType
          AND status = 'RUNNING'
          AND lease_until <= :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobType", jobType)
            .addValue("now", toTimestamp(now))
            .addValue("error", LEASE_EXPIRED_ERROR);
    return jdbcTemplate.update(sql, params) > 0;
  }

  /**
   * IDLE to RUNNING as a single conditional update. Of any number of concurrent callers exactly
   * one sees true.
   */
  public boolean tryAcquire(String jobType, UUID runId, Instant startedAt, Instant leaseUntil) {
    final String sql =
        """
        UPDATE job_slots
        SET status = 'RUNNING',
            run_id = :runId,
            started_at = :startedAt,
            finished_at = NULL,
            lease_until = :leaseUntil,
            last_error = NULL
        WHERE job_type = :jobType
          AND status = 'IDLE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobType", jobType)
            .addValue("runId", runId)
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("leaseUntil", toTimestamp(leaseUntil));
    return jdbcTemplate.update(sql, params) > 0;
  }

  /**
   * RUNNING back to IDLE for the run that owns the slot, recording COMPLETED or FAILED in
   * last_outcome. One statement, so a run can never leave the slot in a terminal but unreleased
   * state.
   */
  public boolean complete(
      String jobType, UUID runId, JobStatus outcome, Instant finishedAt, String error) {
    if (!outcome.isTerminal()) {
      throw new IllegalArgumentException("outcome must be COMPLETED or FAILED");
    }
    final String sql =
        """
        UPDATE job_slots
        SET status = 'IDLE',
            finished_at = :finishedAt,
            lease_until = NULL,
            last_outcome = :outcome,
            last_error = :error
        WHERE job_type = :jobType
          AND run_id = :runId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobType", jobType)
            .addValue("runId", runId)
            .addValue("outcome", outcome.name())
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("error", error);
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<JobSlot> find(String jobType) {
    final String sql =
        """
        SELECT job_type, status, run_id, started_at, finished_at, lease_until,
               last_outcome, last_error
        FROM job_slots
        WHERE job_type = :jobType
        """;
    final List<JobSlot> slots =
        jdbcTemplate.query(sql, new MapSqlParameterSource("jobType", jobType), this::mapRow);
    return slots.stream().findFirst();
  }

  private JobSlot mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String lastOutcome = rs.getString("last_outcome");
    return new JobSlot(
        rs.getString("job_type"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getObject("run_id", UUID.class),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        toInstant(rs.getTimestamp("lease_until")),
        lastOutcome == null ? null : JobStatus.valueOf(lastOutcome),
        rs.getString("last_error"));
  }
}
