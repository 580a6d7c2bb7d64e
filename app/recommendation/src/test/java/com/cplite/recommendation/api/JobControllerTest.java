/*
 * Where: recommendation API web layer test
 * What: HTTP shape of /status, /run-sync, /run and /health
 * Why: the trigger client parses these bodies field by field
 */
package com.cplite.recommendation.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cplite.recommendation.model.JobRun;
import com.cplite.recommendation.model.JobRunReport;
import com.cplite.recommendation.model.JobRunResult;
import com.cplite.recommendation.model.JobStatus;
import com.cplite.recommendation.model.JobStatusView;
import com.cplite.recommendation.service.JobAlreadyRunningException;
import com.cplite.recommendation.service.JobExecutionFailedException;
import com.cplite.recommendation.service.JobStateMachine;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({JobController.class, HealthController.class})
@Import(ApiExceptionHandler.class)
class JobControllerTest {

  private static final UUID RUN_ID = UUID.fromString("5f0c6f55-0a53-4c3e-9a55-3f2b8f0b1a11");
  private static final Instant STARTED_AT = Instant.parse("2026-03-02T03:00:00Z");
  private static final Instant FINISHED_AT = Instant.parse("2026-03-02T03:20:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private JobStateMachine jobStateMachine;

  @Test
  void statusReportsRunningFlagAndLastResult() throws Exception {
    when(jobStateMachine.getStatus())
        .thenReturn(
            new JobStatusView(false, RUN_ID, JobStatus.FAILED, STARTED_AT, FINISHED_AT, "boom"));

    mockMvc
        .perform(get("/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.is_running").value(false))
        .andExpect(jsonPath("$.last_result").value("failed"))
        .andExpect(jsonPath("$.last_error").value("boom"))
        .andExpect(jsonPath("$.started_at").value("2026-03-02T03:00:00Z"));
  }

  @Test
  void runSyncReturnsCompletedBody() throws Exception {
    when(jobStateMachine.runSync())
        .thenReturn(
            new JobRunReport(RUN_ID, STARTED_AT, FINISHED_AT, new JobRunResult(3, 2, 3, 0)));

    mockMvc
        .perform(post("/run-sync").header("X-Request-Id", "cron-1"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "cron-1"))
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.run_id").value(RUN_ID.toString()))
        .andExpect(jsonPath("$.finished_at").value("2026-03-02T03:20:00Z"))
        .andExpect(jsonPath("$.result.recommendation_count").value(3))
        .andExpect(jsonPath("$.result.user_count").value(2));
  }

  @Test
  void runSyncReturnsConflictWhenAlreadyRunning() throws Exception {
    when(jobStateMachine.runSync()).thenThrow(new JobAlreadyRunningException(STARTED_AT));

    mockMvc
        .perform(post("/run-sync"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("JOB_ALREADY_RUNNING"))
        .andExpect(jsonPath("$.message").value("job already running"))
        .andExpect(jsonPath("$.started_at").value("2026-03-02T03:00:00Z"));
  }

  @Test
  void runSyncReturnsServerErrorWhenComputationFails() throws Exception {
    when(jobStateMachine.runSync())
        .thenThrow(
            new JobExecutionFailedException(
                RUN_ID, "engine unavailable", new IllegalStateException("engine unavailable")));

    mockMvc
        .perform(post("/run-sync"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("JOB_FAILED"))
        .andExpect(jsonPath("$.message").value("engine unavailable"))
        .andExpect(jsonPath("$.started_at").doesNotExist());
  }

  @Test
  void runReturnsAccepted() throws Exception {
    when(jobStateMachine.runAsync()).thenReturn(new JobRun(RUN_ID, STARTED_AT));

    mockMvc
        .perform(post("/run"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.status").value("accepted"))
        .andExpect(jsonPath("$.run_id").value(RUN_ID.toString()));
  }

  @Test
  void healthIdentifiesService() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.service").value("recommendation-service"));
  }
}
