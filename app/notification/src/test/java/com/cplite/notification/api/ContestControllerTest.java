/*
 * Where: contests API web layer test
 * What: catalog listing, single contest lookup, pending broadcasts and mark-sent
 * Why: clients filter on upcoming_only and expect 404 for unknown contest ids
 */
package com.cplite.notification.api;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cplite.notification.model.Contest;
import com.cplite.notification.service.ContestCatalogService;
import com.cplite.notification.service.ContestNotFoundException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ContestController.class)
@Import(ApiExceptionHandler.class)
class ContestControllerTest {

  private static final Instant STARTS_AT = Instant.parse("2026-03-05T14:35:00Z");
  private static final Instant RECORDED_AT = Instant.parse("2026-03-02T03:00:05Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ContestCatalogService contestCatalogService;

  @Test
  void listingDefaultsToAllContestsInSnakeCase() throws Exception {
    when(contestCatalogService.contests(false)).thenReturn(List.of(contest(false)));

    mockMvc
        .perform(get("/contests"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].contest_id").value(1999))
        .andExpect(jsonPath("$[0].name").value("Codeforces Round 900"))
        .andExpect(jsonPath("$[0].start_time").value("2026-03-05T14:35:00Z"))
        .andExpect(jsonPath("$[0].duration_seconds").value(7200))
        .andExpect(jsonPath("$[0].website_url").value(nullValue()))
        .andExpect(jsonPath("$[0].notification_sent").value(false));
  }

  @Test
  void upcomingOnlyIsPassedThrough() throws Exception {
    when(contestCatalogService.contests(true)).thenReturn(List.of());

    mockMvc
        .perform(get("/contests").param("upcoming_only", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());

    verify(contestCatalogService).contests(true);
  }

  @Test
  void pendingNotificationsIsNotTakenForContestId() throws Exception {
    when(contestCatalogService.pendingNotifications()).thenReturn(List.of(contest(false)));

    mockMvc
        .perform(get("/contests/pending-notifications"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].contest_id").value(1999));
  }

  @Test
  void unknownContestIsNotFound() throws Exception {
    when(contestCatalogService.contest(404L)).thenThrow(new ContestNotFoundException(404L));

    mockMvc
        .perform(get("/contests/{id}", 404L))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CONTEST_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("contest not found"));
  }

  @Test
  void markSentAnswersSuccess() throws Exception {
    mockMvc
        .perform(post("/contests/{id}/mark-sent", 1999L))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("success"));

    verify(contestCatalogService).markNotificationSent(1999L);
  }

  @Test
  void markSentOfUnknownContestIsNotFound() throws Exception {
    doThrow(new ContestNotFoundException(7L))
        .when(contestCatalogService)
        .markNotificationSent(7L);

    mockMvc
        .perform(post("/contests/{id}/mark-sent", 7L))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CONTEST_NOT_FOUND"));
  }

  @Test
  void nonNumericContestIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/contests/{id}", "round-900"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verifyNoInteractions(contestCatalogService);
  }

  private static Contest contest(boolean sent) {
    return new Contest(
        1999L, "Codeforces Round 900", STARTS_AT, 7200L, null, sent, RECORDED_AT, RECORDED_AT);
  }
}
