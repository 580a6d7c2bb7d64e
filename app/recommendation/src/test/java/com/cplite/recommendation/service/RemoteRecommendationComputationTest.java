package com.cplite.recommendation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.cplite.recommendation.config.RecommendationEngineProperties;
import com.cplite.recommendation.model.UserRecommendation;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class RemoteRecommendationComputationTest {

  private static final String WEEKLY_URL = "http://engine.test/recommendations/weekly";

  @Test
  void computeParsesRecommendations() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WEEKLY_URL))
        .andExpect(method(POST))
        .andRespond(
            withSuccess(
                """
                {"recommendations":[
                  {"user_id":"user-1","task_id":"task-42","title":"Two pointers","due_date":"2026-03-09"},
                  {"user_id":"user-2","task_id":"task-7","title":"Binary search"}
                ]}
                """,
                MediaType.APPLICATION_JSON));

    final List<UserRecommendation> recommendations = fixture.computation.compute();

    assertThat(recommendations)
        .containsExactly(
            new UserRecommendation("user-1", "task-42", "Two pointers", "2026-03-09"),
            new UserRecommendation("user-2", "task-7", "Binary search", null));
    fixture.server.verify();
  }

  @Test
  void computeSkipsIncompleteEntries() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WEEKLY_URL))
        .andRespond(
            withSuccess(
                """
                {"recommendations":[
                  {"user_id":"user-1","task_id":"task-42","title":"Two pointers"},
                  {"user_id":"","task_id":"task-7","title":"Binary search"}
                ]}
                """,
                MediaType.APPLICATION_JSON));

    assertThat(fixture.computation.compute()).hasSize(1);
  }

  @Test
  void computeRejectsMissingRecommendations() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WEEKLY_URL))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(fixture.computation::compute)
        .isInstanceOf(RecommendationIntegrationException.class)
        .extracting(ex -> ((RecommendationIntegrationException) ex).reason())
        .isEqualTo(RecommendationIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void computeMapsServerErrorToBadGateway() {
    final Fixture fixture = newFixture();
    fixture.server.expect(requestTo(WEEKLY_URL)).andRespond(withServerError());

    assertThatThrownBy(fixture.computation::compute)
        .isInstanceOf(RecommendationIntegrationException.class)
        .hasMessage("recommendation engine returned 500")
        .extracting(ex -> ((RecommendationIntegrationException) ex).reason())
        .isEqualTo(RecommendationIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void computeMapsReadTimeoutToTimeout() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WEEKLY_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(fixture.computation::compute)
        .isInstanceOf(RecommendationIntegrationException.class)
        .extracting(ex -> ((RecommendationIntegrationException) ex).reason())
        .isEqualTo(RecommendationIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void computeMapsConnectionFailureToBadGateway() {
    final Fixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(WEEKLY_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertThatThrownBy(fixture.computation::compute)
        .isInstanceOf(RecommendationIntegrationException.class)
        .extracting(ex -> ((RecommendationIntegrationException) ex).reason())
        .isEqualTo(RecommendationIntegrationException.Reason.BAD_GATEWAY);
  }

  private Fixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://engine.test").build();
    final RecommendationEngineProperties properties =
        new RecommendationEngineProperties("http://engine.test", null, null, null);
    return new Fixture(server, new RemoteRecommendationComputation(restClient, properties));
  }

  private record Fixture(MockRestServiceServer server, RemoteRecommendationComputation computation) {}
}
