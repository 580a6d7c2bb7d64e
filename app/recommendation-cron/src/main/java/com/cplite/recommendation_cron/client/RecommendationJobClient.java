package com.cplite.recommendation_cron.client;

import com.cplite.recommendation_cron.config.JobTriggerProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RecommendationJobClient {

  private static final Logger logger = LoggerFactory.getLogger(RecommendationJobClient.class);
  private static final String STATUS_COMPLETED = "completed";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  private final RestClient jobServiceRestClient;

  private final JobTriggerProperties properties;

  public RecommendationJobClient(
      @Qualifier("jobServiceRestClient") RestClient jobServiceRestClient,
      JobTriggerProperties properties) {
    this.jobServiceRestClient = jobServiceRestClient;
    this.properties = properties;
  }

  public JobStatusSnapshot getStatus() {
    final ResponseEntity<JobStatusSnapshot> response;
    try {
      response =
          jobServiceRestClient
              .get()
              .uri(properties.statusPath())
              .retrieve()
              .toEntity(JobStatusSnapshot.class);
    } catch (RestClientResponseException ex) {
      throw unexpectedStatus(ex.getStatusCode().value(), "status", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "status");
    } catch (RuntimeException ex) {
      throw invalidResponse("status", ex);
    }
    requireOk(response, "status");
    final JobStatusSnapshot body = response.getBody();
    if (body == null || body.running() == null) {
      throw new JobServiceIntegrationException(
          JobServiceIntegrationException.Reason.INVALID_RESPONSE,
          "status response has no is_running field");
    }
    return body;
  }

  public RunSyncOutcome runSync() {
    final ResponseEntity<RunSyncResponse> response;
    try {
      response =
          jobServiceRestClient
              .post()
              .uri(properties.runSyncPath())
              .retrieve()
              .toEntity(RunSyncResponse.class);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
        return RunSyncOutcome.CONFLICT;
      }
      throw unexpectedStatus(ex.getStatusCode().value(), "run-sync", ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "run-sync");
    } catch (RuntimeException ex) {
      throw invalidResponse("run-sync", ex);
    }
    requireOk(response, "run-sync");
    final RunSyncResponse body = response.getBody();
    if (body == null || !STATUS_COMPLETED.equals(body.status())) {
      throw new JobServiceIntegrationException(
          JobServiceIntegrationException.Reason.INVALID_RESPONSE,
          "run-sync answered 200 without status=completed");
    }
    logger.info("run-sync completed runId={} finishedAt={}", body.runId(), body.finishedAt());
    return RunSyncOutcome.COMPLETED;
  }

  private void requireOk(ResponseEntity<?> response, String operation) {
    final int status = response.getStatusCode().value();
    if (status != HttpStatus.OK.value()) {
      throw unexpectedStatus(status, operation, null);
    }
  }

  private JobServiceIntegrationException unexpectedStatus(
      int status, String operation, Throwable cause) {
    return new JobServiceIntegrationException(
        JobServiceIntegrationException.Reason.UNEXPECTED_STATUS,
        operation + " answered http status " + status,
        cause);
  }

  private JobServiceIntegrationException invalidResponse(String operation, RuntimeException ex) {
    return new JobServiceIntegrationException(
        JobServiceIntegrationException.Reason.INVALID_RESPONSE,
        operation + " response parse failed",
        ex);
  }

  private JobServiceIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      return new JobServiceIntegrationException(
          JobServiceIntegrationException.Reason.TIMEOUT, operation + " request timed out", ex);
    }
    return new JobServiceIntegrationException(
        JobServiceIntegrationException.Reason.CONNECTION_FAILED,
        operation + " connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
