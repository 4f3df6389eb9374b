package bio.terra.adminauth.util;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.config.RetryConfiguration;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.signing.AccessTokenProvider;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends requests through a {@link RestTemplate} and retries 500 and 503 responses and I/O failures
 * with exponential backoff. Once attempts run out the last response is returned as is, and the
 * last I/O failure is raised as an {@link AdminAuthException}.
 *
 * <p>Interrupting the calling thread cancels the call: it fails with {@link ErrorCode#CANCELLED}
 * and the thread keeps its interrupt status.
 *
 * <p>When built with an {@link AccessTokenProvider} every request carries a bearer token.
 */
@Slf4j
public class AdminAuthHttpClient {
  private static final Set<Integer> RETRYABLE_STATUSES = Set.of(500, 503);

  private final RestTemplate restTemplate;
  private final RetryTemplate retryTemplate;
  private final @Nullable AccessTokenProvider accessTokenProvider;

  public AdminAuthHttpClient(
      RestTemplate restTemplate,
      RetryConfiguration retryConfiguration,
      @Nullable AccessTokenProvider accessTokenProvider) {
    this.restTemplate = restTemplate;
    this.accessTokenProvider = accessTokenProvider;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(retryConfiguration.getMaxAttempts())
            .exponentialBackoff(
                retryConfiguration.getInitialInterval().toMillis(),
                2,
                retryConfiguration.getMaxInterval().toMillis())
            .retryOn(List.of(RetryableResponseException.class, ResourceAccessException.class))
            .withListener(new LoggingRetryListener())
            .build();
  }

  public ResponseEntity<String> get(String url, Map<String, String> headers) {
    return send(HttpMethod.GET, url, headers, null);
  }

  public ResponseEntity<String> postJson(String url, Object body) {
    return send(HttpMethod.POST, url, Map.of(), body);
  }

  public ResponseEntity<String> send(
      HttpMethod method, String url, Map<String, String> headers, @Nullable Object body) {
    try {
      return retryTemplate.execute(
          context -> {
            if (Thread.currentThread().isInterrupted()) {
              throw new AdminAuthException(ErrorCode.CANCELLED, "http call was cancelled");
            }
            var response =
                restTemplate.exchange(url, method, buildEntity(headers, body), String.class);
            if (RETRYABLE_STATUSES.contains(response.getStatusCode().value())) {
              throw new RetryableResponseException(response);
            }
            return response;
          });
    } catch (RetryableResponseException e) {
      return e.getResponse();
    } catch (ResourceAccessException e) {
      throw toTransportException(e);
    } catch (BackOffInterruptedException | CancellationException e) {
      throw cancelled(e);
    }
  }

  private HttpEntity<Object> buildEntity(Map<String, String> headers, @Nullable Object body) {
    var httpHeaders = new HttpHeaders();
    headers.forEach(httpHeaders::set);
    if (body != null) {
      httpHeaders.setContentType(MediaType.APPLICATION_JSON);
    }
    if (accessTokenProvider != null) {
      httpHeaders.setBearerAuth(accessTokenProvider.getAccessToken());
    }
    return new HttpEntity<>(body, httpHeaders);
  }

  static AdminAuthException toTransportException(ResourceAccessException e) {
    var cause = e.getCause() != null ? e.getCause() : e;
    if (cause instanceof ConnectException) {
      return new AdminAuthException(
          ErrorCode.UNAVAILABLE, "failed to establish a connection: " + cause.getMessage(), e);
    }
    if (cause instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
      return cancelled(e);
    }
    if (cause instanceof InterruptedIOException) {
      return new AdminAuthException(
          ErrorCode.DEADLINE_EXCEEDED,
          "timed out while making an http call: " + cause.getMessage(),
          e);
    }
    return new AdminAuthException(
        ErrorCode.UNKNOWN, "error while making http call: " + cause.getMessage(), e);
  }

  private static AdminAuthException cancelled(Exception e) {
    Thread.currentThread().interrupt();
    return new AdminAuthException(ErrorCode.CANCELLED, "http call was cancelled", e);
  }

  /** Carries a retryable response out of the retry callback. */
  private static class RetryableResponseException extends RuntimeException {
    private final transient ResponseEntity<String> response;

    RetryableResponseException(ResponseEntity<String> response) {
      super("retryable response status " + response.getStatusCode().value());
      this.response = response;
    }

    ResponseEntity<String> getResponse() {
      return response;
    }
  }

  private static class LoggingRetryListener implements RetryListener {
    @Override
    public <T, E extends Throwable> void onError(
        RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
      log.debug(
          "http call failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }
  }
}
