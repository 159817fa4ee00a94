package com.updownbot.hft.polymarket.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Blocking JSON-over-HTTP transport shared by the Gamma and CLOB clients.
 * Retries connection failures, 429 and 5xx according to the {@link RetryPolicy}.
 */
@Slf4j
public class PolymarketHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;

  public PolymarketHttpTransport(@NonNull HttpClient httpClient, @NonNull ObjectMapper objectMapper, RetryPolicy retryPolicy) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.retryPolicy = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    int attempts = retryPolicy.attempts();
    PolymarketHttpException last = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return sendOnce(request, type);
      } catch (PolymarketHttpException e) {
        last = e;
        if (!e.isRetryable() || attempt == attempts || Thread.currentThread().isInterrupted()) {
          throw e;
        }
        long backoff = retryPolicy.backoffMillis(attempt);
        log.debug("http {} {} failed (attempt {}/{}), retrying in {}ms: {}",
            request.method(), request.uri(), attempt, attempts, backoff, e.getMessage());
        sleep(backoff);
      }
    }
    throw last;
  }

  private <T> T sendOnce(HttpRequest request, Class<T> type) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketHttpException("interrupted calling " + request.uri(), e);
    } catch (IOException e) {
      throw new PolymarketHttpException("io error calling %s: %s".formatted(request.uri(), e.getMessage()), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String body = response.body() == null ? "" : response.body();
      throw new PolymarketHttpException(
          "HTTP %d from %s: %s".formatted(status, request.uri(), body.length() > 200 ? body.substring(0, 200) : body),
          status);
    }
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (IOException e) {
      throw new PolymarketHttpException("failed parsing response from %s".formatted(request.uri()), status, e);
    }
  }

  private static void sleep(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketHttpException("interrupted during retry backoff", e);
    }
  }
}
