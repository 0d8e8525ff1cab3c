package com.airsentinel.ingester.opensky;

import com.airsentinel.ingester.config.IngesterProperties;
import com.airsentinel.ingester.config.OpenSkyProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * OAuth2 client-credentials token cache for OpenSky.
 *
 * <p>The token is reused until {@code expiry - tokenRefreshMarginSeconds}. Failed acquisitions
 * start a cooldown that grows with consecutive failures so a broken identity provider is not
 * hammered on every poll.
 */
@Component
public class OpenSkyTokenService {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyTokenService.class);
  private static final long[] TOKEN_FAILURE_BACKOFF_SECONDS = {15L, 30L, 60L, 120L, 300L, 600L};
  private static final long DEFAULT_REFRESH_MARGIN_SECONDS = 60L;

  private final OpenSkyEndpointProvider endpointProvider;
  private final OpenSkyCredentialsProvider credentialsProvider;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final long refreshMarginSeconds;
  private final Duration requestTimeout;
  private final Timer tokenRequestTimer;
  private final Counter tokenRequestSuccessCounter;
  private final Counter tokenRequestClientErrorCounter;
  private final Counter tokenRequestServerErrorCounter;
  private final Counter tokenRequestExceptionCounter;

  private String accessToken;
  private Instant expiry;
  private int tokenFailureCount;
  private Instant nextTokenAttemptAt = Instant.EPOCH;

  public OpenSkyTokenService(
      OpenSkyEndpointProvider endpointProvider,
      OpenSkyCredentialsProvider credentialsProvider,
      OpenSkyProperties properties,
      IngesterProperties ingesterProperties,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock) {
    this.endpointProvider = endpointProvider;
    this.credentialsProvider = credentialsProvider;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.refreshMarginSeconds = properties.tokenRefreshMarginSeconds() > 0
        ? properties.tokenRefreshMarginSeconds()
        : DEFAULT_REFRESH_MARGIN_SECONDS;
    this.requestTimeout = Duration.ofMillis(ingesterProperties.requestTimeoutMs());

    this.tokenRequestTimer = Timer.builder("ingester.opensky.token.http.duration")
        .description("OpenSky token HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);

    this.tokenRequestSuccessCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.tokenRequestClientErrorCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "client_error")
        .register(meterRegistry);
    this.tokenRequestServerErrorCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "server_error")
        .register(meterRegistry);
    this.tokenRequestExceptionCounter = Counter.builder("ingester.opensky.token.http.requests.total")
        .description("OpenSky token HTTP requests (by outcome)")
        .tag("outcome", "exception")
        .register(meterRegistry);
  }

  /**
   * Returns a bearer token, refreshing it when missing or inside the refresh margin.
   *
   * @throws AuthFailedException when no token can be obtained
   */
  public synchronized String getToken() {
    Instant now = clock.instant();
    if (accessToken != null && expiry != null && expiry.minusSeconds(refreshMarginSeconds).isAfter(now)) {
      return accessToken;
    }

    if (nextTokenAttemptAt != null && now.isBefore(nextTokenAttemptAt)) {
      long waitSeconds = Math.max(1L, Duration.between(now, nextTokenAttemptAt).toSeconds());
      tokenRequestExceptionCounter.increment();
      throw new AuthFailedException("Token refresh cooldown active (" + waitSeconds + "s remaining)");
    }

    OpenSkyCredentials credentials = credentialsProvider.clientCredentials()
        .orElseThrow(() -> new AuthFailedException("OpenSky client credentials are not configured"));

    long httpStartNs = -1L;
    boolean recorded = false;
    try {
      String tokenUrl = endpointProvider.tokenUrl();
      String body = "grant_type=client_credentials&client_id="
          + URLEncoder.encode(credentials.clientId(), StandardCharsets.UTF_8)
          + "&client_secret=" + URLEncoder.encode(credentials.clientSecret(), StandardCharsets.UTF_8);

      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(tokenUrl))
          .timeout(requestTimeout)
          .header("Content-Type", "application/x-www-form-urlencoded")
          .POST(HttpRequest.BodyPublishers.ofString(body))
          .build();

      httpStartNs = System.nanoTime();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      recorded = true;

      if (response.statusCode() != 200) {
        if (response.statusCode() >= 500) {
          tokenRequestServerErrorCounter.increment();
        } else {
          tokenRequestClientErrorCounter.increment();
        }
        throw registerTokenFailure("token endpoint answered " + response.statusCode(), null);
      }

      JsonNode json = objectMapper.readTree(response.body());
      JsonNode token = json.get("access_token");
      if (token == null || token.asText().isBlank()) {
        tokenRequestClientErrorCounter.increment();
        throw registerTokenFailure("token response has no access_token", null);
      }
      tokenRequestSuccessCounter.increment();
      long expiresIn = json.path("expires_in").asLong(0L);
      accessToken = token.asText();
      expiry = clock.instant().plusSeconds(expiresIn);
      tokenFailureCount = 0;
      nextTokenAttemptAt = Instant.EPOCH;

      log.info("OpenSky token refreshed, expires in {} seconds", expiresIn);
      return accessToken;

    } catch (AuthFailedException e) {
      log.error("Failed to get OpenSky token: {}", e.getMessage());
      throw e;
    } catch (InterruptedException e) {
      if (!recorded && httpStartNs > 0) {
        tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      }
      Thread.currentThread().interrupt();
      tokenRequestExceptionCounter.increment();
      AuthFailedException failure = registerTokenFailure("token request interrupted", e);
      log.error("Failed to get OpenSky token", failure);
      throw failure;
    } catch (Exception e) {
      if (!recorded && httpStartNs > 0) {
        tokenRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
      }
      tokenRequestExceptionCounter.increment();
      AuthFailedException failure = registerTokenFailure("token request failed: " + e.getMessage(), e);
      log.error("Failed to get OpenSky token", failure);
      throw failure;
    }
  }

  /**
   * Drops the cached token so the next {@link #getToken()} performs a fresh acquisition.
   *
   * <p>Called after the feed rejects the current token with 401. The failure cooldown is left
   * untouched.
   */
  public synchronized void invalidate() {
    if (accessToken != null) {
      log.info("Invalidating cached OpenSky token");
    }
    accessToken = null;
    expiry = null;
  }

  private AuthFailedException registerTokenFailure(String message, Throwable cause) {
    tokenFailureCount++;
    int index = Math.min(tokenFailureCount - 1, TOKEN_FAILURE_BACKOFF_SECONDS.length - 1);
    long cooldownSeconds = TOKEN_FAILURE_BACKOFF_SECONDS[index];
    nextTokenAttemptAt = clock.instant().plusSeconds(cooldownSeconds);
    log.warn(
        "OpenSky token refresh failed (attempt {}), cooldown {}s",
        tokenFailureCount,
        cooldownSeconds);
    if (cause == null) {
      return new AuthFailedException("Token refresh failed: " + message);
    }
    return new AuthFailedException("Token refresh failed: " + message, cause);
  }
}
