package com.airsentinel.ingester.fetch;

import com.airsentinel.ingester.config.IngesterProperties;
import com.airsentinel.ingester.opensky.AuthFailedException;
import com.airsentinel.ingester.opensky.NotFoundException;
import com.airsentinel.ingester.opensky.OpenSkyCredentialsProvider;
import com.airsentinel.ingester.opensky.OpenSkyTokenService;
import com.airsentinel.ingester.opensky.ThrottledException;
import com.airsentinel.ingester.opensky.UpstreamUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single choke point for every OpenSky call.
 *
 * <p>Calls are spaced by {@code ingester.min-request-interval-ms} across all keys, authorized with
 * a bearer token (falling back to HTTP Basic), retried once after a 401 with a fresh token, and
 * deduplicated per request key: while a call for a key is in flight, later callers for the same
 * key wait for its outcome instead of issuing their own.
 */
@Component
public class FetchGate {
  private static final Logger log = LoggerFactory.getLogger(FetchGate.class);
  private static final String RETRY_AFTER_HEADER = "X-Rate-Limit-Retry-After-Seconds";

  private final HttpClient httpClient;
  private final OpenSkyTokenService tokenService;
  private final OpenSkyCredentialsProvider credentialsProvider;
  private final BackoffController backoff;
  private final long minIntervalNs;
  private final Duration requestTimeout;
  private final Duration awaitTimeout;

  private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
  private final Object paceLock = new Object();
  private long nextSlotNs;

  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter rateLimitedCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;
  private final Counter suppressedCounter;
  private final Counter deduplicatedCounter;

  public FetchGate(
      HttpClient httpClient,
      OpenSkyTokenService tokenService,
      OpenSkyCredentialsProvider credentialsProvider,
      BackoffController backoff,
      IngesterProperties properties,
      MeterRegistry meterRegistry) {
    this.httpClient = httpClient;
    this.tokenService = tokenService;
    this.credentialsProvider = credentialsProvider;
    this.backoff = backoff;
    this.minIntervalNs = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, properties.minRequestIntervalMs()));
    this.requestTimeout = Duration.ofMillis(properties.requestTimeoutMs());
    // the leader may pace twice and retry once after a 401
    this.awaitTimeout = requestTimeout.multipliedBy(2)
        .plusMillis(2 * Math.max(0L, properties.minRequestIntervalMs()));
    this.nextSlotNs = System.nanoTime();

    this.requestTimer = Timer.builder("ingester.opensky.http.duration")
        .description("OpenSky HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.rateLimitedCounter = outcomeCounter(meterRegistry, "rate_limited");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
    this.suppressedCounter = outcomeCounter(meterRegistry, "suppressed");
    this.deduplicatedCounter = Counter.builder("ingester.opensky.fetch.deduplicated.total")
        .description("Callers that joined an identical in-flight request")
        .register(meterRegistry);
  }

  /**
   * Performs (or joins) the upstream call for {@code request}.
   *
   * @param request canonical key and URI
   * @param parser maps a 2xx response to the payload
   * @param cache written on success; may be {@code null}
   * @return the parsed payload
   * @throws ThrottledException on 429 or while backoff is active
   * @throws AuthFailedException when no usable credentials are accepted
   * @throws NotFoundException on 404
   * @throws UpstreamUnavailableException on transport failures and other non-2xx answers
   */
  public <T> T fetch(
      UpstreamRequest request, Function<HttpResponse<String>, T> parser, ResponseCache<T> cache) {
    if (backoff.isSuppressed()) {
      suppressedCounter.increment();
      throw new ThrottledException(
          "OpenSky backoff active, skipping " + request.key(),
          Math.max(1L, backoff.remaining().toSeconds()));
    }

    CompletableFuture<Object> mine = new CompletableFuture<>();
    CompletableFuture<Object> existing = inFlight.putIfAbsent(request.key(), mine);
    if (existing != null) {
      deduplicatedCounter.increment();
      log.debug("Joining in-flight request {}", request.key());
      return awaitShared(request, existing);
    }

    try {
      // a previous leader may have filled the cache between the caller's lookup and our slot
      if (cache != null) {
        Optional<ResponseCache.Lookup<T>> cached = cache.lookup(request.key());
        if (cached.isPresent() && cached.get().fresh()) {
          deduplicatedCounter.increment();
          mine.complete(cached.get().data());
          return cached.get().data();
        }
      }
      T result = execute(request, parser);
      if (cache != null) {
        cache.put(request.key(), result);
      }
      backoff.reset();
      mine.complete(result);
      return result;
    } catch (RuntimeException ex) {
      mine.completeExceptionally(ex);
      throw ex;
    } finally {
      inFlight.remove(request.key(), mine);
    }
  }

  /** Number of keys with a call currently in flight. */
  public int inFlightCount() {
    return inFlight.size();
  }

  @SuppressWarnings("unchecked")
  private <T> T awaitShared(UpstreamRequest request, CompletableFuture<Object> shared) {
    try {
      return (T) shared.get(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new UpstreamUnavailableException("Shared request failed for " + request.key(), ex.getCause());
    } catch (TimeoutException ex) {
      throw new UpstreamUnavailableException("Timed out waiting for in-flight " + request.key(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new UpstreamUnavailableException("Interrupted waiting for in-flight " + request.key(), ex);
    }
  }

  private <T> T execute(UpstreamRequest request, Function<HttpResponse<String>, T> parser) {
    Authorization auth = resolveAuthorization();
    HttpResponse<String> response = send(request, auth);

    if (response.statusCode() == 401) {
      clientErrorCounter.increment();
      if (auth == null || !auth.bearer()) {
        throw new AuthFailedException("OpenSky rejected credentials for " + request.key());
      }
      log.warn("OpenSky answered 401 for {}, refreshing token and retrying once", request.key());
      tokenService.invalidate();
      auth = resolveAuthorization();
      response = send(request, auth);
      if (response.statusCode() == 401) {
        clientErrorCounter.increment();
        throw new AuthFailedException("OpenSky rejected refreshed credentials for " + request.key());
      }
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      successCounter.increment();
      return parser.apply(response);
    }
    if (status == 429) {
      rateLimitedCounter.increment();
      backoff.triggerBackoff();
      long retryAfter = parseRetryAfter(response.headers().firstValue(RETRY_AFTER_HEADER))
          .orElse(Math.max(1L, backoff.remaining().toSeconds()));
      throw new ThrottledException("OpenSky throttled " + request.key(), retryAfter);
    }
    if (status >= 500) {
      serverErrorCounter.increment();
    } else {
      clientErrorCounter.increment();
    }
    if (status == 404) {
      throw new NotFoundException("OpenSky has no data for " + request.key());
    }
    throw new UpstreamUnavailableException("OpenSky answered " + status + " for " + request.key(), status);
  }

  private HttpResponse<String> send(UpstreamRequest request, Authorization auth) {
    long startNs = -1L;
    try {
      pace();
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(request.uri())
          .timeout(requestTimeout)
          .GET();
      if (auth != null) {
        builder.header("Authorization", auth.headerValue());
      }
      startNs = System.nanoTime();
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
      return response;
    } catch (InterruptedException ex) {
      recordFailure(startNs);
      Thread.currentThread().interrupt();
      throw new UpstreamUnavailableException("Interrupted calling OpenSky for " + request.key(), ex);
    } catch (IOException ex) {
      recordFailure(startNs);
      log.warn("OpenSky call failed for {}: {}", request.key(), ex.getMessage());
      throw new UpstreamUnavailableException("OpenSky call failed for " + request.key(), ex);
    }
  }

  private void recordFailure(long startNs) {
    if (startNs > 0) {
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }
    exceptionCounter.increment();
  }

  /** Reserves the next send slot under the lock, then sleeps outside it. */
  private void pace() throws InterruptedException {
    long waitNs;
    synchronized (paceLock) {
      long now = System.nanoTime();
      long slot = Math.max(now, nextSlotNs);
      nextSlotNs = slot + minIntervalNs;
      waitNs = slot - now;
    }
    if (waitNs > 0) {
      TimeUnit.NANOSECONDS.sleep(waitNs);
    }
  }

  private Authorization resolveAuthorization() {
    try {
      if (credentialsProvider.hasClientCredentials()) {
        return new Authorization("Bearer " + tokenService.getToken(), true);
      }
    } catch (AuthFailedException ex) {
      Optional<String> basic = credentialsProvider.basicAuthorization();
      if (basic.isEmpty()) {
        throw ex;
      }
      log.warn("OpenSky token unavailable ({}), falling back to basic auth", ex.getMessage());
      return new Authorization(basic.get(), false);
    }
    return credentialsProvider.basicAuthorization()
        .map(value -> new Authorization(value, false))
        .orElse(null);
  }

  private Optional<Long> parseRetryAfter(Optional<String> header) {
    if (header.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Math.max(1L, Long.parseLong(header.get().trim())));
    } catch (NumberFormatException ex) {
      log.debug("Unable to parse {} header value: {}", RETRY_AFTER_HEADER, header.get());
      return Optional.empty();
    }
  }

  private static Counter outcomeCounter(MeterRegistry registry, String outcome) {
    return Counter.builder("ingester.opensky.http.requests.total")
        .description("OpenSky HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(registry);
  }

  private record Authorization(String headerValue, boolean bearer) {}
}
