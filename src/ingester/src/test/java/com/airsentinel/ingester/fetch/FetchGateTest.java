package com.airsentinel.ingester.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.airsentinel.ingester.MutableClock;
import com.airsentinel.ingester.TestFixtures;
import com.airsentinel.ingester.config.OpenSkyProperties;
import com.airsentinel.ingester.opensky.AuthFailedException;
import com.airsentinel.ingester.opensky.NotFoundException;
import com.airsentinel.ingester.opensky.OpenSkyCredentialsProvider;
import com.airsentinel.ingester.opensky.OpenSkyTokenService;
import com.airsentinel.ingester.opensky.ThrottledException;
import com.airsentinel.ingester.opensky.UpstreamUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import software.amazon.awssdk.services.ssm.SsmClient;

class FetchGateTest {
  private static final UpstreamRequest ALL = new UpstreamRequest("states:all", URI.create("https://opensky.example/api/states/all"));
  private static final Function<HttpResponse<String>, String> BODY = HttpResponse::body;

  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  private final HttpClient httpClient = org.mockito.Mockito.mock(HttpClient.class);
  private final OpenSkyTokenService tokenService = org.mockito.Mockito.mock(OpenSkyTokenService.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final BackoffController backoff = new BackoffController(TestFixtures.ingester(0), clock);
  private final ResponseCache<String> cache =
      new ResponseCache<>("test", Duration.ofSeconds(15), Duration.ofMinutes(5), clock);

  private FetchGate gate(OpenSkyProperties properties, long minIntervalMs) {
    return new FetchGate(
        httpClient,
        tokenService,
        new OpenSkyCredentialsProvider(properties, org.mockito.Mockito.mock(SsmClient.class)),
        backoff,
        TestFixtures.ingester(minIntervalMs),
        meterRegistry);
  }

  private FetchGate bearerGate() {
    return gate(TestFixtures.openSky("id", "secret", null, null), 0);
  }

  private HttpRequest lastRequest(int expectedCalls) throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient, times(expectedCalls)).send(captor.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    return captor.getValue();
  }

  @Test
  void successParsesWritesCacheAndSendsBearerToken() throws Exception {
    when(tokenService.getToken()).thenReturn("t1");
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(ok);

    String result = bearerGate().fetch(ALL, BODY, cache);

    assertThat(result).isEqualTo("payload");
    assertThat(cache.lookup("states:all")).hasValueSatisfying(hit -> assertThat(hit.data()).isEqualTo("payload"));
    HttpRequest request = lastRequest(1);
    assertThat(request.headers().firstValue("Authorization")).hasValue("Bearer t1");
    assertThat(request.timeout()).hasValue(Duration.ofMillis(2_000L));
  }

  @Test
  void unauthorizedBearerIsRetriedOnceWithFreshToken() throws Exception {
    when(tokenService.getToken()).thenReturn("stale", "fresh");
    HttpResponse<String> unauthorized = TestFixtures.response(401, "");
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(unauthorized, ok);

    String result = bearerGate().fetch(ALL, BODY, cache);

    assertThat(result).isEqualTo("payload");
    verify(tokenService, times(1)).invalidate();
    assertThat(lastRequest(2).headers().firstValue("Authorization")).hasValue("Bearer fresh");
  }

  @Test
  void secondUnauthorizedIsAnAuthFailure() throws Exception {
    when(tokenService.getToken()).thenReturn("t1", "t2");
    HttpResponse<String> unauthorized = TestFixtures.response(401, "");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(unauthorized);

    assertThatThrownBy(() -> bearerGate().fetch(ALL, BODY, cache)).isInstanceOf(AuthFailedException.class);
    verify(httpClient, times(2)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(cache.lookup("states:all")).isEmpty();
  }

  @Test
  void unauthorizedWithBasicCredentialsIsNotRetried() throws Exception {
    HttpResponse<String> unauthorized = TestFixtures.response(401, "");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(unauthorized);
    FetchGate gate = gate(TestFixtures.openSky(null, null, "alice", "s3cret"), 0);

    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache)).isInstanceOf(AuthFailedException.class);
    verify(httpClient, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    verify(tokenService, never()).invalidate();
  }

  @Test
  void tokenFailureFallsBackToBasicCredentials() throws Exception {
    when(tokenService.getToken()).thenThrow(new AuthFailedException("idp down"));
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(ok);
    FetchGate gate = gate(TestFixtures.openSky("id", "secret", "alice", "s3cret"), 0);

    gate.fetch(ALL, BODY, cache);

    String expected = "Basic " + Base64.getEncoder().encodeToString("alice:s3cret".getBytes(StandardCharsets.UTF_8));
    assertThat(lastRequest(1).headers().firstValue("Authorization")).hasValue(expected);
  }

  @Test
  void tokenFailureWithoutFallbackPropagatesBeforeAnyCall() throws Exception {
    when(tokenService.getToken()).thenThrow(new AuthFailedException("idp down"));

    assertThatThrownBy(() -> bearerGate().fetch(ALL, BODY, cache)).isInstanceOf(AuthFailedException.class);
    verify(httpClient, never()).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void noCredentialsMeansUnauthenticatedRequest() throws Exception {
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(ok);
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 0);

    gate.fetch(ALL, BODY, cache);

    assertThat(lastRequest(1).headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void tooManyRequestsTriggersBackoffAndSuppressesFollowingCalls() throws Exception {
    HttpResponse<String> throttled = TestFixtures.response(429, "", Map.of("X-Rate-Limit-Retry-After-Seconds", List.of("42")));
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(throttled);
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 0);

    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache))
        .isInstanceOfSatisfying(ThrottledException.class, ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(42L));
    assertThat(backoff.isSuppressed()).isTrue();

    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache)).isInstanceOf(ThrottledException.class);
    verify(httpClient, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());

    clock.advance(Duration.ofSeconds(61));
    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache)).isInstanceOf(ThrottledException.class);
    verify(httpClient, times(2)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
  }

  @Test
  void successResetsBackoff() throws Exception {
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(ok);
    BackoffController spiedBackoff = org.mockito.Mockito.spy(backoff);
    FetchGate gate = new FetchGate(
        httpClient,
        tokenService,
        new OpenSkyCredentialsProvider(TestFixtures.openSky(null, null, null, null), org.mockito.Mockito.mock(SsmClient.class)),
        spiedBackoff,
        TestFixtures.ingester(0),
        meterRegistry);

    gate.fetch(ALL, BODY, cache);

    verify(spiedBackoff).reset();
  }

  @Test
  void statusesMapToTheErrorTaxonomy() throws Exception {
    HttpResponse<String> notFound = TestFixtures.response(404, "");
    HttpResponse<String> unavailable = TestFixtures.response(503, "");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(notFound, unavailable)
        .thenThrow(new IOException("connection reset"));
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 0);

    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache)).isInstanceOf(NotFoundException.class);
    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache))
        .isInstanceOfSatisfying(UpstreamUnavailableException.class, ex -> assertThat(ex.getStatusCode()).isEqualTo(503));
    assertThatThrownBy(() -> gate.fetch(ALL, BODY, cache))
        .isInstanceOfSatisfying(UpstreamUnavailableException.class, ex -> assertThat(ex.getStatusCode()).isZero());
    assertThat(backoff.isSuppressed()).isFalse();
    assertThat(gate.inFlightCount()).isZero();
  }

  @Test
  void concurrentCallersForOneKeyShareOneUpstreamCall() throws Exception {
    HttpResponse<String> ok = TestFixtures.response(200, "shared");
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenAnswer(invocation -> {
          entered.countDown();
          release.await(5, TimeUnit.SECONDS);
          return ok;
        });
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 0);

    int callers = 5;
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    try {
      List<Future<String>> futures = new ArrayList<>();
      futures.add(executor.submit(() -> gate.fetch(ALL, BODY, cache)));
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
      for (int i = 1; i < callers; i++) {
        futures.add(executor.submit(() -> gate.fetch(ALL, BODY, cache)));
      }
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (meterRegistry.get("ingester.opensky.fetch.deduplicated.total").counter().count() < callers - 1
          && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
      release.countDown();

      for (Future<String> future : futures) {
        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo("shared");
      }
    } finally {
      executor.shutdownNow();
    }

    verify(httpClient, times(1)).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(gate.inFlightCount()).isZero();
  }

  @Test
  void leaderReusesEntryCachedByAnEarlierLeader() throws Exception {
    cache.put("states:all", "cached");
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 0);

    String result = gate.fetch(ALL, BODY, cache);

    assertThat(result).isEqualTo("cached");
    verify(httpClient, never()).send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(gate.inFlightCount()).isZero();
  }

  @Test
  void staleEntryDoesNotShortCircuitTheCall() throws Exception {
    cache.put("states:all", "old");
    clock.advance(Duration.ofSeconds(20));
    HttpResponse<String> ok = TestFixtures.response(200, "new");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(ok);

    String result = gate(TestFixtures.openSky(null, null, null, null), 0).fetch(ALL, BODY, cache);

    assertThat(result).isEqualTo("new");
    lastRequest(1);
  }

  @Test
  void callsAreSpacedByTheMinimumIntervalAcrossKeys() throws Exception {
    HttpResponse<String> ok = TestFixtures.response(200, "payload");
    List<Long> sentAt = new CopyOnWriteArrayList<>();
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenAnswer(invocation -> {
          sentAt.add(System.nanoTime());
          return ok;
        });
    FetchGate gate = gate(TestFixtures.openSky(null, null, null, null), 200);
    UpstreamRequest other = new UpstreamRequest("states:bbox:1.0,2.0,3.0,4.0", URI.create("https://opensky.example/api/states/all?lamin=1"));

    gate.fetch(ALL, BODY, null);
    gate.fetch(other, BODY, null);
    gate.fetch(ALL, BODY, null);

    assertThat(sentAt).hasSize(3);
    assertThat(TimeUnit.NANOSECONDS.toMillis(sentAt.get(1) - sentAt.get(0))).isGreaterThanOrEqualTo(190L);
    assertThat(TimeUnit.NANOSECONDS.toMillis(sentAt.get(2) - sentAt.get(1))).isGreaterThanOrEqualTo(190L);
  }
}
