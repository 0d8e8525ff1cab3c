package com.airsentinel.ingester.fetch;

import com.airsentinel.ingester.config.IngesterProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Suppresses upstream calls for a fixed cooldown after the feed signals throttling.
 */
@Component
public class BackoffController {
  private static final Logger log = LoggerFactory.getLogger(BackoffController.class);
  private static final long DEFAULT_COOLDOWN_MS = 60_000L;

  private final Clock clock;
  private final Duration cooldown;
  private volatile Instant suppressedUntil = Instant.EPOCH;

  public BackoffController(IngesterProperties properties, Clock clock) {
    this.clock = clock;
    long cooldownMs = properties.backoff() != null && properties.backoff().cooldownMs() > 0
        ? properties.backoff().cooldownMs()
        : DEFAULT_COOLDOWN_MS;
    this.cooldown = Duration.ofMillis(cooldownMs);
  }

  public boolean isSuppressed() {
    return clock.instant().isBefore(suppressedUntil);
  }

  /** Starts (or restarts) the cooldown window from now. */
  public void triggerBackoff() {
    suppressedUntil = clock.instant().plus(cooldown);
    log.warn("OpenSky throttling detected, suppressing upstream calls for {}s", cooldown.toSeconds());
  }

  public void reset() {
    if (isSuppressed()) {
      log.info("OpenSky backoff cleared");
    }
    suppressedUntil = Instant.EPOCH;
  }

  /** Time left in the current window, {@link Duration#ZERO} when not suppressed. */
  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), suppressedUntil);
    return left.isNegative() ? Duration.ZERO : left;
  }
}
