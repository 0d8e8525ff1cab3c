package com.airsentinel.ingester.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keyed cache of parsed upstream payloads with two staleness tiers.
 *
 * <p>An entry younger than the fresh TTL is served without a network call. Between the fresh and
 * stale TTL it is only returned as a fallback. Past the stale TTL it is treated as absent.
 *
 * @param <T> payload type
 */
public class ResponseCache<T> {
  private final String name;
  private final Duration freshTtl;
  private final Duration staleTtl;
  private final Clock clock;
  private final ConcurrentMap<String, Entry<T>> entries = new ConcurrentHashMap<>();

  public ResponseCache(String name, Duration freshTtl, Duration staleTtl, Clock clock) {
    if (freshTtl.isNegative() || staleTtl.compareTo(freshTtl) < 0) {
      throw new IllegalArgumentException("stale TTL must be >= fresh TTL >= 0");
    }
    this.name = name;
    this.freshTtl = freshTtl;
    this.staleTtl = staleTtl;
    this.clock = clock;
  }

  /**
   * Looks up a key.
   *
   * @return the entry with its freshness flag, or empty when missing or older than the stale TTL
   */
  public Optional<Lookup<T>> lookup(String key) {
    Entry<T> entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    Duration age = Duration.between(entry.fetchedAt(), clock.instant());
    if (age.compareTo(staleTtl) >= 0) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(new Lookup<>(entry.data(), age.compareTo(freshTtl) < 0, entry.fetchedAt()));
  }

  /** Replaces the entry for {@code key} and stamps it with the current time. */
  public void put(String key, T data) {
    entries.put(key, new Entry<>(data, clock.instant()));
  }

  public void clear() {
    entries.clear();
  }

  public int size() {
    return entries.size();
  }

  public String name() {
    return name;
  }

  public record Entry<T>(T data, Instant fetchedAt) {}

  public record Lookup<T>(T data, boolean fresh, Instant fetchedAt) {}
}
