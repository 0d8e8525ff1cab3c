package com.airsentinel.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(
    long minRequestIntervalMs,
    long requestTimeoutMs,
    Cache cache,
    Backoff backoff) {
  public record Cache(long freshTtlMs, long staleTtlMs) {}

  public record Backoff(long cooldownMs) {}
}
