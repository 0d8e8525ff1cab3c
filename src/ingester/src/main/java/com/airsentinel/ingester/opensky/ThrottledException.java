package com.airsentinel.ingester.opensky;

/**
 * Raised on HTTP 429, or when a call is suppressed because backoff is active.
 */
public class ThrottledException extends OpenSkyException {
  private final long retryAfterSeconds;

  public ThrottledException(String message, long retryAfterSeconds) {
    super(message);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
