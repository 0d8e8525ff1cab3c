package com.airsentinel.ingester.opensky;

/**
 * Network failure, timeout or non-2xx answer other than 401, 404 and 429.
 */
public class UpstreamUnavailableException extends OpenSkyException {
  private final int statusCode;

  public UpstreamUnavailableException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  /** HTTP status, or {@code 0} when the request never got an answer. */
  public int getStatusCode() {
    return statusCode;
  }
}
