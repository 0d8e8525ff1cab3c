package com.airsentinel.ingester.opensky;

/**
 * Base type for failures talking to the OpenSky feed.
 */
public abstract class OpenSkyException extends RuntimeException {
  protected OpenSkyException(String message) {
    super(message);
  }

  protected OpenSkyException(String message, Throwable cause) {
    super(message, cause);
  }
}
