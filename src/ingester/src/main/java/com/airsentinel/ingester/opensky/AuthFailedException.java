package com.airsentinel.ingester.opensky;

/**
 * Token acquisition failed with no Basic fallback, or the upstream rejected our credentials.
 */
public class AuthFailedException extends OpenSkyException {
  public AuthFailedException(String message) {
    super(message);
  }

  public AuthFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
