package com.airsentinel.ingester.opensky;

/**
 * A single upstream row does not match the documented positional schema.
 */
public class MalformedRecordException extends OpenSkyException {
  public MalformedRecordException(String message) {
    super(message);
  }
}
