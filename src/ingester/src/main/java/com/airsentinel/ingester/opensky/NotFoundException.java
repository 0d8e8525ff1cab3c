package com.airsentinel.ingester.opensky;

/**
 * The requested entity does not exist upstream (HTTP 404 or an empty precise lookup).
 */
public class NotFoundException extends OpenSkyException {
  public NotFoundException(String message) {
    super(message);
  }
}
