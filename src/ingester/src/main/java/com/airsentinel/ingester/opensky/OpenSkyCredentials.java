package com.airsentinel.ingester.opensky;

/**
 * OAuth2 client-credentials pair.
 */
public record OpenSkyCredentials(String clientId, String clientSecret) {
  @Override
  public String toString() {
    return "OpenSkyCredentials[clientId=" + clientId + ", clientSecret=***]";
  }
}
