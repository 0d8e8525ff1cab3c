package com.airsentinel.ingester.opensky;

import com.airsentinel.ingester.config.OpenSkyProperties;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

/**
 * Resolves the credentials used against OpenSky.
 *
 * <p>Client credentials come from configuration first, then from SSM parameters. Resolved values
 * are memoized for the lifetime of the process.
 */
@Component
public class OpenSkyCredentialsProvider {
  private static final Logger log = LoggerFactory.getLogger(OpenSkyCredentialsProvider.class);

  private final OpenSkyProperties properties;
  private final SsmClient ssmClient;
  private OpenSkyCredentials resolved;

  public OpenSkyCredentialsProvider(OpenSkyProperties properties, SsmClient ssmClient) {
    this.properties = properties;
    this.ssmClient = ssmClient;
  }

  /**
   * Returns the OAuth2 client credentials, if any are configured.
   *
   * @throws AuthFailedException when SSM parameter names are configured but cannot be read
   */
  public synchronized Optional<OpenSkyCredentials> clientCredentials() {
    if (resolved != null) {
      return Optional.of(resolved);
    }

    if (isPresent(properties.clientId()) && isPresent(properties.clientSecret())) {
      resolved = new OpenSkyCredentials(properties.clientId().trim(), properties.clientSecret().trim());
      return Optional.of(resolved);
    }

    if (isPresent(properties.clientIdSsm()) && isPresent(properties.clientSecretSsm())) {
      try {
        resolved = new OpenSkyCredentials(
            getParameter(properties.clientIdSsm()), getParameter(properties.clientSecretSsm()));
      } catch (SdkException ex) {
        throw new AuthFailedException("Unable to read OpenSky credentials from SSM", ex);
      }
      log.info("OpenSky client credentials loaded from SSM parameter {}", properties.clientIdSsm());
      return Optional.of(resolved);
    }

    return Optional.empty();
  }

  public boolean hasClientCredentials() {
    return clientCredentials().isPresent();
  }

  /**
   * Builds a static {@code Authorization} header value from username/password.
   *
   * @return {@code Basic ...} header value when both are configured
   */
  public Optional<String> basicAuthorization() {
    if (!isPresent(properties.username()) || !isPresent(properties.password())) {
      return Optional.empty();
    }
    String raw = properties.username() + ":" + properties.password();
    return Optional.of("Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)));
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }

  private String getParameter(String name) {
    return ssmClient.getParameter(
        GetParameterRequest.builder().name(name).withDecryption(true).build()).parameter().value();
  }
}
