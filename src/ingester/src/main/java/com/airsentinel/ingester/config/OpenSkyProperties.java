package com.airsentinel.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenSky endpoint and credential settings.
 *
 * <p>Client credentials take precedence over Basic credentials; the {@code *Ssm} fields name SSM
 * parameters used when the plain values are not set.
 */
@ConfigurationProperties(prefix = "opensky")
public record OpenSkyProperties(
    String baseUrl,
    String tokenUrl,
    String clientId,
    String clientSecret,
    String clientIdSsm,
    String clientSecretSsm,
    String username,
    String password,
    long tokenRefreshMarginSeconds) {}
