package com.airsentinel.ingester.opensky;

import com.airsentinel.ingester.config.OpenSkyProperties;
import com.airsentinel.ingester.fetch.UpstreamRequest;
import com.airsentinel.ingester.geo.BoundingBox;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds OpenSky request URIs together with their canonical cache keys.
 *
 * <p>Two requests that return the same data always share a key: ICAO24 sets are lower-cased,
 * de-duplicated and sorted before both the key and the query string are produced.
 */
@Component
public class OpenSkyEndpointProvider {
  static final String KEY_ALL_STATES = "states:all";

  private final OpenSkyProperties properties;

  public OpenSkyEndpointProvider(OpenSkyProperties properties) {
    this.properties = properties;
  }

  public UpstreamRequest allStates() {
    return new UpstreamRequest(KEY_ALL_STATES, URI.create(baseUrl() + "/states/all?extended=1"));
  }

  public UpstreamRequest statesInBox(BoundingBox bbox) {
    String key = String.format(
        "states:bbox:%s,%s,%s,%s", bbox.minLat(), bbox.maxLat(), bbox.minLon(), bbox.maxLon());
    String url = String.format(
        "%s/states/all?extended=1&lamin=%s&lamax=%s&lomin=%s&lomax=%s",
        baseUrl(), bbox.minLat(), bbox.maxLat(), bbox.minLon(), bbox.maxLon());
    return new UpstreamRequest(key, URI.create(url));
  }

  public UpstreamRequest statesByIcao24(Collection<String> icao24s) {
    List<String> normalized = normalizeIcao24s(icao24s);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("At least one icao24 is required");
    }
    String query = normalized.stream()
        .map(icao -> "icao24=" + encode(icao))
        .collect(Collectors.joining("&"));
    return new UpstreamRequest(
        "states:icao24:" + String.join(",", normalized),
        URI.create(baseUrl() + "/states/all?extended=1&" + query));
  }

  public UpstreamRequest track(String icao24, Long time) {
    String normalized = normalizeIcao24(icao24);
    StringBuilder url = new StringBuilder(baseUrl())
        .append("/tracks/all?icao24=")
        .append(encode(normalized));
    if (time != null) {
      url.append("&time=").append(time);
    }
    String key = "track:" + normalized + ":" + (time == null ? "live" : time.toString());
    return new UpstreamRequest(key, URI.create(url.toString()));
  }

  public UpstreamRequest arrivals(String airportIcao, long begin, long end) {
    return airportFlights("arrival", airportIcao, begin, end);
  }

  public UpstreamRequest departures(String airportIcao, long begin, long end) {
    return airportFlights("departure", airportIcao, begin, end);
  }

  public String tokenUrl() {
    return required("opensky.token-url", properties.tokenUrl());
  }

  private UpstreamRequest airportFlights(String direction, String airportIcao, long begin, long end) {
    if (airportIcao == null || airportIcao.isBlank()) {
      throw new IllegalArgumentException("airport ICAO code is required");
    }
    if (end <= begin) {
      throw new IllegalArgumentException("end must be after begin");
    }
    String airport = airportIcao.trim().toUpperCase(Locale.ROOT);
    String url = String.format(
        "%s/flights/%s?airport=%s&begin=%d&end=%d", baseUrl(), direction, encode(airport), begin, end);
    return new UpstreamRequest(
        "flights:" + direction + ":" + airport + ":" + begin + ":" + end, URI.create(url));
  }

  private String baseUrl() {
    String base = required("opensky.base-url", properties.baseUrl());
    return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
  }

  static List<String> normalizeIcao24s(Collection<String> icao24s) {
    if (icao24s == null) {
      return List.of();
    }
    return icao24s.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(icao -> !icao.isEmpty())
        .map(icao -> icao.toLowerCase(Locale.ROOT))
        .distinct()
        .sorted()
        .toList();
  }

  private static String normalizeIcao24(String icao24) {
    if (icao24 == null || icao24.isBlank()) {
      throw new IllegalArgumentException("icao24 is required");
    }
    return icao24.trim().toLowerCase(Locale.ROOT);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private String required(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException("OpenSky configuration missing: " + field);
    }
    return value.trim();
  }
}
