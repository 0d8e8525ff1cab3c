package com.airsentinel.processor.aircraft;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only SQLite implementation of {@link AircraftMetadataRepository}.
 *
 * <p>Reads the {@code aircraft} table through prepared statements, keeps an LRU cache of ICAO24
 * hits, and selects {@code NULL} for optional columns the file does not have. Lookup failures are
 * logged and reported as misses; enrichment is never worth failing a scan over.
 */
public class SqliteAircraftMetadataRepository implements AircraftMetadataRepository, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SqliteAircraftMetadataRepository.class);
  private static final List<String> OPTIONAL_COLUMNS = List.of(
      "manufacturer_icao", "icao_aircraft_type", "operator", "operator_callsign", "owner",
      "category_description", "built", "engines");

  private final Connection connection;
  private final PreparedStatement byIcao24;
  private final Map<String, AircraftMetadata> cache;

  /**
   * Opens the SQLite file read-only.
   *
   * @param sqlitePath path to the SQLite artifact
   * @param cacheSize max number of cached ICAO24 entries (values &lt; 0 are clamped to 0)
   */
  public SqliteAircraftMetadataRepository(Path sqlitePath, int cacheSize) {
    if (!Files.exists(sqlitePath)) {
      throw new IllegalStateException("Aircraft DB not found at " + sqlitePath);
    }

    try {
      String url = "jdbc:sqlite:file:" + sqlitePath.toAbsolutePath() + "?mode=ro";
      this.connection = DriverManager.getConnection(url);
      String select = buildSelect(connection);
      this.byIcao24 = connection.prepareStatement(select + " WHERE icao24 = ? LIMIT 1");
    } catch (SQLException ex) {
      throw new IllegalStateException("Failed to open aircraft SQLite DB at " + sqlitePath, ex);
    }

    int maxEntries = Math.max(0, cacheSize);
    this.cache =
        Collections.synchronizedMap(new LinkedHashMap<>(1024, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, AircraftMetadata> eldest) {
            return size() > maxEntries;
          }
        });
    log.info("Aircraft metadata DB opened at {}", sqlitePath);
  }

  @Override
  public Optional<AircraftMetadata> findByIcao24(String icao24) {
    if (icao24 == null || icao24.isBlank()) {
      return Optional.empty();
    }

    String key = icao24.trim().toLowerCase(Locale.ROOT);
    AircraftMetadata cached = cache.get(key);
    if (cached != null) {
      return Optional.of(cached);
    }

    Optional<AircraftMetadata> found = query(byIcao24, key);
    found.ifPresent(meta -> cache.put(key, meta));
    return found;
  }

  @Override
  public void close() {
    try {
      byIcao24.close();
      connection.close();
    } catch (SQLException ex) {
      log.warn("Failed to close aircraft SQLite DB cleanly", ex);
    }
  }

  private Optional<AircraftMetadata> query(PreparedStatement statement, String value) {
    // PreparedStatement is not thread-safe; lookups are serialized on it.
    synchronized (statement) {
      try {
        statement.setString(1, value);
        try (ResultSet rs = statement.executeQuery()) {
          if (!rs.next()) {
            return Optional.empty();
          }
          return Optional.of(new AircraftMetadata(
              rs.getString("icao24").toLowerCase(Locale.ROOT),
              rs.getString("registration"),
              rs.getString("manufacturer_icao"),
              rs.getString("manufacturer_name"),
              rs.getString("model"),
              rs.getString("typecode"),
              rs.getString("icao_aircraft_type"),
              rs.getString("operator"),
              rs.getString("operator_callsign"),
              rs.getString("owner"),
              rs.getString("category_description"),
              rs.getString("built"),
              rs.getString("engines")));
        }
      } catch (SQLException ex) {
        log.warn("Aircraft metadata lookup failed for {}: {}", value, ex.getMessage());
        return Optional.empty();
      }
    }
  }

  private static String buildSelect(Connection connection) throws SQLException {
    Set<String> columns = new HashSet<>();
    try (PreparedStatement stmt = connection.prepareStatement("PRAGMA table_info(aircraft)");
         ResultSet rs = stmt.executeQuery()) {
      while (rs.next()) {
        String name = rs.getString("name");
        if (name != null) {
          columns.add(name);
        }
      }
    }

    StringBuilder sql = new StringBuilder("SELECT icao24, registration, manufacturer_name, model, typecode");
    for (String column : OPTIONAL_COLUMNS) {
      sql.append(", ").append(columns.contains(column) ? column : "NULL AS " + column);
    }
    return sql.append(" FROM aircraft").toString();
  }
}
