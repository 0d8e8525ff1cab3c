package com.airsentinel.processor.aircraft;

import com.airsentinel.processor.config.ProcessorProperties;
import java.nio.file.Path;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Optional aircraft metadata enrichment, backed by a read-only SQLite file.
 */
@Configuration
public class AircraftDbConfig {

  /**
   * Creates the repository when {@code processor.aircraft-db.enabled=true}.
   *
   * @param properties processor configuration properties
   * @return repository backed by the local SQLite artifact
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "processor.aircraft-db", name = "enabled", havingValue = "true")
  public SqliteAircraftMetadataRepository aircraftMetadataRepository(ProcessorProperties properties) {
    String path = properties.getAircraftDb().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("processor.aircraft-db.enabled=true but processor.aircraft-db.path is empty");
    }
    return new SqliteAircraftMetadataRepository(Path.of(path), properties.getAircraftDb().getCacheSize());
  }
}
