package com.airsentinel.processor.service;

import com.airsentinel.processor.config.ProcessorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic scan of all states feeding the anomaly registry.
 */
@Component
@ConditionalOnProperty(prefix = "processor.scheduling", name = "enabled", havingValue = "true")
public class AirspaceScanJob {
  private static final Logger log = LoggerFactory.getLogger(AirspaceScanJob.class);

  private final AirspaceMonitor monitor;
  private final ProcessorProperties properties;
  private final Counter scanCounter;
  private final Counter errorCounter;

  public AirspaceScanJob(AirspaceMonitor monitor, ProcessorProperties properties, MeterRegistry meterRegistry) {
    this.monitor = monitor;
    this.properties = properties;
    this.scanCounter = meterRegistry.counter("processor.scans.total");
    this.errorCounter = meterRegistry.counter("processor.scans.errors.total");
  }

  @Scheduled(fixedDelayString = "${processor.scan.fixed-delay-ms:30000}")
  public void scan() {
    try {
      AirspaceScan result = monitor.scanAll(properties.getScan().getLimit());
      scanCounter.increment();
      log.info("Airspace scan: {} aircraft, {} anomalies", result.aircraft().size(), result.anomalies().size());
    } catch (RuntimeException ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Airspace scan failed", ex);
    }
  }
}
