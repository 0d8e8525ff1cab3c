package com.airsentinel.processor.detection;

import com.airsentinel.processor.config.ProcessorProperties;
import java.time.Clock;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * The detector set, in evaluation order: emergency squawk, altitude, holding pattern, speed,
 * go-around.
 */
@Component
public class AnomalyPipeline {
  private final List<AnomalyDetector> detectors;

  public AnomalyPipeline(ProcessorProperties properties, Clock clock) {
    AnomalyFactory factory = new AnomalyFactory(clock);
    ProcessorProperties.Detection thresholds = properties.getDetection();
    this.detectors = List.of(
        new EmergencySquawkDetector(factory),
        new AltitudeAnomalyDetector(factory, thresholds),
        new HoldingPatternDetector(factory, thresholds),
        new SpeedAnomalyDetector(factory, thresholds),
        new GoAroundDetector(factory, thresholds));
  }

  public List<AnomalyDetector> detectors() {
    return detectors;
  }
}
