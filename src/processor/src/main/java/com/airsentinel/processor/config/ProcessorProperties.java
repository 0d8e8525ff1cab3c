package com.airsentinel.processor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the processor service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code processor.*} prefix. Defaults match the detection rules' documented thresholds.
 */
@ConfigurationProperties(prefix = "processor")
public class ProcessorProperties {
  private final History history = new History();
  private final Detection detection = new Detection();
  private final Registry registry = new Registry();
  private final AircraftDb aircraftDb = new AircraftDb();
  private final Scan scan = new Scan();

  public History getHistory() {
    return history;
  }

  public Detection getDetection() {
    return detection;
  }

  public Registry getRegistry() {
    return registry;
  }

  public AircraftDb getAircraftDb() {
    return aircraftDb;
  }

  public Scan getScan() {
    return scan;
  }

  /** Per-aircraft history retention. */
  public static class History {
    private int maxEntries = 100;
    private long maxAgeSeconds = 1800;

    public int getMaxEntries() {
      return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
    }

    public long getMaxAgeSeconds() {
      return maxAgeSeconds;
    }

    public void setMaxAgeSeconds(long maxAgeSeconds) {
      this.maxAgeSeconds = maxAgeSeconds;
    }
  }

  /**
   * Detector thresholds.
   *
   * <p>Rates are in ft/min, speeds in knots, except where the name says otherwise.
   */
  public static class Detection {
    private double criticalVerticalRateFpm = -4000;
    private double altitudeDropRateFpm = -3000;
    private int holdingMinSamples = 20;
    private int holdingWindow = 30;
    private double holdingOrbits = 2.0;
    private double holdingTurnDegrees = 30;
    private double fastSpeedKts = 600;
    private double slowSpeedKts = 80;
    private double slowSpeedMinAltitudeMeters = 3000;
    private int goAroundMinSamples = 10;
    private int goAroundWindow = 15;
    private double goAroundLowAltitudeFt = 1500;
    private double goAroundMinClimbRateMs = 2.0;

    public double getCriticalVerticalRateFpm() {
      return criticalVerticalRateFpm;
    }

    public void setCriticalVerticalRateFpm(double criticalVerticalRateFpm) {
      this.criticalVerticalRateFpm = criticalVerticalRateFpm;
    }

    public double getAltitudeDropRateFpm() {
      return altitudeDropRateFpm;
    }

    public void setAltitudeDropRateFpm(double altitudeDropRateFpm) {
      this.altitudeDropRateFpm = altitudeDropRateFpm;
    }

    public int getHoldingMinSamples() {
      return holdingMinSamples;
    }

    public void setHoldingMinSamples(int holdingMinSamples) {
      this.holdingMinSamples = holdingMinSamples;
    }

    public int getHoldingWindow() {
      return holdingWindow;
    }

    public void setHoldingWindow(int holdingWindow) {
      this.holdingWindow = holdingWindow;
    }

    public double getHoldingOrbits() {
      return holdingOrbits;
    }

    public void setHoldingOrbits(double holdingOrbits) {
      this.holdingOrbits = holdingOrbits;
    }

    public double getHoldingTurnDegrees() {
      return holdingTurnDegrees;
    }

    public void setHoldingTurnDegrees(double holdingTurnDegrees) {
      this.holdingTurnDegrees = holdingTurnDegrees;
    }

    public double getFastSpeedKts() {
      return fastSpeedKts;
    }

    public void setFastSpeedKts(double fastSpeedKts) {
      this.fastSpeedKts = fastSpeedKts;
    }

    public double getSlowSpeedKts() {
      return slowSpeedKts;
    }

    public void setSlowSpeedKts(double slowSpeedKts) {
      this.slowSpeedKts = slowSpeedKts;
    }

    public double getSlowSpeedMinAltitudeMeters() {
      return slowSpeedMinAltitudeMeters;
    }

    public void setSlowSpeedMinAltitudeMeters(double slowSpeedMinAltitudeMeters) {
      this.slowSpeedMinAltitudeMeters = slowSpeedMinAltitudeMeters;
    }

    public int getGoAroundMinSamples() {
      return goAroundMinSamples;
    }

    public void setGoAroundMinSamples(int goAroundMinSamples) {
      this.goAroundMinSamples = goAroundMinSamples;
    }

    public int getGoAroundWindow() {
      return goAroundWindow;
    }

    public void setGoAroundWindow(int goAroundWindow) {
      this.goAroundWindow = goAroundWindow;
    }

    public double getGoAroundLowAltitudeFt() {
      return goAroundLowAltitudeFt;
    }

    public void setGoAroundLowAltitudeFt(double goAroundLowAltitudeFt) {
      this.goAroundLowAltitudeFt = goAroundLowAltitudeFt;
    }

    public double getGoAroundMinClimbRateMs() {
      return goAroundMinClimbRateMs;
    }

    public void setGoAroundMinClimbRateMs(double goAroundMinClimbRateMs) {
      this.goAroundMinClimbRateMs = goAroundMinClimbRateMs;
    }
  }

  /** In-memory store of recently detected anomalies. */
  public static class Registry {
    private int maxAnomalies = 1000;

    public int getMaxAnomalies() {
      return maxAnomalies;
    }

    public void setMaxAnomalies(int maxAnomalies) {
      this.maxAnomalies = maxAnomalies;
    }
  }

  /** Aircraft reference DB settings used by optional metadata enrichment. */
  public static class AircraftDb {
    private boolean enabled = false;
    private String path = "";
    private int cacheSize = 50000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getCacheSize() {
      return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
      this.cacheSize = cacheSize;
    }
  }

  /** Scheduled airspace scan. */
  public static class Scan {
    private long fixedDelayMs = 30000;
    private int limit = 100;

    public long getFixedDelayMs() {
      return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
      this.fixedDelayMs = fixedDelayMs;
    }

    public int getLimit() {
      return limit;
    }

    public void setLimit(int limit) {
      this.limit = limit;
    }
  }
}
