package com.airsentinel.processor.detection;

/** Conversions from the feed's SI units to the aviation units the rules are written in. */
final class Units {
  static final double FPM_PER_MS = 196.85;
  static final double FT_PER_M = 3.281;
  static final double KT_PER_MS = 1.944;

  private Units() {}

  static double toFeetPerMinute(double metersPerSecond) {
    return metersPerSecond * FPM_PER_MS;
  }

  static double toFeet(double meters) {
    return meters * FT_PER_M;
  }

  static double toKnots(double metersPerSecond) {
    return metersPerSecond * KT_PER_MS;
  }
}
