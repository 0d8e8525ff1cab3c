package com.airsentinel.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the anomaly processor.
 *
 * <p>The processor pulls state vectors through the ingester's OpenSky client, keeps a short
 * per-aircraft history, and runs the anomaly detector pipeline over each poll.
 */
@SpringBootApplication(scanBasePackages = "com.airsentinel")
@ConfigurationPropertiesScan("com.airsentinel")
public class ProcessorApplication {
  /**
   * Starts the processor application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(ProcessorApplication.class, args);
  }
}
