package com.airsentinel.ingester.config;

import com.airsentinel.ingester.fetch.ResponseCache;
import com.airsentinel.ingester.opensky.FlightTrack;
import com.airsentinel.ingester.opensky.StatesSnapshot;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;

@Configuration
public class IngesterConfig {
  @Bean
  public HttpClient httpClient(IngesterProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(properties.requestTimeoutMs()))
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SsmClient ssmClient(AwsProperties awsProperties) {
    return SsmClient.builder().region(Region.of(awsProperties.region())).build();
  }

  @Bean
  public ResponseCache<StatesSnapshot> statesCache(IngesterProperties properties, Clock clock) {
    IngesterProperties.Cache cache = properties.cache();
    return new ResponseCache<>(
        "states", Duration.ofMillis(cache.freshTtlMs()), Duration.ofMillis(cache.staleTtlMs()), clock);
  }

  @Bean
  public ResponseCache<FlightTrack> trackCache(IngesterProperties properties, Clock clock) {
    IngesterProperties.Cache cache = properties.cache();
    return new ResponseCache<>(
        "tracks", Duration.ofMillis(cache.freshTtlMs()), Duration.ofMillis(cache.staleTtlMs()), clock);
  }
}
