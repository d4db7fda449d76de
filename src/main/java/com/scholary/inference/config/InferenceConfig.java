package com.scholary.inference.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the gateway core.
 *
 * <p>Enables the InferenceProperties to be loaded from application.yml and provides the clock that
 * every time-based component reads.
 */
@Configuration
@EnableConfigurationProperties(InferenceProperties.class)
public class InferenceConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
