package com.scholary.audio.upload.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the upload pipeline.
 *
 * <p>Enables the UploadProperties to be loaded from application.yml. Receiver, strategies and
 * assembler are components wired by constructor injection.
 */
@Configuration
@EnableConfigurationProperties(UploadProperties.class)
public class UploadConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
