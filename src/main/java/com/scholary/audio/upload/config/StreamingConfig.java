package com.scholary.audio.upload.config;

import com.scholary.audio.upload.streaming.StreamingProperties;
import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the range-capable streaming proxy. */
@Configuration
@EnableConfigurationProperties(StreamingProperties.class)
public class StreamingConfig {

  /** Client for upstream fetches of presigned URLs. Redirects are not followed. */
  @Bean
  public HttpClient streamingHttpClient(StreamingProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(properties.connectTimeout())
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }
}
