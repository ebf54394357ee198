package com.scholary.audio.upload.streaming;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming proxy.
 *
 * <p>These map to the "streaming.*" keys in application.yml.
 */
@ConfigurationProperties(prefix = "streaming")
@Validated
public record StreamingProperties(
    @DefaultValue("2h") @NotNull Duration signedUrlTtl,
    @DefaultValue("10s") @NotNull Duration connectTimeout,
    @DefaultValue("public, max-age=604800, stale-while-revalidate=2592000") @NotBlank
        String cacheControl) {}
