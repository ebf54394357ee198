package com.scholary.audio.upload.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for chunked upload assembly.
 *
 * <p>Maps to the "upload.*" keys in application.yml.
 *
 * @param tempPrefix key prefix under which chunk objects of every session live
 * @param domainPrefix key prefix of assembled audio objects
 * @param fastPathThreshold estimated sizes below this are assembled in memory
 * @param minPartSize accumulator flush size for multipart assembly; the backend minimum
 * @param nominalChunkSize per-chunk size assumed when the caller does not declare a total size
 * @param assemblyTimeout deadline for one assembly call
 * @param presignTtl lifetime of presigned direct-upload URLs
 */
@ConfigurationProperties(prefix = "upload")
@Validated
public record UploadProperties(
    @DefaultValue("_chunks") @NotBlank String tempPrefix,
    @DefaultValue("audio") @NotBlank String domainPrefix,
    @DefaultValue("10MB") @NotNull DataSize fastPathThreshold,
    @DefaultValue("5MB") @NotNull DataSize minPartSize,
    @DefaultValue("3584KB") @NotNull DataSize nominalChunkSize,
    @DefaultValue("5m") @NotNull Duration assemblyTimeout,
    @DefaultValue("1h") @NotNull Duration presignTtl) {

  public UploadProperties {
    if (minPartSize != null && minPartSize.toBytes() < 5L * 1024 * 1024) {
      throw new IllegalArgumentException(
          "upload.minPartSize must be at least 5MB, the multipart minimum of S3-compatible backends");
    }
  }
}
