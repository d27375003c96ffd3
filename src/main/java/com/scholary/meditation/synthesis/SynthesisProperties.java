package com.scholary.meditation.synthesis;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for speech synthesis.
 *
 * <p>{@code maxChunkChars} is the largest markup document sent in one request. Polly rejects SSML
 * over 3000 billed characters, so the default stays a little below that.
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public record SynthesisProperties(
    @NotBlank String region,
    @NotBlank String engine,
    @NotBlank String outputFormat,
    @Min(100) int maxChunkChars,
    @Positive int apiCallTimeoutSeconds) {

  /** File extension for the configured output format. */
  public String fileExtension() {
    switch (outputFormat) {
      case "ogg_vorbis":
        return "ogg";
      case "pcm":
        return "pcm";
      default:
        return outputFormat;
    }
  }
}
