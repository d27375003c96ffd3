package com.scholary.meditation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for pipeline runs.
 *
 * <p>Controls where snapshots, audio and summaries are written and how many async jobs are kept.
 */
@ConfigurationProperties(prefix = "meditation")
@Validated
public record PipelineProperties(@Valid @NotNull Storage storage, @Valid @NotNull Jobs jobs) {

  public record Storage(
      @NotBlank String stateDir, @NotBlank String audioDir, @NotBlank String jsonDir) {

    public Path statePath() {
      return Path.of(stateDir);
    }

    public Path audioPath() {
      return Path.of(audioDir);
    }

    public Path jsonPath() {
      return Path.of(jsonDir);
    }
  }

  public record Jobs(
      @Positive int maxSize,
      @Positive int expireAfterMinutes,
      @Positive int executorThreads,
      @Positive int executorQueueSize) {}
}
