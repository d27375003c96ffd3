package com.scholary.meditation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.pipeline.PipelineEngine;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.store.FileSystemStateStore;
import com.scholary.meditation.store.StateStore;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline engine and its snapshot store.
 *
 * <p>Enables the PipelineProperties to be loaded from application.yml. Every {@link PipelineStage}
 * bean is handed to the engine, which orders them by step.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public StateStore stateStore(
      PipelineProperties properties, ObjectMapper objectMapper, Clock clock) {
    return new FileSystemStateStore(properties.storage().statePath(), objectMapper, clock);
  }

  @Bean
  public PipelineEngine pipelineEngine(List<PipelineStage> stages, StateStore stateStore) {
    return new PipelineEngine(stages, stateStore);
  }
}
