package com.scholary.meditation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.generation.GenerationProperties;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.generation.OpenAiTextClient;
import com.scholary.meditation.generation.StructuredOutputParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generative text service.
 *
 * <p>Enables the GenerationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerationProperties.class)
public class GenerationConfig {

  @Bean
  public GenerativeTextClient generativeTextClient(
      GenerationProperties properties, ObjectMapper objectMapper) {
    return new OpenAiTextClient(properties, objectMapper);
  }

  @Bean
  public StructuredOutputParser structuredOutputParser(
      GenerativeTextClient client, ObjectMapper objectMapper, GenerationProperties properties) {
    return new StructuredOutputParser(client, objectMapper, properties.reformatAttempts());
  }
}
