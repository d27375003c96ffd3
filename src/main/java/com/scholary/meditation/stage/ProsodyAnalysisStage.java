package com.scholary.meditation.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.generation.GenerationException;
import com.scholary.meditation.generation.GenerationOptions;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.generation.StructuredOutputParser;
import com.scholary.meditation.generation.StructuredOutputParser.Decoded;
import com.scholary.meditation.logging.StructuredLogger;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.state.ProsodyAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Asks for delivery recommendations (tone, key terms, breathing, per-section prosody). */
@Component
public class ProsodyAnalysisStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProsodyAnalysisStage.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String ANALYSIS_SCHEMA =
      "{\"overall_tone\": \"...\", \"key_terms\": [\"...\"], \"breathing_patterns\": [{\"type\":"
          + " \"...\", \"phases\": {\"inhale\": \"4s\", \"exhale\": \"6s\"}}],"
          + " \"section_recommendations\": [{\"section_type\": \"...\", \"pitch\": \"-15%\","
          + " \"rate\": \"80%\", \"volume\": \"soft\"}]}";

  private static final String SYSTEM_PROMPT =
      "You are a voice coach for guided meditation recordings. You analyze scripts and recommend"
          + " how they should be spoken. Answer with JSON only.";

  private final GenerativeTextClient client;
  private final StructuredOutputParser parser;
  private final ObjectMapper objectMapper;

  public ProsodyAnalysisStage(
      GenerativeTextClient client, StructuredOutputParser parser, ObjectMapper objectMapper) {
    this.client = client;
    this.parser = parser;
    this.objectMapper = objectMapper;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.PROSODY_ANALYSIS;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    MeditationScript script = state.getScript();
    if (script == null) {
      state.markFailed("No meditation script to analyze");
      return state;
    }

    Decoded<ProsodyAnalysis> decoded;
    try {
      String raw = client.generate(SYSTEM_PROMPT, prompt(script), GenerationOptions.precise());
      decoded =
          parser.decode(
              raw, ProsodyAnalysis.class, ANALYSIS_SCHEMA, () -> DefaultProsody.analysis(script));
    } catch (GenerationException e) {
      LOGGER.warn("Prosody analysis request failed, using the default analysis", e);
      decoded = new Decoded<>(DefaultProsody.analysis(script), true, 0);
    }

    if (decoded.fallbackUsed()) {
      structuredLogger.logFallbackUsed(step().id(), "prosody_analysis", decoded.reformatAttempts());
      state.addWarning("Default prosody analysis used; the generated analysis was unusable");
    }
    state.setProsodyAnalysis(decoded.value());
    LOGGER.info(
        "Prosody analysis: tone={}, {} section recommendations",
        decoded.value().overallTone(),
        decoded.value().sectionRecommendations().size());
    return state;
  }

  private String prompt(MeditationScript script) {
    return "Analyze this meditation script for delivery. Identify the overall tone, the key terms"
        + " that deserve emphasis, any breathing patterns with the duration of each phase, and the"
        + " pitch, rate and volume each section type should use. Return JSON in this form:\n"
        + ANALYSIS_SCHEMA
        + "\n\nSections:\n"
        + toJson(script);
  }

  private String toJson(MeditationScript script) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(script.sections());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize script sections", e);
    }
  }
}
