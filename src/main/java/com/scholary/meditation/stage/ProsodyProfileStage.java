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
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.state.ProsodyAnalysis;
import com.scholary.meditation.state.ProsodyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the analysis into concrete voice settings: base pitch, rate and volume, pause lengths,
 * emphasis terms and per-section overrides.
 *
 * <p>When no usable profile comes back, a template profile adjusted for the listener's emotional
 * state, the meditation style and the language is used instead.
 */
@Component
public class ProsodyProfileStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProsodyProfileStage.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String PROFILE_SCHEMA =
      "{\"base_pitch\": \"-10%\", \"base_rate\": \"85%\", \"volume\": \"soft\", \"pauses\":"
          + " {\"short\": \"800ms\", \"medium\": \"2s\", \"long\": \"4s\", \"breath\": \"3s\"},"
          + " \"emphasis_terms\": [\"...\"], \"section_profiles\": {\"introduction\": {\"pitch\":"
          + " \"-15%\", \"rate\": \"80%\", \"volume\": \"soft\"}}}";

  private static final String SYSTEM_PROMPT =
      "You design SSML voice profiles for guided meditation narration. Answer with JSON only.";

  private final GenerativeTextClient client;
  private final StructuredOutputParser parser;
  private final ObjectMapper objectMapper;

  public ProsodyProfileStage(
      GenerativeTextClient client, StructuredOutputParser parser, ObjectMapper objectMapper) {
    this.client = client;
    this.parser = parser;
    this.objectMapper = objectMapper;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.PROSODY_PROFILE;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    ProsodyAnalysis analysis = state.getProsodyAnalysis();
    if (state.getScript() == null || analysis == null) {
      state.markFailed("No script and prosody analysis to build a profile from");
      return state;
    }
    MeditationRequest request = state.getRequest();

    Decoded<ProsodyProfile> decoded;
    try {
      String raw =
          client.generate(SYSTEM_PROMPT, prompt(request, analysis), GenerationOptions.precise());
      decoded =
          parser.decode(
              raw,
              ProsodyProfile.class,
              PROFILE_SCHEMA,
              () -> DefaultProsody.profile(request, analysis));
    } catch (GenerationException e) {
      LOGGER.warn("Prosody profile request failed, using the template profile", e);
      decoded = new Decoded<>(DefaultProsody.profile(request, analysis), true, 0);
    }

    if (decoded.fallbackUsed()) {
      structuredLogger.logFallbackUsed(step().id(), "prosody_profile", decoded.reformatAttempts());
      state.addWarning("Template prosody profile used; the generated profile was unusable");
    }
    ProsodyProfile profile = decoded.value();
    state.setProsodyProfile(profile);
    LOGGER.info(
        "Prosody profile: pitch={}, rate={}, volume={}",
        profile.basePitch(),
        profile.baseRate(),
        profile.volume());
    return state;
  }

  private String prompt(MeditationRequest request, ProsodyAnalysis analysis) {
    return String.format(
        "Create a voice profile for a %s meditation for a listener who feels %s, narrated in %s."
            + " Base it on this analysis:%n%s%n%nReturn JSON in this form:%n%s",
        request.meditationStyle(),
        request.emotionalState(),
        request.languageCode(),
        toJson(analysis),
        PROFILE_SCHEMA);
  }

  private String toJson(ProsodyAnalysis analysis) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(analysis);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize prosody analysis", e);
    }
  }
}
