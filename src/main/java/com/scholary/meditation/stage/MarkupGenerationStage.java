package com.scholary.meditation.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.generation.GenerationOptions;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.state.ProsodyProfile;
import com.scholary.meditation.synthesis.MarkupSupport;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders the script as SSML using the prosody profile.
 *
 * <p>The {@code <speak>} document is taken from the response; a response without one is wrapped.
 * Well-formedness is checked later, by the review stage.
 */
@Component
public class MarkupGenerationStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarkupGenerationStage.class);

  static final String SYSTEM_PROMPT =
      "You convert guided meditation scripts into SSML for Amazon Polly. Use only the <speak>,"
          + " <break>, <prosody>, <p> and <s> tags. Express pauses with <break time=\"...\"/> and"
          + " voice changes with <prosody pitch=\"...\" rate=\"...\" volume=\"...\">. Remove"
          + " section headings in square brackets. Return only the SSML document.";

  private final GenerativeTextClient client;
  private final ObjectMapper objectMapper;

  public MarkupGenerationStage(GenerativeTextClient client, ObjectMapper objectMapper) {
    this.client = client;
    this.objectMapper = objectMapper;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.MARKUP_GENERATION;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    MeditationScript script = state.getScript();
    ProsodyProfile profile = state.getProsodyProfile();
    if (script == null || profile == null) {
      state.markFailed("No script and prosody profile to generate markup from");
      return state;
    }

    String response =
        client.generate(SYSTEM_PROMPT, prompt(script, profile), GenerationOptions.precise());
    if (response == null || response.isBlank()) {
      state.markFailed("Markup generation returned no content");
      return state;
    }

    Optional<String> speak = MarkupSupport.extractSpeak(response);
    String markup;
    if (speak.isPresent()) {
      markup = speak.get();
    } else {
      LOGGER.warn("Response has no <speak> element, wrapping it");
      state.addWarning("Generated markup had no <speak> root and was wrapped");
      markup = "<speak>\n" + response.trim() + "\n</speak>";
    }

    state.setMarkupOutput(markup);
    LOGGER.info("Generated {} chars of markup", markup.length());
    return state;
  }

  private String prompt(MeditationScript script, ProsodyProfile profile) {
    return "Apply this voice profile to the script below. Use the base settings throughout, the"
        + " section profiles for the matching sections, the pause lengths between sentences,"
        + " paragraphs and breathing instructions, and gentle emphasis on the emphasis terms.\n\n"
        + "Voice profile:\n"
        + toJson(profile)
        + "\n\nScript:\n"
        + script.content();
  }

  private String toJson(ProsodyProfile profile) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize prosody profile", e);
    }
  }
}
