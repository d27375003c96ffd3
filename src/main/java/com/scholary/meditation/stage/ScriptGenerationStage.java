package com.scholary.meditation.stage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.scholary.meditation.generation.GenerationException;
import com.scholary.meditation.generation.GenerationOptions;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.generation.StructuredOutputParser;
import com.scholary.meditation.generation.StructuredOutputParser.Decoded;
import com.scholary.meditation.logging.StructuredLogger;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.state.ScriptSection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the narration script and splits it into typed sections.
 *
 * <p>The script itself must come from the generative service. The section breakdown is decoded
 * strictly; when it cannot be, sections are detected from {@code [MARKER]} headings or, failing
 * that, from paragraphs.
 */
@Component
public class ScriptGenerationStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScriptGenerationStage.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String SECTIONS_SCHEMA =
      "[{\"type\": \"introduction|grounding|breathing|body_scan|visualization|affirmations"
          + "|closing\", \"content\": \"section text\", \"function\": \"purpose of the section\"}]";

  private static final String SCRIPT_SYSTEM_PROMPT =
      "You are an experienced meditation teacher who writes guided meditation scripts. Write in a"
          + " calm, warm, second-person voice. Mark each section with a heading in square brackets"
          + " such as [INTRODUCTION], [BREATHING], [BODY SCAN], [VISUALIZATION], [AFFIRMATIONS] and"
          + " [CLOSING]. Return only the script.";

  private static final String SECTIONS_SYSTEM_PROMPT =
      "You analyze guided meditation scripts. Answer with a JSON array only, no explanation.";

  private final GenerativeTextClient client;
  private final StructuredOutputParser parser;

  public ScriptGenerationStage(GenerativeTextClient client, StructuredOutputParser parser) {
    this.client = client;
    this.parser = parser;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.SCRIPT_GENERATION;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    MeditationRequest request = state.getRequest();
    String content =
        client.generate(SCRIPT_SYSTEM_PROMPT, scriptPrompt(request), GenerationOptions.creative());
    if (content == null || content.isBlank()) {
      state.markFailed("Script generation returned no content");
      return state;
    }
    content = content.trim();
    LOGGER.info("Generated script of {} chars", content.length());

    Decoded<List<ScriptSection>> decoded = decodeSections(content);
    List<ScriptSection> sections = decoded.value();
    boolean fallbackUsed = decoded.fallbackUsed();
    if (sections.isEmpty()) {
      sections = ScriptSections.detect(content);
      fallbackUsed = true;
    }
    if (fallbackUsed) {
      structuredLogger.logFallbackUsed(step().id(), "sections", decoded.reformatAttempts());
      state.addWarning("Script sections detected from the script text; section analysis unusable");
    }

    state.setScript(new MeditationScript(content, sections));
    LOGGER.info("Script has {} sections", sections.size());
    return state;
  }

  private Decoded<List<ScriptSection>> decodeSections(String content) {
    String raw;
    try {
      raw =
          client.generate(
              SECTIONS_SYSTEM_PROMPT, sectionsPrompt(content), GenerationOptions.precise());
    } catch (GenerationException e) {
      LOGGER.warn("Section analysis failed, detecting sections from the text: {}", e.getMessage());
      return new Decoded<>(ScriptSections.detect(content), true, 0);
    }
    return parser.decode(
        raw,
        new TypeReference<List<ScriptSection>>() {},
        SECTIONS_SCHEMA,
        () -> ScriptSections.detect(content));
  }

  static String scriptPrompt(MeditationRequest request) {
    return String.format(
        "Write a guided meditation script with these characteristics:%n"
            + "- Emotional state of the listener: %s%n"
            + "- Meditation style: %s%n"
            + "- Theme: %s%n"
            + "- Duration: %d minutes (about %d words)%n"
            + "- Language: %s%n%n"
            + "Include an introduction, a breathing section, the main practice and a gentle"
            + " closing. Leave room for pauses; the listener needs time to follow each"
            + " instruction.",
        request.emotionalState(),
        request.meditationStyle(),
        request.meditationTheme(),
        request.durationMinutes(),
        request.targetWordCount(),
        request.languageCode());
  }

  private static String sectionsPrompt(String script) {
    return "Split this meditation script into its sections. For each section return its type, its"
        + " full text and its function, as a JSON array in this form:\n"
        + SECTIONS_SCHEMA
        + "\n\nScript:\n"
        + script;
  }
}
