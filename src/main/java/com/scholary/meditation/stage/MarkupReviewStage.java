package com.scholary.meditation.stage;

import com.scholary.meditation.generation.GenerationException;
import com.scholary.meditation.generation.GenerationOptions;
import com.scholary.meditation.generation.GenerationProperties;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.synthesis.MarkupSupport;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reviews and corrects the generated SSML.
 *
 * <p>Runs up to {@code generation.review-iterations} rounds. A round ends the loop when the
 * reviewer reports nothing to improve. A revision replaces the markup only if it is well-formed.
 * Markup that is still not well-formed after the loop is replaced by a plain rendition of the
 * script, so synthesis always receives valid SSML.
 */
@Component
public class MarkupReviewStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarkupReviewStage.class);

  private static final String SYSTEM_PROMPT =
      "You review SSML for Amazon Polly. Check that the document is well-formed XML with a single"
          + " <speak> root, uses only the <speak>, <break>, <prosody>, <p> and <s> tags, and has"
          + " natural pauses for a guided meditation. If it needs changes, return the complete"
          + " corrected SSML. If it does not, answer exactly: No improvements are needed.";

  private final GenerativeTextClient client;
  private final int reviewIterations;

  public MarkupReviewStage(GenerativeTextClient client, GenerationProperties properties) {
    this(client, properties.reviewIterations());
  }

  MarkupReviewStage(GenerativeTextClient client, int reviewIterations) {
    this.client = client;
    this.reviewIterations = reviewIterations;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.MARKUP_REVIEW;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    String markup = state.getMarkupOutput();
    if (markup == null || markup.isBlank()) {
      state.markFailed("No markup to review");
      return state;
    }

    for (int iteration = 1; iteration <= reviewIterations; iteration++) {
      String response;
      try {
        response = client.generate(SYSTEM_PROMPT, markup, GenerationOptions.precise());
      } catch (GenerationException e) {
        LOGGER.warn("Review round {} failed, keeping the current markup", iteration, e);
        state.addWarning("Markup review stopped early: " + e.getMessage());
        break;
      }

      if (isApproval(response)) {
        LOGGER.info("Reviewer approved the markup in round {}", iteration);
        break;
      }

      Optional<String> revision = MarkupSupport.extractSpeak(response);
      if (revision.isEmpty()) {
        LOGGER.warn("Review round {} returned no <speak> document, ignoring it", iteration);
      } else if (!MarkupSupport.isWellFormed(revision.get())) {
        LOGGER.warn("Review round {} returned malformed markup, ignoring it", iteration);
      } else {
        markup = revision.get();
        LOGGER.info("Review round {} revised the markup ({} chars)", iteration, markup.length());
      }
    }

    if (!MarkupSupport.isWellFormed(markup)) {
      if (state.getScript() == null) {
        state.markFailed("Markup is not well-formed and there is no script to fall back to");
        return state;
      }
      LOGGER.warn("Markup is still not well-formed after review, using plain script markup");
      state.addWarning("Reviewed markup was not well-formed; plain script markup used");
      markup = MarkupSupport.plainTextSpeak(state.getScript().content());
    }

    state.setMarkupOutput(markup);
    return state;
  }

  static boolean isApproval(String response) {
    if (response == null) {
      return false;
    }
    String lower = response.toLowerCase(Locale.ROOT);
    return lower.contains("no improvements are needed") || lower.contains("ssml looks good");
  }
}
