package com.scholary.meditation.stage;

import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.synthesis.ChunkedSpeechSynthesizer;
import com.scholary.meditation.synthesis.SynthesisException;
import com.scholary.meditation.synthesis.VoiceCatalog;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Narrates the reviewed markup with the voice matching the request. */
@Component
public class SpeechSynthesisStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechSynthesisStage.class);

  private final ChunkedSpeechSynthesizer synthesizer;
  private final VoiceCatalog voiceCatalog;

  public SpeechSynthesisStage(ChunkedSpeechSynthesizer synthesizer, VoiceCatalog voiceCatalog) {
    this.synthesizer = synthesizer;
    this.voiceCatalog = voiceCatalog;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.SPEECH_SYNTHESIS;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    String markup = state.getMarkupOutput();
    if (markup == null || markup.isBlank()) {
      state.markFailed("No markup to synthesize");
      return state;
    }

    MeditationRequest request = state.getRequest();
    String voiceId = voiceCatalog.voiceFor(request.languageCode(), request.voiceType());
    String languageCode = voiceCatalog.resolveLanguage(request.languageCode());
    if (!languageCode.equals(request.languageCode())) {
      state.addWarning(
          "No voices for " + request.languageCode() + ", narrating in " + languageCode);
    }
    LOGGER.info("Synthesizing with voice {} ({})", voiceId, languageCode);

    try {
      Path narration = synthesizer.synthesize(markup, voiceId, languageCode);
      state.recordNarration(narration.toString());
      LOGGER.info("Narration written to {}", narration);
    } catch (SynthesisException e) {
      LOGGER.error("Speech synthesis failed", e);
      state.markFailed("Speech synthesis failed: " + e.getMessage());
    }
    return state;
  }
}
