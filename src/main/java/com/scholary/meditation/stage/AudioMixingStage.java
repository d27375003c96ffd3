package com.scholary.meditation.stage;

import com.scholary.meditation.audio.AudioMixer;
import com.scholary.meditation.audio.MixResult;
import com.scholary.meditation.audio.MixingException;
import com.scholary.meditation.audio.MixingProperties;
import com.scholary.meditation.audio.NoSoundscapeAvailableException;
import com.scholary.meditation.audio.SoundscapeSelector;
import com.scholary.meditation.config.PipelineProperties;
import com.scholary.meditation.pipeline.PipelineStage;
import com.scholary.meditation.state.AudioOutput;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lays the narration over a soundscape matching the request, then writes the run summary.
 *
 * <p>A missing soundscape library is reported separately from a failed mix so the two can be told
 * apart in the error.
 */
@Component
public class AudioMixingStage implements PipelineStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioMixingStage.class);

  private final SoundscapeSelector soundscapeSelector;
  private final AudioMixer audioMixer;
  private final ResultWriter resultWriter;
  private final MixingProperties mixingProperties;
  private final Path audioDir;

  public AudioMixingStage(
      SoundscapeSelector soundscapeSelector,
      AudioMixer audioMixer,
      ResultWriter resultWriter,
      MixingProperties mixingProperties,
      PipelineProperties pipelineProperties) {
    this(
        soundscapeSelector,
        audioMixer,
        resultWriter,
        mixingProperties,
        pipelineProperties.storage().audioPath());
  }

  AudioMixingStage(
      SoundscapeSelector soundscapeSelector,
      AudioMixer audioMixer,
      ResultWriter resultWriter,
      MixingProperties mixingProperties,
      Path audioDir) {
    this.soundscapeSelector = soundscapeSelector;
    this.audioMixer = audioMixer;
    this.resultWriter = resultWriter;
    this.mixingProperties = mixingProperties;
    this.audioDir = audioDir;
  }

  @Override
  public PipelineStep step() {
    return PipelineStep.AUDIO_MIXING;
  }

  @Override
  public PipelineState apply(PipelineState state) {
    AudioOutput audio = state.getAudioOutput();
    if (audio == null || !audio.hasNarration()) {
      state.markFailed("No narration audio to mix");
      return state;
    }
    Path narration = Path.of(audio.getNarrationFile());
    if (!Files.isRegularFile(narration)) {
      state.markFailed("Narration file not found: " + narration);
      return state;
    }

    Path background;
    try {
      background =
          soundscapeSelector.select(
              Path.of(mixingProperties.soundscapeDir()), state.getRequest().soundscape());
    } catch (NoSoundscapeAvailableException e) {
      state.markFailed(e.getMessage());
      return state;
    }
    LOGGER.info("Selected soundscape {}", background);

    MixResult result;
    try {
      result =
          audioMixer.mix(
              narration,
              background,
              mixingProperties.backgroundVolume(),
              mixingProperties.makeSample(),
              mixingProperties.sampleSeconds(),
              audioDir);
    } catch (MixingException e) {
      LOGGER.error("Audio mixing failed", e);
      state.markFailed("Audio mixing failed: " + e.getMessage());
      return state;
    }

    state.recordMix(
        background.toString(),
        result.mixedFile().toString(),
        result.hasSample() ? result.sampleFile().toString() : null);

    try {
      Path summary = resultWriter.save(state);
      state.recordSummaryFile(summary.toString());
      LOGGER.info("Meditation summary written to {}", summary);
    } catch (IOException e) {
      LOGGER.error("Failed to write meditation summary", e);
      state.markFailed("Failed to write meditation summary: " + e.getMessage());
    }
    return state;
  }
}
