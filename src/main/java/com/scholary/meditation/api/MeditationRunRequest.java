package com.scholary.meditation.api;

import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineStep;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request to produce a meditation.
 *
 * <p>The run starts from a fresh record at the first step. {@code endStep} is optional and
 * defaults to the last step. Later start steps go through {@link ResumeRunRequest}.
 */
public record MeditationRunRequest(
    @NotBlank @Schema(example = "anxious") String emotionalState,
    @NotBlank @Schema(example = "Mindfulness") String meditationStyle,
    @NotBlank @Schema(example = "StressRelief") String meditationTheme,
    @Min(1) @Max(60) int durationMinutes,
    @Schema(example = "Female", allowableValues = {"Male", "Female", "Neutral"}) String voiceType,
    @Pattern(regexp = "[a-z]{2}-[A-Z]{2}") @Schema(example = "en-US") String languageCode,
    @Schema(example = "Nature") String soundscape,
    @Schema(example = "audio-mixing") PipelineStep endStep) {

  public MeditationRequest toMeditationRequest() {
    return new MeditationRequest(
        emotionalState,
        meditationStyle,
        meditationTheme,
        durationMinutes,
        voiceType,
        languageCode,
        soundscape);
  }

  public PipelineStep effectiveEndStep() {
    return endStep == null ? PipelineStep.last() : endStep;
  }
}
