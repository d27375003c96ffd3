package com.scholary.meditation.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The input parameters of a meditation run.
 *
 * <p>Set once when a run starts and never changed afterwards; every later stage reads it from the
 * state record.
 */
public record MeditationRequest(
    @JsonProperty("emotional_state") String emotionalState,
    @JsonProperty("meditation_style") String meditationStyle,
    @JsonProperty("meditation_theme") String meditationTheme,
    @JsonProperty("duration_minutes") int durationMinutes,
    @JsonProperty("voice_type") String voiceType,
    @JsonProperty("language_code") String languageCode,
    @JsonProperty("soundscape") String soundscape) {

  public static final String DEFAULT_LANGUAGE = "en-US";

  public MeditationRequest {
    if (languageCode == null || languageCode.isBlank()) {
      languageCode = DEFAULT_LANGUAGE;
    }
    if (voiceType == null || voiceType.isBlank()) {
      voiceType = "Neutral";
    }
    if (soundscape == null || soundscape.isBlank()) {
      soundscape = "Nature";
    }
  }

  /** Approximate narration length for the requested duration, at a calm speaking pace. */
  public int targetWordCount() {
    return durationMinutes * 125;
  }
}
