package com.scholary.meditation.synthesis;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a language and a voice type (Male, Female, Neutral) to a Polly voice id.
 *
 * <p>Unknown languages use the en-US voices; unknown voice types use the neutral voice.
 */
public class VoiceCatalog {

  static final String DEFAULT_LANGUAGE = "en-US";
  static final String NEUTRAL = "neutral";

  private static final Map<String, Map<String, String>> VOICES =
      Map.of(
          "en-US", Map.of("male", "Matthew", "female", "Joanna", NEUTRAL, "Ivy"),
          "es-ES", Map.of("male", "Andres", "female", "Conchita", NEUTRAL, "Mia"));

  public String voiceFor(String languageCode, String voiceType) {
    Map<String, String> voices = VOICES.getOrDefault(languageCode, VOICES.get(DEFAULT_LANGUAGE));
    String type = voiceType == null ? NEUTRAL : voiceType.toLowerCase(Locale.ROOT);
    return voices.getOrDefault(type, voices.get(NEUTRAL));
  }

  /** Language the voice will actually speak, after falling back for unknown languages. */
  public String resolveLanguage(String languageCode) {
    return VOICES.containsKey(languageCode) ? languageCode : DEFAULT_LANGUAGE;
  }
}
