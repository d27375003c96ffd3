package com.scholary.meditation.synthesis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MarkupSupportTest {

  @Test
  void extractSpeak_shouldFindDocumentInsideProse() {
    String response =
        "Here is the improved SSML:\n```xml\n<speak><p>Rest.</p></speak>\n```\nLet me know.";

    assertThat(MarkupSupport.extractSpeak(response)).contains("<speak><p>Rest.</p></speak>");
    assertThat(MarkupSupport.extractSpeak("No markup here")).isEmpty();
    assertThat(MarkupSupport.extractSpeak(null)).isEmpty();
  }

  @Test
  void isWellFormed_shouldRequireParseableSpeakRoot() {
    assertThat(MarkupSupport.isWellFormed("<speak><p>Rest.</p><break time=\"1s\"/></speak>"))
        .isTrue();
    assertThat(MarkupSupport.isWellFormed("<speak><p>Rest.</speak>")).isFalse();
    assertThat(MarkupSupport.isWellFormed("<p>Rest.</p>")).isFalse();
    assertThat(MarkupSupport.isWellFormed("")).isFalse();
  }

  @Test
  void plainTextSpeak_shouldDropMarkersAndEscapeText() {
    String markup =
        MarkupSupport.plainTextSpeak("[INTRODUCTION]\nWelcome & settle in.\n\n[CLOSING]\nRest.");

    assertThat(markup)
        .isEqualTo(
            "<speak><p>Welcome &amp; settle in.</p><break time=\"1s\"/><p>Rest.</p></speak>");
    assertThat(MarkupSupport.isWellFormed(markup)).isTrue();
  }
}
