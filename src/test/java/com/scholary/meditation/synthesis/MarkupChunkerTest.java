package com.scholary.meditation.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class MarkupChunkerTest {

  private final MarkupChunker chunker = new MarkupChunker();

  static String longMeditation(int paragraphs) {
    StringBuilder markup = new StringBuilder("<speak>");
    for (int i = 1; i <= paragraphs; i++) {
      markup.append("<p><prosody rate=\"80%\" pitch=\"-10%\">Paragraph ").append(i).append(". ");
      for (int j = 0; j < 9; j++) {
        markup.append(
            "Breathe in slowly and let your shoulders soften as you settle into this moment. ");
      }
      markup.append("</prosody></p><break time=\"2s\"/>");
    }
    return markup.append("</speak>").toString();
  }

  @Test
  void split_shouldKeepEveryFragmentUnderTheCeilingAndWellFormed() {
    String markup = longMeditation(12);
    assertThat(markup.length()).isGreaterThan(9000);

    List<String> fragments = chunker.split(markup, 2900);

    assertThat(fragments).hasSizeGreaterThanOrEqualTo(4);
    for (String fragment : fragments) {
      assertThat(fragment.length()).isLessThanOrEqualTo(2900);
      assertThat(fragment).startsWith("<speak>").endsWith("</speak>");
      assertThat(MarkupSupport.isWellFormed(fragment)).as(fragment).isTrue();
    }
  }

  @Test
  void split_shouldPreserveParagraphOrder() {
    List<String> fragments = chunker.split(longMeditation(12), 2900);

    String joined = String.join("", fragments);
    int previous = -1;
    for (int i = 1; i <= 12; i++) {
      int index = joined.indexOf("Paragraph " + i + ".");
      assertThat(index).as("paragraph %d", i).isGreaterThan(previous);
      previous = index;
    }
    assertThat(fragments.get(0)).contains("Paragraph 1.");
    assertThat(fragments.get(fragments.size() - 1)).contains("Paragraph 12.");
  }

  @Test
  void split_shouldKeepRootAttributesOnEveryFragment() {
    String markup = "<speak xml:lang=\"es-ES\"><p>Uno.</p><p>Dos.</p></speak>";

    List<String> fragments = chunker.split(markup, 50);

    assertThat(fragments)
        .containsExactly(
            "<speak xml:lang=\"es-ES\"><p>Uno.</p></speak>",
            "<speak xml:lang=\"es-ES\"><p>Dos.</p></speak>");
  }

  @Test
  void split_shouldCountRootAttributesWhenSplittingBySentence() {
    String markup = "<speak xml:lang=\"es-ES\">Respira hondo. Suelta los hombros.</speak>";

    List<String> fragments = chunker.split(markup, 50);

    assertThat(fragments).hasSizeGreaterThan(1);
    for (String fragment : fragments) {
      assertThat(fragment.length()).isLessThanOrEqualTo(50);
      assertThat(fragment).startsWith("<speak xml:lang=\"es-ES\">");
      assertThat(MarkupSupport.isWellFormed(fragment)).as(fragment).isTrue();
    }
  }

  @Test
  void split_shouldRewrapParagraphsInTheirStyleAncestors() {
    String markup = "<speak><prosody rate=\"slow\"><p>One.</p><p>Two.</p></prosody></speak>";

    List<String> fragments = chunker.split(markup, 60);

    assertThat(fragments)
        .containsExactly(
            "<speak><prosody rate=\"slow\"><p>One.</p></prosody></speak>",
            "<speak><prosody rate=\"slow\"><p>Two.</p></prosody></speak>");
  }

  @Test
  void split_shouldAttachBreaksToTheFollowingParagraph() {
    String markup = "<speak><p>One.</p><break time=\"1s\"/><p>Two.</p></speak>";

    List<String> fragments = chunker.split(markup, 50);

    assertThat(fragments).hasSize(2);
    assertThat(fragments.get(0)).doesNotContain("break");
    assertThat(fragments.get(1)).contains("break").contains("Two.");
  }

  @Test
  void split_shouldPackSmallParagraphsTogether() {
    String markup = "<speak><p>One.</p><p>Two.</p><p>Three.</p></speak>";

    List<String> fragments = chunker.split(markup, 2900);

    assertThat(fragments).containsExactly("<speak><p>One.</p><p>Two.</p><p>Three.</p></speak>");
  }

  @Test
  void split_shouldFallBackToSentencesWithoutParagraphs() {
    String markup = "<speak>First sentence here. Second sentence here. Third one.</speak>";

    List<String> fragments = chunker.split(markup, 50);

    assertThat(fragments)
        .containsExactly(
            "<speak>First sentence here.</speak>",
            "<speak>Second sentence here. Third one.</speak>");
  }

  @Test
  void split_shouldSplitOversizedParagraphBySentence() {
    String sentence = "Let the breath move through you like a slow tide. ";
    String markup = "<speak><p>Short.</p><p>" + sentence.repeat(6) + "</p></speak>";

    List<String> fragments = chunker.split(markup, 120);

    assertThat(fragments).hasSizeGreaterThan(2);
    assertThat(fragments.get(0)).isEqualTo("<speak><p>Short.</p></speak>");
    for (String fragment : fragments) {
      assertThat(fragment.length()).isLessThanOrEqualTo(120);
      assertThat(MarkupSupport.isWellFormed(fragment)).isTrue();
    }
  }

  @Test
  void split_shouldWrapMarkupWithoutSpeakRoot() {
    List<String> fragments = chunker.split("<p>Just one paragraph.</p>", 2900);

    assertThat(fragments).containsExactly("<speak><p>Just one paragraph.</p></speak>");
  }

  @Test
  void splitPlainText_shouldEscapeAndHardSplitLongWords() {
    List<String> fragments = chunker.splitPlainText("Tom & Jerry " + "x".repeat(40), 30);

    assertThat(fragments.get(0)).isEqualTo("<speak>Tom &amp; Jerry</speak>");
    for (String fragment : fragments) {
      assertThat(fragment.length()).isLessThanOrEqualTo(30);
    }
    assertThat(String.join("", fragments).replace("<speak>", "").replace("</speak>", ""))
        .contains("x".repeat(15));
  }

  @Test
  void split_shouldRejectCeilingTooSmallForTheRoot() {
    assertThatThrownBy(() -> chunker.split("<speak><p>Hi.</p></speak>", 15))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
