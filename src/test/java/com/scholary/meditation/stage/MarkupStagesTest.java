package com.scholary.meditation.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.generation.GenerationException;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.synthesis.MarkupSupport;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MarkupStagesTest {

  private static final String MARKUP =
      "<speak><prosody rate=\"80%\"><p>Welcome.</p><break time=\"2s\"/><p>Breathe.</p>"
          + "</prosody></speak>";

  @Mock private GenerativeTextClient client;

  private PipelineState state;

  @BeforeEach
  void setUp() {
    state = PipelineState.start(TestFixtures.request());
    state.setScript(
        new MeditationScript("[INTRODUCTION]\nWelcome.\n\nBreathe & relax.", List.of()));
  }

  private MarkupGenerationStage generationStage() {
    return new MarkupGenerationStage(client, TestFixtures.objectMapper());
  }

  private void withProfile() {
    state.setProsodyProfile(DefaultProsody.profile(state.getRequest(), null));
  }

  @Test
  void generation_shouldExtractSpeakDocumentFromChatter() {
    withProfile();
    when(client.generate(any(), any(), any()))
        .thenReturn("Here is your SSML:\n" + MARKUP + "\nEnjoy the session.");

    generationStage().apply(state);

    assertThat(state.getMarkupOutput()).isEqualTo(MARKUP);
    assertThat(state.getWarnings()).isEmpty();
  }

  @Test
  void generation_shouldWrapResponseWithoutSpeakRoot() {
    withProfile();
    when(client.generate(any(), any(), any())).thenReturn("  <p>Welcome.</p>  ");

    generationStage().apply(state);

    assertThat(state.getMarkupOutput()).isEqualTo("<speak>\n<p>Welcome.</p>\n</speak>");
    assertThat(state.getWarnings()).hasSize(1);
  }

  @Test
  void generation_shouldFailOnEmptyResponse() {
    withProfile();
    when(client.generate(any(), any(), any())).thenReturn("");

    generationStage().apply(state);

    assertThat(state.getError()).isEqualTo("Markup generation returned no content");
  }

  @Test
  void generation_shouldFailWithoutProfile() {
    generationStage().apply(state);

    assertThat(state.getError())
        .isEqualTo("No script and prosody profile to generate markup from");
    verifyNoInteractions(client);
  }

  @Test
  void review_shouldStopAtApproval() {
    state.setMarkupOutput(MARKUP);
    when(client.generate(any(), any(), any())).thenReturn("The SSML looks good.");

    new MarkupReviewStage(client, 3).apply(state);

    assertThat(state.getMarkupOutput()).isEqualTo(MARKUP);
    verify(client, times(1)).generate(any(), any(), any());
  }

  @Test
  void review_shouldAcceptWellFormedRevisionsAndIgnoreMalformedOnes() {
    String revised = "<speak><p>Welcome.</p><break time=\"3s\"/><p>Breathe.</p></speak>";
    state.setMarkupOutput(MARKUP);
    when(client.generate(any(), any(), any()))
        .thenReturn(revised, "<speak><p>Broken</speak>", "No improvements are needed.");

    new MarkupReviewStage(client, 5).apply(state);

    assertThat(state.getMarkupOutput()).isEqualTo(revised);
    verify(client, times(3)).generate(any(), any(), any());
  }

  @Test
  void review_shouldRespectIterationLimit() {
    state.setMarkupOutput(MARKUP);
    when(client.generate(any(), any(), any())).thenReturn("Consider slowing down.");

    new MarkupReviewStage(client, 2).apply(state);

    assertThat(state.getMarkupOutput()).isEqualTo(MARKUP);
    verify(client, times(2)).generate(any(), any(), any());
  }

  @Test
  void review_shouldKeepMarkupWhenReviewerFails() {
    state.setMarkupOutput(MARKUP);
    when(client.generate(any(), any(), any())).thenThrow(new GenerationException("timeout"));

    new MarkupReviewStage(client, 3).apply(state);

    assertThat(state.hasError()).isFalse();
    assertThat(state.getMarkupOutput()).isEqualTo(MARKUP);
    assertThat(state.getWarnings()).containsExactly("Markup review stopped early: timeout");
  }

  @Test
  void review_shouldFallBackToPlainScriptWhenMarkupStaysMalformed() {
    state.setMarkupOutput("<speak><p>Unclosed</speak>");
    when(client.generate(any(), any(), any())).thenReturn("No improvements are needed.");

    new MarkupReviewStage(client, 3).apply(state);

    assertThat(MarkupSupport.isWellFormed(state.getMarkupOutput())).isTrue();
    assertThat(state.getMarkupOutput())
        .doesNotContain("[INTRODUCTION]")
        .contains("<p>Breathe &amp; relax.</p>");
    assertThat(state.getWarnings()).hasSize(1);
  }

  @Test
  void review_shouldFailWithoutMarkup() {
    new MarkupReviewStage(client, 3).apply(state);

    assertThat(state.getError()).isEqualTo("No markup to review");
  }

  @Test
  void isApproval_shouldMatchKnownPhrasesIgnoringCase() {
    assertThat(MarkupReviewStage.isApproval("NO IMPROVEMENTS ARE NEEDED")).isTrue();
    assertThat(MarkupReviewStage.isApproval("Overall the SSML looks good to me")).isTrue();
    assertThat(MarkupReviewStage.isApproval("<speak>...</speak>")).isFalse();
    assertThat(MarkupReviewStage.isApproval(null)).isFalse();
  }
}
