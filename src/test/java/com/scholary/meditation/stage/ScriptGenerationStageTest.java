package com.scholary.meditation.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.generation.GenerationException;
import com.scholary.meditation.generation.GenerativeTextClient;
import com.scholary.meditation.generation.StructuredOutputParser;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.ScriptSection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScriptGenerationStageTest {

  private static final String SCRIPT =
      "[INTRODUCTION]\nWelcome. Settle into your seat.\n\n"
          + "[BREATHING]\nBreathe in for four, out for six.\n\n"
          + "[CLOSING]\nWhen you are ready, open your eyes.";

  @Mock private GenerativeTextClient client;

  private ScriptGenerationStage stage;
  private PipelineState state;

  @BeforeEach
  void setUp() {
    stage =
        new ScriptGenerationStage(
            client, new StructuredOutputParser(client, TestFixtures.objectMapper(), 0));
    state = PipelineState.start(TestFixtures.request());
  }

  @Test
  void apply_shouldStoreScriptWithDecodedSections() {
    when(client.generate(any(), any(), any()))
        .thenReturn(
            "  " + SCRIPT + "\n",
            "[{\"type\":\"introduction\",\"content\":\"Welcome.\",\"function\":\"arrive\"},"
                + "{\"type\":\"closing\",\"content\":\"Open your eyes.\"}]");

    stage.apply(state);

    assertThat(state.hasError()).isFalse();
    assertThat(state.getScript().content()).isEqualTo(SCRIPT);
    assertThat(state.getScript().sections())
        .extracting(ScriptSection::type)
        .containsExactly("introduction", "closing");
    assertThat(state.getWarnings()).isEmpty();
  }

  @Test
  void apply_shouldDetectSectionsFromMarkersWhenAnalysisIsMalformed() {
    when(client.generate(any(), any(), any())).thenReturn(SCRIPT, "Here are the sections: ...");

    stage.apply(state);

    assertThat(state.getScript().sections())
        .extracting(ScriptSection::type)
        .containsExactly("introduction", "breathing", "closing");
    assertThat(state.getWarnings()).hasSize(1);
  }

  @Test
  void apply_shouldDetectSectionsWhenAnalysisRequestFails() {
    when(client.generate(any(), any(), any()))
        .thenReturn(SCRIPT)
        .thenThrow(new GenerationException("Generation failed after 3 attempts"));

    stage.apply(state);

    assertThat(state.hasError()).isFalse();
    assertThat(state.getScript().sections()).hasSize(3);
    assertThat(state.getWarnings()).hasSize(1);
  }

  @Test
  void apply_shouldDetectSectionsWhenAnalysisIsEmpty() {
    when(client.generate(any(), any(), any())).thenReturn(SCRIPT, "[]");

    stage.apply(state);

    assertThat(state.getScript().sections()).hasSize(3);
    assertThat(state.getWarnings()).hasSize(1);
  }

  @Test
  void apply_shouldFailWhenScriptIsBlank() {
    when(client.generate(any(), any(), any())).thenReturn("   ");

    stage.apply(state);

    assertThat(state.getError()).isEqualTo("Script generation returned no content");
    assertThat(state.getScript()).isNull();
  }

  @Test
  void scriptPrompt_shouldDescribeTheRequest() {
    String prompt = ScriptGenerationStage.scriptPrompt(TestFixtures.request());

    assertThat(prompt)
        .contains("anxious")
        .contains("Mindfulness")
        .contains("StressRelief")
        .contains("10 minutes (about 1250 words)")
        .contains("en-US");
  }
}
