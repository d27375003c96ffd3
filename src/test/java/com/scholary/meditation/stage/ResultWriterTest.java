package com.scholary.meditation.stage;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.ScriptSection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultWriterTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = TestFixtures.objectMapper();
  private final Clock clock =
      Clock.fixed(Instant.parse("2024-03-01T10:15:30.123Z"), ZoneOffset.UTC);

  @Test
  void writeJson_shouldIncludeRequestScriptAndProsody() throws Exception {
    PipelineState state = PipelineState.start(TestFixtures.request());
    state.setScript(
        new MeditationScript("Welcome.", List.of(new ScriptSection("introduction", "Welcome."))));
    state.setProsodyAnalysis(DefaultProsody.analysis(state.getScript()));
    state.setProsodyProfile(DefaultProsody.profile(state.getRequest(), null));
    state.recordNarration("audio/voice.mp3");

    JsonNode json =
        objectMapper.readTree(new ResultWriter(objectMapper, tempDir, clock).writeJson(state));

    assertThat(json.path("request").path("emotional_state").asText()).isEqualTo("anxious");
    assertThat(json.path("script").path("sections").path(0).path("type").asText())
        .isEqualTo("introduction");
    assertThat(json.path("prosody_analysis").path("overall_tone").asText())
        .isEqualTo("calming and soothing");
    assertThat(json.path("prosody_profile").path("pauses").path("short").asText())
        .isEqualTo("800ms");
    assertThat(json.path("audio_output").path("narration_file").asText())
        .isEqualTo("audio/voice.mp3");
    assertThat(json.has("markup_output")).isFalse();
  }

  @Test
  void save_shouldCreateDirectoryAndTimestampedFile() throws Exception {
    Path jsonDir = tempDir.resolve("nested/json");

    Path file =
        new ResultWriter(objectMapper, jsonDir, clock)
            .save(PipelineState.start(TestFixtures.request()));

    assertThat(file).isEqualTo(jsonDir.resolve("meditation_20240301_101530_123.json"));
    assertThat(objectMapper.readTree(Files.readString(file)).path("script").isNull()).isTrue();
  }
}
