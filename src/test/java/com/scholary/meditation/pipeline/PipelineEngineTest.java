package com.scholary.meditation.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.state.MeditationScript;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import com.scholary.meditation.store.FileSystemStateStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class PipelineEngineTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = TestFixtures.objectMapper();
  private final List<PipelineStep> executed = new ArrayList<>();
  private final Map<PipelineStep, Consumer<PipelineState>> behaviour =
      new EnumMap<>(PipelineStep.class);

  private FileSystemStateStore store;
  private PipelineEngine engine;

  @BeforeEach
  void setUp() {
    store = new FileSystemStateStore(tempDir, objectMapper, Clock.systemUTC());
    List<PipelineStage> stages = new ArrayList<>();
    for (PipelineStep step : PipelineStep.values()) {
      stages.add(new RecordingStage(step));
    }
    engine = new PipelineEngine(stages, store);
  }

  @Test
  void constructor_shouldRequireAStageForEveryStep() {
    List<PipelineStage> stages = List.of(new RecordingStage(PipelineStep.SCRIPT_GENERATION));

    assertThatThrownBy(() -> new PipelineEngine(stages, store))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("prosody-analysis");
  }

  @Test
  void runAll_shouldRunEveryStepInOrderAndSnapshotEach() {
    PipelineState result = engine.runAll(TestFixtures.request());

    assertThat(result.hasError()).isFalse();
    assertThat(executed).containsExactly(PipelineStep.values());
    assertThat(result.getCurrentStep()).isEqualTo(PipelineStep.AUDIO_MIXING);
    for (PipelineStep step : PipelineStep.values()) {
      assertThat(store.latest(step)).as("snapshot for %s", step).isPresent();
    }
    assertThat(store.list()).hasSize(PipelineStep.values().length);
  }

  @Test
  void runRange_shouldRejectEndBeforeStart() {
    assertThatThrownBy(
            () ->
                engine.runRange(
                    PipelineStep.AUDIO_MIXING,
                    PipelineStep.SCRIPT_GENERATION,
                    TestFixtures.request(),
                    null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(executed).isEmpty();
  }

  @Test
  void stageError_shouldHaltAndSkipLaterSnapshots() {
    behaviour.put(PipelineStep.PROSODY_PROFILE, state -> state.markFailed("profile broke"));

    PipelineState result = engine.runAll(TestFixtures.request());

    assertThat(result.getError()).isEqualTo("profile broke");
    assertThat(executed)
        .containsExactly(
            PipelineStep.SCRIPT_GENERATION,
            PipelineStep.PROSODY_ANALYSIS,
            PipelineStep.PROSODY_PROFILE);
    assertThat(store.latest(PipelineStep.PROSODY_PROFILE)).isPresent();
    assertThat(store.latest(PipelineStep.MARKUP_GENERATION)).isEmpty();
    assertThat(store.load(store.latest(PipelineStep.PROSODY_PROFILE).get()).getError())
        .isEqualTo("profile broke");
  }

  @Test
  void stageException_shouldBecomeErrorOnRecord() {
    behaviour.put(
        PipelineStep.PROSODY_ANALYSIS,
        state -> {
          throw new IllegalStateException("boom");
        });

    PipelineState result = engine.runAll(TestFixtures.request());

    assertThat(result.getError()).isEqualTo("Error in prosody-analysis: boom");
    assertThat(result.getCurrentStep()).isEqualTo(PipelineStep.PROSODY_ANALYSIS);
    assertThat(executed).hasSize(2);
  }

  @Test
  void runRange_shouldSeedFromPredecessorSnapshot() {
    behaviour.put(
        PipelineStep.SCRIPT_GENERATION,
        state -> state.setScript(new MeditationScript("Breathe in.", List.of())));
    engine.runRange(
        PipelineStep.SCRIPT_GENERATION,
        PipelineStep.SCRIPT_GENERATION,
        TestFixtures.request(),
        null);
    executed.clear();

    List<String> scriptsSeen = new ArrayList<>();
    behaviour.put(
        PipelineStep.PROSODY_ANALYSIS, state -> scriptsSeen.add(state.getScript().content()));

    PipelineState result =
        engine.runRange(PipelineStep.PROSODY_ANALYSIS, PipelineStep.PROSODY_ANALYSIS, null, null);

    assertThat(result.hasError()).isFalse();
    assertThat(scriptsSeen).containsExactly("Breathe in.");
    assertThat(executed).containsExactly(PipelineStep.PROSODY_ANALYSIS);
  }

  @Test
  void runRange_shouldFailOnCorruptPredecessorSnapshot() throws Exception {
    Files.writeString(tempDir.resolve("state_markup-review_20240301_000000_000.json"), "{broken");

    PipelineState result =
        engine.runRange(
            PipelineStep.SPEECH_SYNTHESIS,
            PipelineStep.AUDIO_MIXING,
            TestFixtures.request(),
            null);

    assertThat(result.getError())
        .startsWith("Error in speech-synthesis: failed to load snapshot")
        .contains("state_markup-review_20240301_000000_000.json");
    assertThat(executed).isEmpty();
    assertThat(store.latest(PipelineStep.SPEECH_SYNTHESIS)).isPresent();
  }

  @Test
  void runRange_shouldRequireSnapshotOrRequest() {
    assertThatThrownBy(
            () ->
                engine.runRange(PipelineStep.MARKUP_REVIEW, PipelineStep.AUDIO_MIXING, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("markup-generation");
  }

  @Test
  void runRange_shouldNotRunAFailedSeed() {
    PipelineState seed = PipelineState.start(TestFixtures.request());
    seed.markFailed("earlier failure");

    PipelineState result =
        engine.runRange(PipelineStep.SCRIPT_GENERATION, PipelineStep.AUDIO_MIXING, null, seed);

    assertThat(result).isSameAs(seed);
    assertThat(executed).isEmpty();
    assertThat(store.list()).isEmpty();
  }

  @Test
  void runStep_shouldRunExactlyOneStage() {
    PipelineState state = PipelineState.start(TestFixtures.request());

    engine.runStep(PipelineStep.MARKUP_GENERATION, state);

    assertThat(executed).containsExactly(PipelineStep.MARKUP_GENERATION);
    assertThat(store.list()).hasSize(1);
  }

  @Test
  void resumedRun_shouldMatchUninterruptedRun() throws Exception {
    behaviour.put(
        PipelineStep.SCRIPT_GENERATION,
        state -> state.setScript(new MeditationScript("Relax your jaw.", List.of())));
    behaviour.put(
        PipelineStep.MARKUP_GENERATION,
        state ->
            state.setMarkupOutput("<speak><p>" + state.getScript().content() + "</p></speak>"));
    behaviour.put(
        PipelineStep.SPEECH_SYNTHESIS, state -> state.recordNarration("narration.mp3"));

    PipelineState uninterrupted = engine.runAll(TestFixtures.request());

    engine.runRange(
        PipelineStep.SCRIPT_GENERATION, PipelineStep.MARKUP_REVIEW, TestFixtures.request(), null);
    PipelineState resumed =
        engine.runRange(PipelineStep.SPEECH_SYNTHESIS, PipelineStep.AUDIO_MIXING, null, null);

    assertThat(objectMapper.writeValueAsString(resumed))
        .isEqualTo(objectMapper.writeValueAsString(uninterrupted));
  }

  @Test
  void resumeFrom_shouldFailOnMissingSnapshot() {
    PipelineState result =
        engine.resumeFrom(
            "state_markup-review_20200101_000000_000.json",
            PipelineStep.SPEECH_SYNTHESIS,
            PipelineStep.AUDIO_MIXING);

    assertThat(result.getError()).startsWith("Failed to resume from");
    assertThat(executed).isEmpty();
  }

  @Test
  void runRange_shouldClearRunIdAfterwards() {
    engine.runAll(TestFixtures.request());

    assertThat(MDC.get("runId")).isNull();
  }

  private class RecordingStage implements PipelineStage {

    private final PipelineStep step;

    RecordingStage(PipelineStep step) {
      this.step = step;
    }

    @Override
    public PipelineStep step() {
      return step;
    }

    @Override
    public PipelineState apply(PipelineState state) {
      executed.add(step);
      assertThat(MDC.get("runId")).isNotBlank();
      behaviour.getOrDefault(step, s -> {}).accept(state);
      return state;
    }
  }
}
