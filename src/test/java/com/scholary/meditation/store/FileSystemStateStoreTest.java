package com.scholary.meditation.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemStateStoreTest {

  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2024-03-01T10:15:30.123Z"), ZoneOffset.UTC);

  @TempDir Path tempDir;

  private FileSystemStateStore store;

  @BeforeEach
  void setUp() {
    store =
        new FileSystemStateStore(
            tempDir.resolve("state"), TestFixtures.objectMapper(), FIXED_CLOCK);
  }

  @Test
  void save_shouldNameSnapshotAfterStepAndTimestamp() {
    String id =
        store.save(PipelineState.start(TestFixtures.request()), PipelineStep.MARKUP_REVIEW);

    assertThat(id).isEqualTo("state_markup-review_20240301_101530_123.json");
    assertThat(Files.exists(tempDir.resolve("state").resolve(id))).isTrue();
  }

  @Test
  void save_shouldNeverReuseATimestampWithinTheSameMillisecond() {
    PipelineState state = PipelineState.start(TestFixtures.request());

    String first = store.save(state, PipelineStep.SCRIPT_GENERATION);
    String second = store.save(state, PipelineStep.SCRIPT_GENERATION);
    String third = store.save(state, PipelineStep.SCRIPT_GENERATION);

    assertThat(List.of(first, second, third)).doesNotHaveDuplicates().isSorted();
    assertThat(second).isEqualTo("state_script-generation_20240301_101530_124.json");
    assertThat(store.latest(PipelineStep.SCRIPT_GENERATION)).contains(third);
  }

  @Test
  void save_shouldSkipNamesTakenByAnotherWriter() throws Exception {
    Path dir = tempDir.resolve("state");
    Files.createDirectories(dir);
    Files.writeString(dir.resolve("state_script-generation_20240301_101530_123.json"), "{}");

    String id =
        store.save(PipelineState.start(TestFixtures.request()), PipelineStep.SCRIPT_GENERATION);

    assertThat(id).isEqualTo("state_script-generation_20240301_101530_124.json");
  }

  @Test
  void save_shouldKeepNamesInTimeOrderWhenLocalClocksFallBack() {
    ZoneId newYork = ZoneId.of("America/New_York");
    PipelineState state = PipelineState.start(TestFixtures.request());
    Path dir = tempDir.resolve("state");

    // 01:30 EDT, then 01:10 EST forty minutes later
    String older =
        new FileSystemStateStore(
                dir,
                TestFixtures.objectMapper(),
                Clock.fixed(Instant.parse("2024-11-03T05:30:00Z"), newYork))
            .save(state, PipelineStep.SCRIPT_GENERATION);
    FileSystemStateStore laterRun =
        new FileSystemStateStore(
            dir,
            TestFixtures.objectMapper(),
            Clock.fixed(Instant.parse("2024-11-03T06:10:00Z"), newYork));
    String newer = laterRun.save(state, PipelineStep.SCRIPT_GENERATION);

    assertThat(older).isEqualTo("state_script-generation_20241103_053000_000.json");
    assertThat(newer).isEqualTo("state_script-generation_20241103_061000_000.json");
    assertThat(laterRun.latest(PipelineStep.SCRIPT_GENERATION)).contains(newer);
  }

  @Test
  void load_shouldRestoreSavedState() {
    PipelineState state = PipelineState.start(TestFixtures.request());
    state.setMarkupOutput("<speak><p>Breathe.</p></speak>");
    String id = store.save(state, PipelineStep.MARKUP_GENERATION);

    PipelineState loaded = store.load(id);

    assertThat(loaded.getRequest()).isEqualTo(TestFixtures.request());
    assertThat(loaded.getMarkupOutput()).isEqualTo("<speak><p>Breathe.</p></speak>");
  }

  @Test
  void load_shouldAcceptIdWithoutExtension() {
    String id =
        store.save(PipelineState.start(TestFixtures.request()), PipelineStep.PROSODY_PROFILE);

    PipelineState loaded = store.load(id.replace(".json", ""));

    assertThat(loaded.getRequest()).isEqualTo(TestFixtures.request());
  }

  @Test
  void load_shouldReportMissingSnapshot() {
    assertThatThrownBy(() -> store.load("state_audio-mixing_20240101_000000_000.json"))
        .isInstanceOf(SnapshotNotFoundException.class);
  }

  @Test
  void load_shouldReportCorruptSnapshotAsLoadFailure() throws Exception {
    Path dir = tempDir.resolve("state");
    Files.createDirectories(dir);
    Files.writeString(dir.resolve("state_prosody-analysis_20240301_000000_000.json"), "{not json");

    assertThatThrownBy(() -> store.load("state_prosody-analysis_20240301_000000_000.json"))
        .isInstanceOf(StateStoreException.class)
        .isNotInstanceOf(SnapshotNotFoundException.class);
  }

  @Test
  void latest_shouldPreferFurthestStepOverNewestFile() throws Exception {
    Path dir = tempDir.resolve("state");
    Files.createDirectories(dir);
    Files.writeString(dir.resolve("state_speech-synthesis_20240101_000000_000.json"), "{}");
    Files.writeString(dir.resolve("state_script-generation_20240301_000000_000.json"), "{}");

    assertThat(store.latest()).contains("state_speech-synthesis_20240101_000000_000.json");
    assertThat(store.latest(PipelineStep.AUDIO_MIXING)).isEmpty();
  }

  @Test
  void list_shouldSortByTimestamp() throws Exception {
    Path dir = tempDir.resolve("state");
    Files.createDirectories(dir);
    Files.writeString(dir.resolve("state_prosody-analysis_20240301_000000_002.json"), "{}");
    Files.writeString(dir.resolve("state_script-generation_20240301_000000_001.json"), "{}");
    Files.writeString(dir.resolve("notes.txt"), "ignored");

    assertThat(store.list())
        .containsExactly(
            "state_script-generation_20240301_000000_001.json",
            "state_prosody-analysis_20240301_000000_002.json");
  }

  @Test
  void queries_shouldReturnEmptyForMissingDirectory() {
    assertThat(store.list()).isEmpty();
    assertThat(store.latest()).isEmpty();
    assertThat(store.latest(PipelineStep.SCRIPT_GENERATION)).isEmpty();
  }
}
