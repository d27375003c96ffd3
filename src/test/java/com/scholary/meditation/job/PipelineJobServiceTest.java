package com.scholary.meditation.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.meditation.TestFixtures;
import com.scholary.meditation.api.JobStatusResponse.Status;
import com.scholary.meditation.pipeline.PipelineEngine;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineState;
import com.scholary.meditation.state.PipelineStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class PipelineJobServiceTest {

  @Mock private PipelineEngine engine;

  private final JobRepository jobRepository = new JobRepository(10, 5);
  private final MeditationRequest request = TestFixtures.request();
  private PipelineJobService service;
  private PipelineJob job;

  @BeforeEach
  void setUp() {
    service = new PipelineJobService(engine, jobRepository);
    job = new PipelineJob("job-42", request, PipelineStep.first(), PipelineStep.last());
    jobRepository.save(job);
  }

  @Test
  void run_shouldCompleteJobWithAudioOutput() {
    PipelineState result = PipelineState.start(request);
    result.recordNarration("audio/voice.mp3");
    result.recordMix("soundscapes/forest.mp3", "audio/mixed.mp3", null);
    result.addWarning("Template prosody profile used; the generated profile was unusable");
    result.setCurrentStep(PipelineStep.AUDIO_MIXING);
    when(engine.runRange(
            eq(PipelineStep.SCRIPT_GENERATION), eq(PipelineStep.AUDIO_MIXING), eq(request), any()))
        .thenReturn(result);

    service.run(job);

    PipelineJob stored = jobRepository.findById("job-42").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(stored.getProgress()).isEqualTo(100);
    assertThat(stored.getCurrentStep()).isEqualTo(PipelineStep.AUDIO_MIXING);
    assertThat(stored.getAudioOutput().getMixedFile()).isEqualTo("audio/mixed.mp3");
    assertThat(stored.getWarnings()).hasSize(1);
    assertThat(stored.getError()).isNull();
    assertThat(MDC.get("jobId")).isNull();
  }

  @Test
  void run_shouldSeedResumedJobFromItsOwnSnapshot() {
    PipelineJob resumed =
        PipelineJob.resuming(
            "job-43",
            "state_markup-review_20240301_101530_123.json",
            PipelineStep.SPEECH_SYNTHESIS,
            PipelineStep.AUDIO_MIXING);
    jobRepository.save(resumed);
    PipelineState result = PipelineState.start(request);
    result.recordNarration("audio/voice.mp3");
    result.recordMix("soundscapes/forest.mp3", "audio/mixed.mp3", null);
    result.setCurrentStep(PipelineStep.AUDIO_MIXING);
    when(engine.resumeFrom(
            "state_markup-review_20240301_101530_123.json",
            PipelineStep.SPEECH_SYNTHESIS,
            PipelineStep.AUDIO_MIXING))
        .thenReturn(result);

    service.run(resumed);

    PipelineJob stored = jobRepository.findById("job-43").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(stored.getAudioOutput().getMixedFile()).isEqualTo("audio/mixed.mp3");
    verify(engine, never()).runRange(any(), any(), any(), any());
  }

  @Test
  void run_shouldFailJobWithPipelineError() {
    PipelineState result = PipelineState.start(request);
    result.setCurrentStep(PipelineStep.SPEECH_SYNTHESIS);
    result.markFailed("Speech synthesis failed: throttled");
    when(engine.runRange(any(), any(), any(), any())).thenReturn(result);

    service.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("Speech synthesis failed: throttled");
    assertThat(job.getCurrentStep()).isEqualTo(PipelineStep.SPEECH_SYNTHESIS);
    assertThat(job.getProgress()).isEqualTo(10);
  }

  @Test
  void run_shouldFailJobWhenEngineThrows() {
    when(engine.runRange(any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("state directory is not writable"));

    service.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("state directory is not writable");
  }
}
