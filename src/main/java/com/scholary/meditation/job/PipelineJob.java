package com.scholary.meditation.job;

import com.scholary.meditation.api.JobStatusResponse.Status;
import com.scholary.meditation.state.AudioOutput;
import com.scholary.meditation.state.MeditationRequest;
import com.scholary.meditation.state.PipelineStep;
import java.time.Instant;
import java.util.List;

/**
 * Represents an async meditation job.
 *
 * <p>Tracks the job's state, progress, and the outcome of its pipeline run. Stored in memory using
 * Caffeine cache.
 */
public class PipelineJob {

  private final String jobId;
  private final MeditationRequest request;
  private final String resumeFrom;
  private final PipelineStep startStep;
  private final PipelineStep endStep;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile PipelineStep currentStep;
  private volatile AudioOutput audioOutput;
  private volatile List<String> warnings = List.of();
  private volatile String error;

  public PipelineJob(
      String jobId, MeditationRequest request, PipelineStep startStep, PipelineStep endStep) {
    this(jobId, request, null, startStep, endStep);
  }

  private PipelineJob(
      String jobId,
      MeditationRequest request,
      String resumeFrom,
      PipelineStep startStep,
      PipelineStep endStep) {
    this.jobId = jobId;
    this.request = request;
    this.resumeFrom = resumeFrom;
    this.startStep = startStep;
    this.endStep = endStep;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public MeditationRequest getRequest() {
    return request;
  }

  /** A job that continues from the given snapshot; its request comes from the snapshot. */
  public static PipelineJob resuming(
      String jobId, String snapshotId, PipelineStep startStep, PipelineStep endStep) {
    return new PipelineJob(jobId, null, snapshotId, startStep, endStep);
  }

  /** Snapshot the job resumes from, or {@code null} for a fresh run. */
  public String getResumeFrom() {
    return resumeFrom;
  }

  public boolean isResume() {
    return resumeFrom != null;
  }

  public PipelineStep getStartStep() {
    return startStep;
  }

  public PipelineStep getEndStep() {
    return endStep;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public PipelineStep getCurrentStep() {
    return currentStep;
  }

  public void setCurrentStep(PipelineStep currentStep) {
    this.currentStep = currentStep;
  }

  public AudioOutput getAudioOutput() {
    return audioOutput;
  }

  public void setAudioOutput(AudioOutput audioOutput) {
    this.audioOutput = audioOutput;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public void setWarnings(List<String> warnings) {
    this.warnings = List.copyOf(warnings);
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
