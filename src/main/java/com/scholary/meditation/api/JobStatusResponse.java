package com.scholary.meditation.api;

import com.scholary.meditation.state.AudioOutput;
import java.util.List;

/**
 * Response for a job status query.
 *
 * <p>Shows the current state of an async job. Once the run has finished, {@code audioOutput} holds
 * the produced files; a failed run carries the error from the state record. {@code failuresUrl} is
 * only set for failed jobs.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    String currentStep,
    AudioOutput audioOutput,
    List<String> warnings,
    String error,
    String kibanaUrl,
    String failuresUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
