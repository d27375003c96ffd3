package com.scholary.meditation.api;

import com.scholary.meditation.api.JobStatusResponse.Status;
import com.scholary.meditation.job.JobRepository;
import com.scholary.meditation.job.PipelineJob;
import com.scholary.meditation.job.PipelineJobService;
import com.scholary.meditation.monitoring.KibanaUrlGenerator;
import com.scholary.meditation.state.PipelineStep;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for meditation generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a meditation run (returns a job ID immediately)
 *   <li>Resuming a run from a snapshot
 *   <li>Job status polling
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/meditations")
@Tag(name = "Meditations", description = "Guided meditation generation API")
public class MeditationController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MeditationController.class);

  private final PipelineJobService jobService;
  private final JobRepository jobRepository;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public MeditationController(
      PipelineJobService jobService,
      JobRepository jobRepository,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.jobService = jobService;
    this.jobRepository = jobRepository;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  /** Start an asynchronous meditation job. */
  @PostMapping
  @Operation(
      summary = "Start meditation",
      description =
          "Start an asynchronous pipeline run for the request and return a job ID for status"
              + " polling")
  public ResponseEntity<AsyncJobResponse> create(@Valid @RequestBody MeditationRunRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Meditation request: emotionalState={}, style={}, theme={}, duration={}m",
        request.emotionalState(),
        request.meditationStyle(),
        request.meditationTheme(),
        request.durationMinutes());

    PipelineJob job =
        new PipelineJob(
            jobId,
            request.toMeditationRequest(),
            PipelineStep.first(),
            request.effectiveEndStep());
    return submit(job);
  }

  /** Continue a run from one of its snapshots. */
  @PostMapping("/resume")
  @Operation(
      summary = "Resume meditation",
      description =
          "Start an asynchronous run of the given steps seeded from the named snapshot, and return"
              + " a job ID for status polling")
  public ResponseEntity<AsyncJobResponse> resume(@Valid @RequestBody ResumeRunRequest request) {
    if (request.startStep().isAfter(request.effectiveEndStep())) {
      return ResponseEntity.badRequest().build();
    }

    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Resume request: snapshot={}, steps {}..{}",
        request.snapshotId(),
        request.startStep(),
        request.effectiveEndStep());

    return submit(
        PipelineJob.resuming(
            jobId, request.snapshotId(), request.startStep(), request.effectiveEndStep()));
  }

  private ResponseEntity<AsyncJobResponse> submit(PipelineJob job) {
    String jobId = job.getJobId();
    jobRepository.save(job);

    try {
      jobService.processJobAsync(job);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job queue is full, rejecting job {}", jobId);
      jobRepository.delete(jobId);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    LOGGER.info("Created async meditation job: {}", jobId);
    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(jobId, kibanaUrlGenerator.generateJobUrl(jobId)));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. Finished jobs include the audio output.
   */
  @GetMapping("/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a meditation job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
    return jobRepository
        .findById(jobId)
        .map(job -> ResponseEntity.ok(toResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  private JobStatusResponse toResponse(PipelineJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getCurrentStep() == null ? null : job.getCurrentStep().id(),
        job.getAudioOutput(),
        job.getWarnings(),
        job.getError(),
        kibanaUrlGenerator.generateJobUrl(job.getJobId()),
        job.getStatus() == Status.FAILED
            ? kibanaUrlGenerator.generateJobFailuresUrl(job.getJobId())
            : null);
  }
}
