package com.scholary.meditation.job;

import com.scholary.meditation.api.JobStatusResponse.Status;
import com.scholary.meditation.logging.StructuredLogger;
import com.scholary.meditation.pipeline.PipelineEngine;
import com.scholary.meditation.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs meditation jobs on the task executor.
 *
 * <p>A job starts from a fresh state record for its own request, or from the one snapshot it names.
 * It never picks up another run's latest snapshot. The job id is put in the MDC for the whole run.
 */
@Service
public class PipelineJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineJobService.class);

  private final PipelineEngine engine;
  private final JobRepository jobRepository;

  public PipelineJobService(PipelineEngine engine, JobRepository jobRepository) {
    this.engine = engine;
    this.jobRepository = jobRepository;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>This runs in the "taskExecutor" pool. The job status is updated when processing starts and
   * when the run ends.
   */
  @Async
  public void processJobAsync(PipelineJob job) {
    run(job);
  }

  void run(PipelineJob job) {
    StructuredLogger.setJobContext(job.getJobId());
    try {
      LOGGER.info(
          "Starting job {}: steps {}..{}", job.getJobId(), job.getStartStep(), job.getEndStep());
      job.setStatus(Status.PROCESSING);
      job.setProgress(10);
      job.setCurrentStep(job.getStartStep());
      jobRepository.save(job);

      PipelineState result =
          job.isResume()
              ? engine.resumeFrom(job.getResumeFrom(), job.getStartStep(), job.getEndStep())
              : engine.runRange(
                  job.getStartStep(),
                  job.getEndStep(),
                  job.getRequest(),
                  PipelineState.start(job.getRequest()));

      job.setCurrentStep(result.getCurrentStep());
      job.setAudioOutput(result.getAudioOutput());
      job.setWarnings(result.getWarnings());
      if (result.hasError()) {
        job.setStatus(Status.FAILED);
        job.setError(result.getError());
        LOGGER.warn("Job {} failed: {}", job.getJobId(), result.getError());
      } else {
        job.setStatus(Status.COMPLETED);
        job.setProgress(100);
        LOGGER.info("Completed job {}", job.getJobId());
      }
      jobRepository.save(job);

    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
