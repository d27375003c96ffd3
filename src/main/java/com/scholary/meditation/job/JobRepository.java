package com.scholary.meditation.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for meditation jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs are evicted by size and age. Only job status lives
 * here; the run itself is checkpointed by the state store.
 */
@Repository
public class JobRepository {

  private final Cache<String, PipelineJob> cache;

  public JobRepository(
      @Value("${meditation.jobs.maxSize}") int maxSize,
      @Value("${meditation.jobs.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PipelineJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<PipelineJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
