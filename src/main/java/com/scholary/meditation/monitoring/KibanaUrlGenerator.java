package com.scholary.meditation.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for following a meditation job in the logs.
 *
 * <p>Job threads carry the job id in the MDC, so filtering on it shows every step event of the run.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:meditation-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    return discoverUrl(String.format("jobId:\"%s\"", jobId));
  }

  /** Kibana URL listing the step failures of a job. */
  public String generateJobFailuresUrl(String jobId) {
    return discoverUrl(String.format("jobId:\"%s\" and event_type:\"step_failed\"", jobId));
  }

  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    // Format: /app/discover#/?_a=(index:'...',query:(language:kuery,query:'jobId:"abc-123"'))
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
