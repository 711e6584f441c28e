package com.scholary.livefeed.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for pipeline monitoring.
 *
 * <p>Links are pre-filtered on the MDC fields written by {@code StructuredLogger}.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.base-url:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.index-pattern:livefeed-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific processing job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    return discover(String.format("jobId:\"%s\"", jobId));
  }

  /**
   * Generate Kibana Discover URL for everything logged about one stream.
   *
   * @param streamId the stream ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateStreamUrl(String streamId) {
    return discover(String.format("streamId:\"%s\"", streamId));
  }

  private String discover(String query) {
    // Format: /app/discover#/?_a=(query:(language:kuery,query:'jobId:"abc-123"'))
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
