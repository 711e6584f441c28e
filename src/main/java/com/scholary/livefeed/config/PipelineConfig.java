package com.scholary.livefeed.config;

import com.scholary.livefeed.chunking.ChunkingProperties;
import com.scholary.livefeed.queue.QueueProperties;
import com.scholary.livefeed.retention.RetentionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the analysis path: chunk extraction, the processing queue and retention.
 */
@Configuration
@EnableConfigurationProperties({
  ChunkingProperties.class,
  QueueProperties.class,
  RetentionProperties.class
})
public class PipelineConfig {}
