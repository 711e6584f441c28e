package com.scholary.livefeed.config;

import com.scholary.livefeed.detection.DetectionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the detection pipeline client.
 *
 * <p>Enables the DetectionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(DetectionProperties.class)
public class DetectionConfig {}
