package com.scholary.livefeed.config;

import com.scholary.livefeed.health.HealthProperties;
import com.scholary.livefeed.supervisor.SupervisorProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the playback path: transcoder supervision and stream health checks.
 *
 * <p>Enables the SupervisorProperties and HealthProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({SupervisorProperties.class, HealthProperties.class})
public class SupervisorConfig {}
