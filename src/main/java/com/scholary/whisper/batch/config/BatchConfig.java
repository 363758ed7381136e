package com.scholary.whisper.batch.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for batch run defaults.
 *
 * <p>Enables the BatchProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(BatchProperties.class)
public class BatchConfig {}
