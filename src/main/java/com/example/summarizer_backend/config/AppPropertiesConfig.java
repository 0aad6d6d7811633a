package com.example.summarizer_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, ComposeProperties.class})
public class AppPropertiesConfig {
}
