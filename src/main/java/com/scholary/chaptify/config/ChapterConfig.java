package com.scholary.chaptify.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for chapter resolution.
 *
 * <p>Enables the ChapterProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ChapterProperties.class)
public class ChapterConfig {}
