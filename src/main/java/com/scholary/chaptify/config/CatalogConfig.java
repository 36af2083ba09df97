package com.scholary.chaptify.config;

import com.scholary.chaptify.catalog.CatalogProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the catalog client.
 *
 * <p>Enables the CatalogProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogConfig {}
