package com.scholary.inference.config;

import com.scholary.inference.model.ModelBackendProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the model backend client.
 *
 * <p>Enables the ModelBackendProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ModelBackendProperties.class)
public class ModelBackendConfig {}
