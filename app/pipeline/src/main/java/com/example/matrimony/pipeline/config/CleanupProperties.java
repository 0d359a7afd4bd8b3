/*
 * Where: pipeline configuration binding
 * What: allowlist of tables the database_cleanup job may touch
 */
package com.example.matrimony.pipeline.config;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.cleanup")
@Validated
public record CleanupProperties(@NotEmpty List<String> allowedCollections) {}
