/*
 * Where: pipeline configuration binding
 * What: email channel mode (log or smtp) and sender address
 */
package com.example.matrimony.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pipeline.channels.email")
@Validated
public record EmailChannelProperties(
    @DefaultValue("log") String mode, @NotBlank @DefaultValue("noreply@example.com") String fromAddress) {}
