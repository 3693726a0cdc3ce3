package com.example.dispatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch.requests")
public record DispatchRequestProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int batchSize,
    @Min(1) int reconcileMaxRetries,
    @NotNull Duration fanoutTimeout) {}
