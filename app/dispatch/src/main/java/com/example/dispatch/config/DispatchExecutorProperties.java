package com.example.dispatch.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Bounds of the fan-out and gateway-call thread pools. */
@Validated
@ConfigurationProperties(prefix = "dispatch.executor")
public record DispatchExecutorProperties(
    @Min(1) int fanoutPoolSize,
    @Min(1) int gatewayPoolSize,
    @Min(0) int queueCapacity) {}
