package com.example.dispatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch.delivery")
public record DispatchDeliveryProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int batchSize,
    @Min(1) int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Min(16) int errorMessageMaxLength,
    @NotNull Duration lease,
    @NotNull Duration gatewayTimeout) {}
