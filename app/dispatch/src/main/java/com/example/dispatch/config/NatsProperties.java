package com.example.dispatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Connection settings; {@code enabled=false} skips every NATS bean. */
@Validated
@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled,
    @NotBlank String url,
    @NotBlank String connectionName,
    @NotNull Duration connectionTimeout,
    @Min(-1) int maxReconnects) {}
