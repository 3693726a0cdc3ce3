package com.example.dispatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch.template-cache")
public record DispatchTemplateCacheProperties(@Min(1) long maximumSize, @NotNull Duration ttl) {}
