package com.example.dispatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** How long a dedup key reservation is held before the same key may create a new request. */
@ConfigurationProperties(prefix = "dispatch.idempotency")
public record DispatchIdempotencyProperties(Duration ttl) {}
