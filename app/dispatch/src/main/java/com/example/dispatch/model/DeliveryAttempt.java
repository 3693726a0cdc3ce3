package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryAttempt(
    UUID logId, int attemptNumber, Instant attemptedAt, AttemptStatus status, String failureReason) {}
