package com.example.dispatch.model;

import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId, String eventType, String aggregateKey, String payloadJson, int attemptCount) {}
