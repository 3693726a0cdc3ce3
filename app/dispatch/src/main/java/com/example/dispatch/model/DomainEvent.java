package com.example.dispatch.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record DomainEvent(
    UUID eventId,
    DomainEventType type,
    String aggregateKey,
    String correlationId,
    Instant occurredAt,
    Map<String, Object> attributes) {

  public DomainEvent {
    attributes =
        attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static DomainEvent of(
      DomainEventType type,
      String aggregateKey,
      String correlationId,
      Instant occurredAt,
      Map<String, Object> attributes) {
    return new DomainEvent(UUID.randomUUID(), type, aggregateKey, correlationId, occurredAt, attributes);
  }
}
