/*
 * Where: Dispatch service layer
 * What: Appends domain events to outbox_events as JSON payloads
 * Why: Events commit or roll back together with the aggregate change that raised them
 */
package com.example.dispatch.service;

import com.example.common.TraceIds;
import com.example.common.event.DispatchEventPayload;
import com.example.dispatch.model.DomainEvent;
import com.example.dispatch.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
public class EventOutbox {

  private final OutboxEventRepository outboxEventRepository;
  private final ObjectMapper objectMapper;

  @Transactional(propagation = Propagation.MANDATORY)
  public void append(DomainEvent event) {
    final DispatchEventPayload payload =
        new DispatchEventPayload(
            event.eventId().toString(),
            event.type().eventName(),
            event.occurredAt().toString(),
            event.aggregateKey(),
            event.correlationId(),
            TraceIds.resolve(MDC.get("trace_id")),
            event.attributes());
    outboxEventRepository.insert(
        event.eventId(),
        event.type().eventName(),
        event.aggregateKey(),
        toJson(payload),
        event.occurredAt());
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void appendAll(List<DomainEvent> events) {
    for (DomainEvent event : events) {
      append(event);
    }
  }

  private String toJson(DispatchEventPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize outbox payload", ex);
    }
  }
}
