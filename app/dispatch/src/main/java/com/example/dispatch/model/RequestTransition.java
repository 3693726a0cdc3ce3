package com.example.dispatch.model;

import java.util.List;

/** New request snapshot plus the events that the transition raised. */
public record RequestTransition(NotificationRequest request, List<DomainEvent> events) {

  public RequestTransition {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
