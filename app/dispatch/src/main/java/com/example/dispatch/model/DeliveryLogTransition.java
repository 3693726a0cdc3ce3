package com.example.dispatch.model;

import java.util.List;

/** Result of a delivery log transition; {@code attempt} is null when no gateway call was made. */
public record DeliveryLogTransition(
    SentNotificationLog log, DeliveryAttempt attempt, List<DomainEvent> events) {

  public DeliveryLogTransition {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
