package com.example.dispatch.api;

import com.example.dispatch.model.AttemptStatus;
import com.example.dispatch.model.DeliveryAttempt;
import com.example.dispatch.model.SentNotificationLog;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveriesResponse(List<DeliveryResponse> deliveries, List<Attempt> attempts) {

  public DeliveriesResponse {
    deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Attempt(
      UUID logId,
      int attemptNumber,
      Instant attemptedAt,
      AttemptStatus status,
      String failureReason) {

    static Attempt from(DeliveryAttempt attempt) {
      return new Attempt(
          attempt.logId(),
          attempt.attemptNumber(),
          attempt.attemptedAt(),
          attempt.status(),
          attempt.failureReason());
    }
  }

  public static DeliveriesResponse of(
      List<SentNotificationLog> logs, List<DeliveryAttempt> attempts) {
    return new DeliveriesResponse(
        logs.stream().map(DeliveryResponse::from).toList(),
        attempts.stream().map(Attempt::from).toList());
  }
}
