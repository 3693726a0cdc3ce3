package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.SentNotificationLog;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryResponse(
    UUID logId,
    UUID requestId,
    String notificationType,
    String recipientId,
    Channel channel,
    String address,
    DeliveryStatus status,
    int attemptCount,
    Instant nextRetryAt,
    String providerMessageId,
    String lastFailureReason,
    Instant createdAt,
    Instant updatedAt) {

  public static DeliveryResponse from(SentNotificationLog log) {
    return new DeliveryResponse(
        log.logId(),
        log.requestId(),
        log.notificationType(),
        log.recipientId(),
        log.channel(),
        log.address(),
        log.status(),
        log.attemptCount(),
        log.nextRetryAt(),
        log.providerMessageId(),
        log.lastFailureReason(),
        log.createdAt(),
        log.updatedAt());
  }
}
