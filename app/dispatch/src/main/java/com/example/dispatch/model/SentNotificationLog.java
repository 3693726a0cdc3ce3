/*
 * Where: Dispatch domain model
 * What: Delivery log for one (request, channel, address)
 * Why: Rendered content is captured once so retries resend identical messages
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record SentNotificationLog(
    UUID logId,
    UUID requestId,
    String notificationType,
    String recipientId,
    Channel channel,
    String address,
    String subject,
    String body,
    DeliveryStatus status,
    int attemptCount,
    Instant nextRetryAt,
    String providerMessageId,
    String lastFailureReason,
    Instant createdAt,
    Instant updatedAt) {

  public static String dispatchKey(UUID requestId, Channel channel, String address) {
    return requestId + ":" + channel.name() + ":" + address;
  }

  public String dispatchKey() {
    return dispatchKey(requestId, channel, address);
  }

  public String aggregateKey() {
    return "delivery:" + logId;
  }

  public RenderedMessage message() {
    return new RenderedMessage(subject, body);
  }

  SentNotificationLog with(
      DeliveryStatus nextStatus,
      int nextAttemptCount,
      Instant nextRetry,
      String nextProviderMessageId,
      String nextFailureReason,
      Instant now) {
    return new SentNotificationLog(
        logId,
        requestId,
        notificationType,
        recipientId,
        channel,
        address,
        subject,
        body,
        nextStatus,
        nextAttemptCount,
        nextRetry,
        nextProviderMessageId,
        nextFailureReason,
        createdAt,
        now);
  }
}
