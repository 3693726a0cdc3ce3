/*
 * Where: Dispatch domain model
 * What: Pure transitions of the sent notification log
 * Why: Keeps status monotonic and attempt timestamps ordered without touching storage
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DeliveryLogTransitions {

  public static final String CANCELED_REASON = "canceled";

  private DeliveryLogTransitions() {}

  public static DomainEvent readyToDispatch(SentNotificationLog log, String correlationId) {
    return event(DomainEventType.NOTIFICATION_READY_TO_DISPATCH, log, correlationId, log.createdAt(), null);
  }

  /**
   * Gateway accepted the message. Channels without delivery receipts are treated as delivered on
   * acceptance.
   */
  public static DeliveryLogTransition recordSuccess(
      SentNotificationLog log,
      String providerMessageId,
      boolean deliveryReceipts,
      String correlationId,
      Instant now) {
    final Instant attemptedAt = requireAttemptable(log, now);
    final DeliveryStatus nextStatus = deliveryReceipts ? DeliveryStatus.SENT : DeliveryStatus.DELIVERED;
    final int attemptNumber = log.attemptCount() + 1;
    final SentNotificationLog next =
        log.with(nextStatus, attemptNumber, null, providerMessageId, log.lastFailureReason(), attemptedAt);
    final DeliveryAttempt attempt =
        new DeliveryAttempt(log.logId(), attemptNumber, attemptedAt, AttemptStatus.SENT, null);
    final List<DomainEvent> events = new ArrayList<>();
    events.add(attempted(next, attempt, correlationId));
    final Map<String, Object> sentAttributes = new LinkedHashMap<>();
    if (providerMessageId != null) {
      sentAttributes.put("provider_message_id", providerMessageId);
    }
    events.add(
        event(
            DomainEventType.NOTIFICATION_SENT_TO_CHANNEL, next, correlationId, attemptedAt, sentAttributes));
    if (!deliveryReceipts) {
      events.add(event(DomainEventType.NOTIFICATION_DELIVERED, next, correlationId, attemptedAt, null));
    }
    return new DeliveryLogTransition(next, attempt, events);
  }

  /** Transient failure: schedules the next retry, or fails the log once attempts are exhausted. */
  public static DeliveryLogTransition recordTransientFailure(
      SentNotificationLog log,
      String reason,
      Instant nextRetryAt,
      int maxAttempts,
      String correlationId,
      Instant now) {
    final Instant attemptedAt = requireAttemptable(log, now);
    final int attemptNumber = log.attemptCount() + 1;
    final DeliveryAttempt attempt =
        new DeliveryAttempt(
            log.logId(), attemptNumber, attemptedAt, AttemptStatus.TRANSIENT_FAILURE, reason);
    if (attemptNumber >= maxAttempts) {
      final SentNotificationLog failed =
          log.with(DeliveryStatus.FAILED, attemptNumber, null, null, reason, attemptedAt);
      return new DeliveryLogTransition(
          failed,
          attempt,
          List.of(
              attempted(failed, attempt, correlationId),
              deliveryFailed(failed, "retries exhausted: " + reason, correlationId, attemptedAt)));
    }
    final SentNotificationLog next =
        log.with(
            DeliveryStatus.QUEUED_FOR_DISPATCH, attemptNumber, nextRetryAt, null, reason, attemptedAt);
    return new DeliveryLogTransition(next, attempt, List.of(attempted(next, attempt, correlationId)));
  }

  /**
   * Transient failure on a request that was canceled meanwhile. The attempt is kept, the log
   * fails as canceled instead of being queued again.
   */
  public static DeliveryLogTransition recordCanceledAfterAttempt(
      SentNotificationLog log, String reason, String correlationId, Instant now) {
    final Instant attemptedAt = requireAttemptable(log, now);
    final int attemptNumber = log.attemptCount() + 1;
    final DeliveryAttempt attempt =
        new DeliveryAttempt(
            log.logId(), attemptNumber, attemptedAt, AttemptStatus.TRANSIENT_FAILURE, reason);
    final SentNotificationLog failed =
        log.with(DeliveryStatus.FAILED, attemptNumber, null, null, CANCELED_REASON, attemptedAt);
    return new DeliveryLogTransition(
        failed,
        attempt,
        List.of(
            attempted(failed, attempt, correlationId),
            deliveryFailed(failed, CANCELED_REASON, correlationId, attemptedAt)));
  }

  public static DeliveryLogTransition recordPermanentFailure(
      SentNotificationLog log, String reason, String correlationId, Instant now) {
    final Instant attemptedAt = requireAttemptable(log, now);
    final int attemptNumber = log.attemptCount() + 1;
    final DeliveryAttempt attempt =
        new DeliveryAttempt(
            log.logId(), attemptNumber, attemptedAt, AttemptStatus.PERMANENT_FAILURE, reason);
    final SentNotificationLog failed =
        log.with(DeliveryStatus.FAILED, attemptNumber, null, null, reason, attemptedAt);
    return new DeliveryLogTransition(
        failed,
        attempt,
        List.of(
            attempted(failed, attempt, correlationId),
            deliveryFailed(failed, reason, correlationId, attemptedAt)));
  }

  public static DeliveryLogTransition confirmDelivery(
      SentNotificationLog log, String correlationId, Instant now) {
    return advance(log, DeliveryStatus.DELIVERED, DomainEventType.NOTIFICATION_DELIVERED, correlationId, now);
  }

  public static DeliveryLogTransition markRead(
      SentNotificationLog log, String correlationId, Instant now) {
    return advance(log, DeliveryStatus.READ, DomainEventType.NOTIFICATION_READ, correlationId, now);
  }

  /** Fails a queued log that has not been sent yet. No attempt is recorded. */
  public static DeliveryLogTransition cancel(
      SentNotificationLog log, String correlationId, Instant now) {
    if (log.status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
      throw new InvalidStateTransitionException(
          "cannot cancel delivery " + log.logId() + " in status " + log.status());
    }
    final Instant at = notBefore(log, now);
    final SentNotificationLog failed =
        log.with(DeliveryStatus.FAILED, log.attemptCount(), null, null, CANCELED_REASON, at);
    return new DeliveryLogTransition(
        failed, null, List.of(deliveryFailed(failed, CANCELED_REASON, correlationId, at)));
  }

  private static DeliveryLogTransition advance(
      SentNotificationLog log,
      DeliveryStatus target,
      DomainEventType eventType,
      String correlationId,
      Instant now) {
    if (!log.status().canAdvanceTo(target)) {
      throw new InvalidStateTransitionException(
          "cannot move delivery " + log.logId() + " from " + log.status() + " to " + target);
    }
    if (log.status() == DeliveryStatus.QUEUED_FOR_DISPATCH) {
      throw new InvalidStateTransitionException(
          "delivery " + log.logId() + " has not been sent yet");
    }
    final Instant at = notBefore(log, now);
    final SentNotificationLog next =
        log.with(
            target,
            log.attemptCount(),
            null,
            log.providerMessageId(),
            log.lastFailureReason(),
            at);
    return new DeliveryLogTransition(next, null, List.of(event(eventType, next, correlationId, at, null)));
  }

  private static Instant requireAttemptable(SentNotificationLog log, Instant now) {
    if (log.status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
      throw new InvalidStateTransitionException(
          "delivery " + log.logId() + " is " + log.status() + " and cannot be attempted");
    }
    return notBefore(log, now);
  }

  // attempts on one log are strictly time-ordered even if clocks drift between nodes
  private static Instant notBefore(SentNotificationLog log, Instant now) {
    final Instant last = log.updatedAt();
    if (last != null && !now.isAfter(last)) {
      return last.plusMillis(1);
    }
    return now;
  }

  private static DomainEvent attempted(
      SentNotificationLog log, DeliveryAttempt attempt, String correlationId) {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("attempt_number", attempt.attemptNumber());
    attributes.put("attempt_status", attempt.status().name());
    if (attempt.failureReason() != null) {
      attributes.put("reason", attempt.failureReason());
    }
    return event(
        DomainEventType.NOTIFICATION_DISPATCH_ATTEMPTED,
        log,
        correlationId,
        attempt.attemptedAt(),
        attributes);
  }

  private static DomainEvent deliveryFailed(
      SentNotificationLog log, String reason, String correlationId, Instant at) {
    return event(
        DomainEventType.NOTIFICATION_DELIVERY_FAILED, log, correlationId, at, Map.of("reason", reason));
  }

  private static DomainEvent event(
      DomainEventType type,
      SentNotificationLog log,
      String correlationId,
      Instant occurredAt,
      Map<String, Object> extra) {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("log_id", log.logId().toString());
    attributes.put("request_id", log.requestId().toString());
    attributes.put("recipient_id", log.recipientId());
    attributes.put("channel", log.channel().name());
    attributes.put("status", log.status().name());
    if (extra != null) {
      attributes.putAll(extra);
    }
    return DomainEvent.of(type, log.aggregateKey(), correlationId, occurredAt, attributes);
  }
}
