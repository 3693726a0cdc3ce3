/*
 * Where: Dispatch domain model
 * What: State machine of the notification request aggregate as pure functions
 * Why: Each function returns the next snapshot and exactly one event, with no I/O
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class NotificationRequestTransitions {

  private NotificationRequestTransitions() {}

  public static NotificationRequest newRequest(
      UUID requestId,
      CreateNotificationCommand command,
      Map<Channel, UUID> pinnedTemplateIds,
      Instant now) {
    final List<Recipient> recipients =
        command.recipients().stream().map(r -> Recipient.of(r.id(), r.addresses())).toList();
    final Instant firstEvaluation =
        command.scheduledAt() != null && command.scheduledAt().isAfter(now) ? command.scheduledAt() : now;
    return new NotificationRequest(
        requestId,
        command.type(),
        command.payload(),
        recipients,
        command.channelPreferences(),
        command.urgency(),
        command.scheduledAt(),
        command.correlationId(),
        command.dedupKey(),
        RequestStatus.PENDING,
        null,
        pinnedTemplateIds,
        firstEvaluation,
        0L,
        now,
        now);
  }

  public static DomainEvent requested(NotificationRequest request) {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("request_id", request.requestId().toString());
    attributes.put("type", request.type());
    attributes.put("urgency", request.urgency().name());
    attributes.put("recipient_count", request.recipients().size());
    return event(DomainEventType.NOTIFICATION_REQUESTED, request, request.createdAt(), attributes);
  }

  /** PENDING -> PROCESSING once at least one recipient has an allowed channel. */
  public static RequestTransition startProcessing(
      NotificationRequest request, List<Recipient> plannedRecipients, Instant now) {
    requireStatus(request, RequestStatus.PENDING, "startProcessing");
    final NotificationRequest next =
        request.with(RequestStatus.PROCESSING, null, plannedRecipients, null, now);
    return new RequestTransition(
        next,
        List.of(
            event(
                DomainEventType.NOTIFICATION_PROCESSING_STARTED,
                next,
                now,
                Map.of("request_id", next.requestId().toString()))));
  }

  /** PENDING -> BLOCKED when policy allows no channel for any recipient. */
  public static RequestTransition block(
      NotificationRequest request, List<Recipient> blockedRecipients, String reason, Instant now) {
    requireStatus(request, RequestStatus.PENDING, "block");
    final NotificationRequest next =
        request.with(RequestStatus.BLOCKED, reason, blockedRecipients, null, now);
    return new RequestTransition(
        next,
        List.of(
            event(
                DomainEventType.NOTIFICATION_BLOCKED,
                next,
                now,
                Map.of("request_id", next.requestId().toString(), "reason", reason))));
  }

  /** Stays PENDING; only the next evaluation time moves. Not a transition, so no event. */
  public static RequestTransition defer(NotificationRequest request, Instant until, Instant now) {
    requireStatus(request, RequestStatus.PENDING, "defer");
    final NotificationRequest next =
        request.with(RequestStatus.PENDING, null, request.recipients(), until, now);
    return new RequestTransition(next, List.of());
  }

  /** Records per-recipient progress while PROCESSING. Not a status change, so no event. */
  public static RequestTransition updateOutcomes(
      NotificationRequest request, List<Recipient> recipients, Instant now) {
    requireStatus(request, RequestStatus.PROCESSING, "updateOutcomes");
    return new RequestTransition(
        request.with(RequestStatus.PROCESSING, null, recipients, null, now), List.of());
  }

  public static RequestTransition markAsCompleted(
      NotificationRequest request, List<Recipient> settledRecipients, Instant now) {
    requireStatus(request, RequestStatus.PROCESSING, "markAsCompleted");
    final NotificationRequest next =
        request.with(RequestStatus.COMPLETED, null, settledRecipients, null, now);
    final long succeeded =
        settledRecipients.stream().filter(r -> r.outcome() == RecipientOutcome.SUCCEEDED).count();
    return new RequestTransition(
        next,
        List.of(
            event(
                DomainEventType.NOTIFICATION_COMPLETED,
                next,
                now,
                Map.of(
                    "request_id", next.requestId().toString(),
                    "succeeded_recipients", succeeded,
                    "total_recipients", settledRecipients.size()))));
  }

  public static RequestTransition markAsFailed(
      NotificationRequest request, List<Recipient> settledRecipients, String reason, Instant now) {
    requireStatus(request, RequestStatus.PROCESSING, "markAsFailed");
    final NotificationRequest next =
        request.with(RequestStatus.FAILED, reason, settledRecipients, null, now);
    return new RequestTransition(
        next,
        List.of(
            event(
                DomainEventType.NOTIFICATION_FAILED,
                next,
                now,
                Map.of("request_id", next.requestId().toString(), "reason", reason))));
  }

  public static RequestTransition cancel(NotificationRequest request, Instant now) {
    requireStatus(request, RequestStatus.PENDING, "cancel");
    final NotificationRequest next =
        request.with(RequestStatus.CANCELED, "canceled", request.recipients(), null, now);
    return new RequestTransition(
        next,
        List.of(
            event(
                DomainEventType.NOTIFICATION_CANCELED,
                next,
                now,
                Map.of("request_id", next.requestId().toString()))));
  }

  private static void requireStatus(
      NotificationRequest request, RequestStatus expected, String operation) {
    if (request.status() != expected) {
      throw new InvalidStateTransitionException(
          operation
              + " requires "
              + expected
              + " but request "
              + request.requestId()
              + " is "
              + request.status());
    }
  }

  private static DomainEvent event(
      DomainEventType type,
      NotificationRequest request,
      Instant occurredAt,
      Map<String, Object> attributes) {
    return DomainEvent.of(
        type, request.aggregateKey(), request.correlationId(), occurredAt, attributes);
  }
}
