/*
 * Where: Dispatch domain model
 * What: Snapshot of the notification request aggregate
 * Why: Transitions produce new snapshots; the repository saves them with a version check
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public record NotificationRequest(
    UUID requestId,
    String type,
    Map<String, Object> payload,
    List<Recipient> recipients,
    List<Channel> channelPreferences,
    Urgency urgency,
    Instant scheduledAt,
    String correlationId,
    String dedupKey,
    RequestStatus status,
    String statusReason,
    Map<Channel, UUID> pinnedTemplateIds,
    Instant nextEvaluationAt,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationRequest {
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    recipients = recipients == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(recipients));
    channelPreferences =
        channelPreferences == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(channelPreferences));
    pinnedTemplateIds =
        pinnedTemplateIds == null || pinnedTemplateIds.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(pinnedTemplateIds));
  }

  public Optional<Recipient> recipient(String recipientId) {
    return recipients.stream().filter(r -> r.id().equals(recipientId)).findFirst();
  }

  public String aggregateKey() {
    return "request:" + requestId;
  }

  NotificationRequest with(
      RequestStatus nextStatus,
      String nextReason,
      List<Recipient> nextRecipients,
      Instant nextEvaluation,
      Instant now) {
    return new NotificationRequest(
        requestId,
        type,
        payload,
        nextRecipients,
        channelPreferences,
        urgency,
        scheduledAt,
        correlationId,
        dedupKey,
        nextStatus,
        nextReason,
        pinnedTemplateIds,
        nextEvaluation,
        version,
        createdAt,
        now);
  }
}
