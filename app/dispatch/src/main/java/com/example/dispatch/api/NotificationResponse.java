package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.Recipient;
import com.example.dispatch.model.RecipientOutcome;
import com.example.dispatch.model.RequestStatus;
import com.example.dispatch.model.Urgency;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID requestId,
    String type,
    RequestStatus status,
    String statusReason,
    Urgency urgency,
    Instant scheduledAt,
    String correlationId,
    List<RecipientSummary> recipients,
    Map<Channel, UUID> pinnedTemplates,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationResponse {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    pinnedTemplates = pinnedTemplates == null ? Map.of() : Map.copyOf(pinnedTemplates);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RecipientSummary(
      String id, List<Channel> plannedChannels, RecipientOutcome outcome) {

    public RecipientSummary {
      plannedChannels = plannedChannels == null ? List.of() : List.copyOf(plannedChannels);
    }

    static RecipientSummary from(Recipient recipient) {
      return new RecipientSummary(recipient.id(), recipient.plannedChannels(), recipient.outcome());
    }
  }

  public static NotificationResponse from(NotificationRequest request) {
    return new NotificationResponse(
        request.requestId(),
        request.type(),
        request.status(),
        request.statusReason(),
        request.urgency(),
        request.scheduledAt(),
        request.correlationId(),
        request.recipients().stream().map(RecipientSummary::from).toList(),
        request.pinnedTemplateIds(),
        request.version(),
        request.createdAt(),
        request.updatedAt());
  }
}
