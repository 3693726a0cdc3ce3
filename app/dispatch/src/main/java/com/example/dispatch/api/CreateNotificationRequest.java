package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.CreateNotificationCommand;
import com.example.dispatch.model.Urgency;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationRequest(
    @NotBlank(message = "type is required") String type,
    Map<String, Object> payload,
    @NotEmpty(message = "recipients are required") List<@Valid RecipientRequest> recipients,
    @NotEmpty(message = "channel_preferences are required") List<Channel> channelPreferences,
    Urgency urgency,
    Instant scheduledAt,
    String correlationId,
    @NotBlank(message = "dedup_key is required") String dedupKey) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record RecipientRequest(
      @NotBlank(message = "recipient id is required") String id,
      Map<Channel, String> addresses) {}

  /** Header value wins when the body omits correlation_id. */
  public CreateNotificationCommand toCommand(String headerCorrelationId) {
    final String correlation =
        correlationId == null || correlationId.isBlank() ? headerCorrelationId : correlationId;
    final List<CreateNotificationCommand.RecipientInput> inputs =
        recipients.stream()
            .map(r -> new CreateNotificationCommand.RecipientInput(r.id(), r.addresses()))
            .toList();
    return new CreateNotificationCommand(
        type, payload, inputs, channelPreferences, urgency, scheduledAt, correlation, dedupKey);
  }
}
