package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.TemplateStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateResponse(
    UUID templateId,
    String name,
    Channel channel,
    int version,
    TemplateStatus status,
    String subjectTemplate,
    String bodyTemplate,
    Instant createdAt) {

  public static TemplateResponse from(NotificationTemplate template) {
    return new TemplateResponse(
        template.templateId(),
        template.name(),
        template.channel(),
        template.version(),
        template.status(),
        template.subjectTemplate(),
        template.bodyTemplate(),
        template.createdAt());
  }
}
