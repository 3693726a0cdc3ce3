package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationTemplate(
    UUID templateId,
    String name,
    Channel channel,
    String subjectTemplate,
    String bodyTemplate,
    int version,
    TemplateStatus status,
    Instant createdAt) {

  public String cacheKey() {
    return cacheKey(name, channel);
  }

  public static String cacheKey(String name, Channel channel) {
    return name + ":" + channel.name();
  }
}
