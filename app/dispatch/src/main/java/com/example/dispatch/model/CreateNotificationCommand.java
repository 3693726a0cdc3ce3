package com.example.dispatch.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CreateNotificationCommand(
    String type,
    Map<String, Object> payload,
    List<RecipientInput> recipients,
    List<Channel> channelPreferences,
    Urgency urgency,
    Instant scheduledAt,
    String correlationId,
    String dedupKey) {

  public CreateNotificationCommand {
    payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    recipients = recipients == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(recipients));
    channelPreferences =
        channelPreferences == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(channelPreferences));
    urgency = urgency == null ? Urgency.MEDIUM : urgency;
  }

  public record RecipientInput(String id, Map<Channel, String> addresses) {

    public RecipientInput {
      addresses =
          addresses == null || addresses.isEmpty()
              ? Map.of()
              : Collections.unmodifiableMap(new EnumMap<>(addresses));
    }
  }
}
