package com.example.common.event;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DispatchEventPayloadTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void serializesWithSnakeCaseNames() throws Exception {
    final DispatchEventPayload payload =
        new DispatchEventPayload(
            "event-1",
            "NotificationCompletedEvent",
            "2026-01-17T00:00:00Z",
            "request:r-1",
            "c1",
            "trace-1",
            Map.of("status", "COMPLETED"));

    final JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(payload));

    assertThat(json.get("event_id").asText()).isEqualTo("event-1");
    assertThat(json.get("aggregate_key").asText()).isEqualTo("request:r-1");
    assertThat(json.get("correlation_id").asText()).isEqualTo("c1");
    assertThat(json.get("attributes").get("status").asText()).isEqualTo("COMPLETED");
  }

  @Test
  void nullAttributesBecomeEmpty() {
    final DispatchEventPayload payload =
        new DispatchEventPayload("e", "t", "o", "k", null, null, null);

    assertThat(payload.attributes()).isEmpty();
  }
}
