/*
 * Where: Dispatch API web layer tests
 * What: Verifies status codes and error mapping of the notification endpoints
 * Why: Clients rely on 202/200 to tell a new request from a deduplicated one
 */
package com.example.dispatch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dispatch.DispatchTestData;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.CreateNotificationCommand;
import com.example.dispatch.model.CreateResult;
import com.example.dispatch.model.InvalidStateTransitionException;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.Urgency;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.service.NotificationNotFoundException;
import com.example.dispatch.service.RequestLifecycleManager;
import com.example.dispatch.service.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@Import(ApiExceptionHandler.class)
class NotificationControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final String BODY =
      """
      {
        "type": "order_shipped",
        "payload": {"order_id": "o-1"},
        "recipients": [{"id": "u-1", "addresses": {"EMAIL": "u1@example.com"}}],
        "channel_preferences": ["EMAIL"],
        "urgency": "HIGH",
        "dedup_key": "order-o-1"
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private RequestLifecycleManager lifecycleManager;

  private NotificationRequest sampleRequest() {
    return DispatchTestData.pendingRequest(
        DispatchTestData.command(
            List.of(DispatchTestData.recipient("u-1", Map.of(Channel.EMAIL, "u1@example.com"))),
            List.of(Channel.EMAIL),
            Urgency.HIGH),
        NOW);
  }

  @Test
  void createReturns202ForNewRequest() throws Exception {
    final NotificationRequest request = sampleRequest();
    when(lifecycleManager.create(any(CreateNotificationCommand.class)))
        .thenReturn(new CreateResult(request, true));

    mockMvc
        .perform(
            post("/v1/notifications")
                .header("X-Correlation-Id", "corr-header")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.request_id").value(request.requestId().toString()))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.recipients[0].id").value("u-1"));

    final ArgumentCaptor<CreateNotificationCommand> captor =
        ArgumentCaptor.forClass(CreateNotificationCommand.class);
    verify(lifecycleManager).create(captor.capture());
    assertThat(captor.getValue().correlationId())
        .isEqualTo("corr-header");
    assertThat(captor.getValue().urgency())
        .isEqualTo(Urgency.HIGH);
  }

  @Test
  void createReturns200ForDeduplicatedRequest() throws Exception {
    when(lifecycleManager.create(any(CreateNotificationCommand.class)))
        .thenReturn(new CreateResult(sampleRequest(), false));

    mockMvc
        .perform(post("/v1/notifications").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isOk());
  }

  @Test
  void createReturns400WhenDedupKeyMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/notifications")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"type":"order_shipped","recipients":[{"id":"u-1","addresses":{"EMAIL":"a@b.c"}}],
                     "channel_preferences":["EMAIL"]}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
        .andExpect(jsonPath("$.message").value("dedup_key is required"));
    verifyNoInteractions(lifecycleManager);
  }

  @Test
  void createReturns400WhenBodyMissing() throws Exception {
    mockMvc
        .perform(post("/v1/notifications").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void createReturns400WhenBusinessValidationFails() throws Exception {
    when(lifecycleManager.create(any(CreateNotificationCommand.class)))
        .thenThrow(new ValidationException("channel_preferences must not repeat a channel"));

    mockMvc
        .perform(post("/v1/notifications").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("channel_preferences must not repeat a channel"));
  }

  @Test
  void getReturns404ForUnknownRequest() throws Exception {
    final UUID id = UUID.randomUUID();
    when(lifecycleManager.get(id))
        .thenThrow(new NotificationNotFoundException("notification " + id + " not found"));

    mockMvc
        .perform(get("/v1/notifications/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void getReturns400ForMalformedId() throws Exception {
    mockMvc
        .perform(get("/v1/notifications/not-a-uuid"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("id is invalid"));
  }

  @Test
  void cancelReturns409ForTerminalRequest() throws Exception {
    final UUID id = UUID.randomUUID();
    when(lifecycleManager.cancel(id))
        .thenThrow(new InvalidStateTransitionException("cannot cancel request in status COMPLETED"));

    mockMvc
        .perform(post("/v1/notifications/{id}/cancel", id))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));
  }

  @Test
  void cancelReturns409OnConcurrencyConflict() throws Exception {
    final UUID id = UUID.randomUUID();
    when(lifecycleManager.cancel(id)).thenThrow(new ConcurrencyConflictException("stale version"));

    mockMvc
        .perform(post("/v1/notifications/{id}/cancel", id))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONCURRENCY_CONFLICT"));
  }
}
