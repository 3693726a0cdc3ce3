package com.example.dispatch.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dispatch.DispatchTestData;
import com.example.dispatch.model.AttemptStatus;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DeliveryAttempt;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.SentNotificationLog;
import com.example.dispatch.service.DeliveryLedger;
import com.example.dispatch.service.DispatchOrchestrator;
import com.example.dispatch.service.NotificationNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DeliveryController.class)
@Import(ApiExceptionHandler.class)
class DeliveryControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DispatchOrchestrator orchestrator;

  @MockitoBean private DeliveryLedger ledger;

  @Test
  void deliveredReceiptReturnsUpdatedLog() throws Exception {
    final SentNotificationLog log =
        DispatchTestData.logInStatus(
            UUID.randomUUID(), "u-1", Channel.SMS, DeliveryStatus.DELIVERED, NOW);
    when(orchestrator.confirmDelivery(log.logId())).thenReturn(log);

    mockMvc
        .perform(post("/v1/deliveries/{log_id}/delivered", log.logId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.log_id").value(log.logId().toString()))
        .andExpect(jsonPath("$.status").value("DELIVERED"))
        .andExpect(jsonPath("$.channel").value("SMS"));
  }

  @Test
  void readReceiptForUnknownLogReturns404() throws Exception {
    final UUID logId = UUID.randomUUID();
    when(orchestrator.markRead(logId))
        .thenThrow(new NotificationNotFoundException("delivery log " + logId + " not found"));

    mockMvc
        .perform(post("/v1/deliveries/{log_id}/read", logId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void searchByRequestIdIncludesAttempts() throws Exception {
    final UUID requestId = UUID.randomUUID();
    final SentNotificationLog log =
        DispatchTestData.logInStatus(requestId, "u-1", Channel.EMAIL, DeliveryStatus.FAILED, NOW);
    when(ledger.findByRequestId(requestId)).thenReturn(List.of(log));
    when(ledger.attemptsByRequestId(requestId))
        .thenReturn(
            List.of(
                new DeliveryAttempt(
                    log.logId(), 1, NOW, AttemptStatus.PERMANENT_FAILURE, "rejected")));

    mockMvc
        .perform(get("/v1/deliveries").param("request_id", requestId.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deliveries[0].last_failure_reason").value("rejected"))
        .andExpect(jsonPath("$.attempts[0].attempt_number").value(1))
        .andExpect(jsonPath("$.attempts[0].status").value("PERMANENT_FAILURE"));
  }

  @Test
  void searchByAddress() throws Exception {
    when(ledger.findByAddress("u1@example.com")).thenReturn(List.of());

    mockMvc
        .perform(get("/v1/deliveries").param("address", "u1@example.com"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.deliveries").isEmpty());
    verify(ledger).findByAddress("u1@example.com");
  }

  @Test
  void searchWithoutSelectorReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/deliveries"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message").value("exactly one of request_id or address is required"));
    verifyNoInteractions(ledger);
  }

  @Test
  void searchWithBothSelectorsReturns400() throws Exception {
    mockMvc
        .perform(
            get("/v1/deliveries")
                .param("request_id", UUID.randomUUID().toString())
                .param("address", "u1@example.com"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void failedOlderThanParsesIsoDuration() throws Exception {
    when(ledger.findFailedOlderThan(Duration.ofHours(1))).thenReturn(List.of());

    mockMvc
        .perform(get("/v1/deliveries/failed").param("older_than", "PT1H"))
        .andExpect(status().isOk());
    verify(ledger).findFailedOlderThan(Duration.ofHours(1));
  }

  @Test
  void failedWithoutOlderThanReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/deliveries/failed"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("older_than is required"));
  }
}
