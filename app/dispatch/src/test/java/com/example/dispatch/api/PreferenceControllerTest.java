package com.example.dispatch.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.PreferenceUpdate;
import com.example.dispatch.model.UserNotificationPreferences;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.service.PreferenceService;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PreferenceController.class)
@Import(ApiExceptionHandler.class)
class PreferenceControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PreferenceService preferenceService;

  @Test
  void getReturnsPreferences() throws Exception {
    when(preferenceService.get("u-1"))
        .thenReturn(
            new UserNotificationPreferences(
                "u-1",
                List.of(new ChannelOptIn("order_shipped", Channel.SMS, false)),
                new DoNotDisturbWindow(
                    LocalTime.of(22, 0), LocalTime.of(7, 0), ZoneId.of("Asia/Tokyo")),
                List.of(),
                2L,
                NOW));

    mockMvc
        .perform(get("/v1/users/u-1/preferences"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("u-1"))
        .andExpect(jsonPath("$.do_not_disturb.zone").value("Asia/Tokyo"))
        .andExpect(jsonPath("$.version").value(2));
  }

  @Test
  void putMapsBodyToUpdate() throws Exception {
    when(preferenceService.update(any(PreferenceUpdate.class)))
        .thenReturn(new UserNotificationPreferences("u-1", List.of(), null, List.of(), 3L, NOW));

    mockMvc
        .perform(
            put("/v1/users/u-1/preferences")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "opt_ins": [{"type": "order_shipped", "channel": "EMAIL", "enabled": false}],
                      "do_not_disturb": {"start": "22:00", "end": "07:00", "zone": "Asia/Tokyo"},
                      "frequency_limits": [{"type": "order_shipped", "max_count": 3, "window": "PT1H"}],
                      "expected_version": 2
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.version").value(3));

    final ArgumentCaptor<PreferenceUpdate> captor = ArgumentCaptor.forClass(PreferenceUpdate.class);
    verify(preferenceService).update(captor.capture());
    final PreferenceUpdate update = captor.getValue();
    assertThat(update.userId()).isEqualTo("u-1");
    assertThat(update.expectedVersion()).isEqualTo(2L);
    assertThat(update.doNotDisturb().zone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
    assertThat(update.frequencyLimits().get(0).maxCount()).isEqualTo(3);
  }

  @Test
  void putWithUnknownZoneReturns400() throws Exception {
    mockMvc
        .perform(
            put("/v1/users/u-1/preferences")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"do_not_disturb": {"start": "22:00", "end": "07:00", "zone": "Mars/Olympus"}}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    verifyNoInteractions(preferenceService);
  }

  @Test
  void putWithStaleVersionReturns409() throws Exception {
    when(preferenceService.update(any(PreferenceUpdate.class)))
        .thenThrow(new ConcurrencyConflictException("modified concurrently"));

    mockMvc
        .perform(
            put("/v1/users/u-1/preferences")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expected_version\": 1}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONCURRENCY_CONFLICT"));
  }
}
