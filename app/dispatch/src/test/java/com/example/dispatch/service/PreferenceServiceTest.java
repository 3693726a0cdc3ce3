package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DomainEvent;
import com.example.dispatch.model.DomainEventType;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.PreferenceUpdate;
import com.example.dispatch.model.UserNotificationPreferences;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.repository.UserPreferenceRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PreferenceServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private UserPreferenceRepository preferenceRepository;
  @Mock private EventOutbox eventOutbox;

  private PreferenceService service;

  @BeforeEach
  void setUp() {
    service =
        new PreferenceService(
            preferenceRepository, eventOutbox, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void getReturnsDefaultsForUnknownUser() {
    when(preferenceRepository.findByUserId("u-1")).thenReturn(Optional.empty());

    final UserNotificationPreferences preferences = service.get("u-1");

    assertThat(preferences.version()).isZero();
    assertThat(preferences.isEnabled("order_shipped", Channel.SMS)).isTrue();
    assertThat(preferences.doNotDisturb()).isNull();
  }

  @Test
  void updateWithExpectedVersionRaisesUpdatedEvent() {
    final PreferenceUpdate update =
        new PreferenceUpdate(
            "u-1",
            List.of(new ChannelOptIn("order_shipped", Channel.SMS, false)),
            null,
            List.of(new FrequencyLimit("order_shipped", 3, Duration.ofHours(1))),
            2L);
    final UserNotificationPreferences stored =
        new UserNotificationPreferences(
            "u-1", update.optIns(), null, update.frequencyLimits(), 3L, FIXED_NOW);
    when(preferenceRepository.upsert(any(UserNotificationPreferences.class), eq(2L)))
        .thenReturn(stored);

    final UserNotificationPreferences saved = service.update(update);

    assertThat(saved.version()).isEqualTo(3L);
    final ArgumentCaptor<DomainEvent> eventCaptor = ArgumentCaptor.forClass(DomainEvent.class);
    verify(eventOutbox).append(eventCaptor.capture());
    final DomainEvent event = eventCaptor.getValue();
    assertThat(event.type()).isEqualTo(DomainEventType.USER_NOTIFICATION_PREFERENCES_UPDATED);
    assertThat(event.aggregateKey()).isEqualTo("user:u-1");
    assertThat(event.attributes())
        .containsEntry("version", 3L)
        .containsEntry("opt_out_count", 1L)
        .containsEntry("do_not_disturb", false);
  }

  @Test
  void updateWithoutExpectedVersionUsesCurrentVersion() {
    final UserNotificationPreferences current =
        new UserNotificationPreferences("u-1", List.of(), null, List.of(), 4L, FIXED_NOW);
    when(preferenceRepository.findByUserId("u-1")).thenReturn(Optional.of(current));
    when(preferenceRepository.upsert(any(UserNotificationPreferences.class), eq(4L)))
        .thenReturn(
            new UserNotificationPreferences("u-1", List.of(), null, List.of(), 5L, FIXED_NOW));

    assertThat(service.update(new PreferenceUpdate("u-1", null, null, null, null)).version())
        .isEqualTo(5L);
  }

  @Test
  void updateConflictDoesNotRaiseEvent() {
    when(preferenceRepository.upsert(any(UserNotificationPreferences.class), anyLong()))
        .thenThrow(new ConcurrencyConflictException("modified concurrently"));

    assertThatThrownBy(
            () -> service.update(new PreferenceUpdate("u-1", List.of(), null, List.of(), 1L)))
        .isInstanceOf(ConcurrencyConflictException.class);
    verifyNoInteractions(eventOutbox);
  }

  @Test
  void updateRejectsDuplicateOptIn() {
    final PreferenceUpdate update =
        new PreferenceUpdate(
            "u-1",
            List.of(
                new ChannelOptIn("order_shipped", Channel.EMAIL, true),
                new ChannelOptIn("order_shipped", Channel.EMAIL, false)),
            null,
            List.of(),
            null);

    assertThatThrownBy(() -> service.update(update))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("duplicate opt-in");
    verifyNoInteractions(preferenceRepository, eventOutbox);
  }

  @Test
  void updateRejectsNonPositiveLimitWindow() {
    final PreferenceUpdate update =
        new PreferenceUpdate(
            "u-1",
            List.of(),
            null,
            List.of(new FrequencyLimit("order_shipped", 1, Duration.ZERO)),
            null);

    assertThatThrownBy(() -> service.update(update))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("window must be positive");
  }
}
