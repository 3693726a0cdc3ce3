package com.example.dispatch.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dispatch.AbstractPostgresContainerTest;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.UserNotificationPreferences;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class UserPreferenceRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T14:00:00Z");

  @Autowired private UserPreferenceRepository preferenceRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
  }

  @Test
  void unknownUserHasNoRow() {
    assertThat(preferenceRepository.findByUserId("nobody")).isEmpty();
  }

  @Test
  void firstUpsertInsertsVersionOne() {
    final UserNotificationPreferences saved =
        preferenceRepository.upsert(
            new UserNotificationPreferences(
                "u1",
                List.of(new ChannelOptIn("order_shipped", Channel.SMS, false)),
                new DoNotDisturbWindow(
                    LocalTime.of(22, 0), LocalTime.of(7, 0), ZoneId.of("Asia/Tokyo")),
                List.of(new FrequencyLimit("order_shipped", 3, Duration.ofHours(1))),
                0L,
                NOW),
            0L);

    assertThat(saved.version()).isEqualTo(1L);
    assertThat(saved.isEnabled("order_shipped", Channel.SMS)).isFalse();
    assertThat(saved.isEnabled("order_shipped", Channel.EMAIL)).isTrue();
    assertThat(saved.doNotDisturb().start()).isEqualTo(LocalTime.of(22, 0));
    assertThat(saved.doNotDisturb().zone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
    assertThat(saved.frequencyLimit("order_shipped"))
        .get()
        .extracting(FrequencyLimit::window)
        .isEqualTo(Duration.ofHours(1));
  }

  @Test
  void updateRequiresCurrentVersion() {
    preferenceRepository.upsert(
        new UserNotificationPreferences("u1", List.of(), null, List.of(), 0L, NOW), 0L);

    final UserNotificationPreferences updated =
        preferenceRepository.upsert(
            new UserNotificationPreferences(
                "u1",
                List.of(new ChannelOptIn("promo", Channel.PUSH, false)),
                null,
                List.of(),
                1L,
                NOW.plusSeconds(1)),
            1L);

    assertThat(updated.version()).isEqualTo(2L);
    assertThat(updated.doNotDisturb()).isNull();
    assertThatThrownBy(
            () ->
                preferenceRepository.upsert(
                    new UserNotificationPreferences("u1", List.of(), null, List.of(), 1L, NOW),
                    1L))
        .isInstanceOf(ConcurrencyConflictException.class);
    assertThat(preferenceRepository.findByUserId("u1").orElseThrow().optIns()).hasSize(1);
  }
}
