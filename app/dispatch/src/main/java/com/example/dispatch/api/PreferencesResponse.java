package com.example.dispatch.api;

import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.UserNotificationPreferences;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferencesResponse(
    String userId,
    List<ChannelOptIn> optIns,
    DoNotDisturb doNotDisturb,
    List<Limit> frequencyLimits,
    long version,
    Instant updatedAt) {

  public PreferencesResponse {
    optIns = optIns == null ? List.of() : List.copyOf(optIns);
    frequencyLimits = frequencyLimits == null ? List.of() : List.copyOf(frequencyLimits);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DoNotDisturb(LocalTime start, LocalTime end, String zone) {

    static DoNotDisturb from(DoNotDisturbWindow window) {
      return window == null
          ? null
          : new DoNotDisturb(window.start(), window.end(), window.zone().getId());
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Limit(String type, int maxCount, Duration window) {

    static Limit from(FrequencyLimit limit) {
      return new Limit(limit.type(), limit.maxCount(), limit.window());
    }
  }

  public static PreferencesResponse from(UserNotificationPreferences preferences) {
    return new PreferencesResponse(
        preferences.userId(),
        preferences.optIns(),
        DoNotDisturb.from(preferences.doNotDisturb()),
        preferences.frequencyLimits().stream().map(Limit::from).toList(),
        preferences.version(),
        preferences.updatedAt());
  }
}
