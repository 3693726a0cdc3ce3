package com.example.dispatch.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public record UserNotificationPreferences(
    String userId,
    List<ChannelOptIn> optIns,
    DoNotDisturbWindow doNotDisturb,
    List<FrequencyLimit> frequencyLimits,
    long version,
    Instant updatedAt) {

  public UserNotificationPreferences {
    optIns = optIns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(optIns));
    frequencyLimits =
        frequencyLimits == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(frequencyLimits));
  }

  public static UserNotificationPreferences defaults(String userId) {
    return new UserNotificationPreferences(userId, List.of(), null, List.of(), 0L, null);
  }

  public boolean isEnabled(String type, Channel channel) {
    return optIns.stream()
        .filter(o -> o.type().equals(type) && o.channel() == channel)
        .findFirst()
        .map(ChannelOptIn::enabled)
        .orElse(true);
  }

  public Optional<FrequencyLimit> frequencyLimit(String type) {
    return frequencyLimits.stream().filter(l -> l.type().equals(type)).findFirst();
  }
}
