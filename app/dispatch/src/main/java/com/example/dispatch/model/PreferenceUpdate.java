package com.example.dispatch.model;

import java.util.List;

/** Full replacement of a user's preferences; {@code expectedVersion} null means last writer wins. */
public record PreferenceUpdate(
    String userId,
    List<ChannelOptIn> optIns,
    DoNotDisturbWindow doNotDisturb,
    List<FrequencyLimit> frequencyLimits,
    Long expectedVersion) {

  public PreferenceUpdate {
    optIns = optIns == null ? List.of() : List.copyOf(optIns);
    frequencyLimits = frequencyLimits == null ? List.of() : List.copyOf(frequencyLimits);
  }
}
