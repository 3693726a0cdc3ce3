package com.example.dispatch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record Recipient(
    String id,
    Map<Channel, String> addresses,
    List<Channel> plannedChannels,
    RecipientOutcome outcome) {

  public Recipient {
    addresses =
        addresses == null || addresses.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(addresses));
    plannedChannels =
        plannedChannels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(plannedChannels));
    outcome = outcome == null ? RecipientOutcome.PENDING : outcome;
  }

  public static Recipient of(String id, Map<Channel, String> addresses) {
    return new Recipient(id, addresses, List.of(), RecipientOutcome.PENDING);
  }

  public String addressFor(Channel channel) {
    return addresses.get(channel);
  }

  public Recipient withPlan(List<Channel> channels, RecipientOutcome nextOutcome) {
    return new Recipient(id, addresses, channels, nextOutcome);
  }

  public Recipient withOutcome(RecipientOutcome nextOutcome) {
    return new Recipient(id, addresses, plannedChannels, nextOutcome);
  }
}
