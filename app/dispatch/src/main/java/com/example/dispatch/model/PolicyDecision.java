package com.example.dispatch.model;

import java.time.Instant;
import java.util.List;

public record PolicyDecision(
    PolicyOutcome outcome, List<Channel> channels, Instant deferUntil, String reason) {

  public PolicyDecision {
    channels = channels == null ? List.of() : List.copyOf(channels);
  }

  public static PolicyDecision allow(List<Channel> channels) {
    return new PolicyDecision(PolicyOutcome.ALLOW, channels, null, null);
  }

  public static PolicyDecision defer(List<Channel> channels, Instant until, String reason) {
    return new PolicyDecision(PolicyOutcome.DEFER, channels, until, reason);
  }

  public static PolicyDecision block(String reason) {
    return new PolicyDecision(PolicyOutcome.BLOCK, List.of(), null, reason);
  }
}
