package com.example.dispatch.model;

import java.util.UUID;

/** {@code existingRef} is set when the key was already held by a live reservation. */
public record Reservation(boolean acquired, UUID existingRef) {

  public static Reservation granted() {
    return new Reservation(true, null);
  }

  public static Reservation existing(UUID ref) {
    return new Reservation(false, ref);
  }
}
