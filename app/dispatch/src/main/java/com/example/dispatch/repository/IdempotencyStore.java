package com.example.dispatch.repository;

import com.example.dispatch.model.Reservation;
import java.time.Duration;
import java.util.UUID;

/** Atomic key reservation used to make request creation idempotent. */
public interface IdempotencyStore {

  /**
   * Reserves {@code key} for {@code candidateRef} unless a live reservation exists.
   *
   * @return acquired, or the reference held by the live reservation
   */
  Reservation reserve(String key, UUID candidateRef, Duration ttl);
}
