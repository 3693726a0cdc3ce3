package com.example.dispatch.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

public record DoNotDisturbWindow(LocalTime start, LocalTime end, ZoneId zone) {

  public boolean wrapsMidnight() {
    return end.isBefore(start);
  }

  /** Start inclusive, end exclusive. An empty window (start == end) never matches. */
  public boolean contains(Instant instant) {
    final LocalTime local = instant.atZone(zone).toLocalTime();
    if (start.equals(end)) {
      return false;
    }
    if (wrapsMidnight()) {
      return !local.isBefore(start) || local.isBefore(end);
    }
    return !local.isBefore(start) && local.isBefore(end);
  }

  /** End of the window that contains {@code instant}. Only meaningful when {@link #contains} holds. */
  public Instant endAfter(Instant instant) {
    final ZonedDateTime local = instant.atZone(zone);
    LocalDate endDate = local.toLocalDate();
    if (wrapsMidnight() && !local.toLocalTime().isBefore(start)) {
      endDate = endDate.plusDays(1);
    }
    return ZonedDateTime.of(endDate, end, zone).toInstant();
  }
}
