package com.example.dispatch.model;

import java.time.Duration;

/** At most {@code maxCount} successful dispatches of {@code type} within a sliding {@code window}. */
public record FrequencyLimit(String type, int maxCount, Duration window) {}
