package com.example.dispatch.model;

import java.time.Instant;

/** Inputs the policy evaluator needs beyond the request itself. */
public record PolicyContext(
    UserNotificationPreferences preferences, long recentDispatchCount, Instant evaluationTime) {}
