package com.example.dispatch.model;

/** Outcome of create: {@code created} is false when the dedup key was already reserved. */
public record CreateResult(NotificationRequest request, boolean created) {}
