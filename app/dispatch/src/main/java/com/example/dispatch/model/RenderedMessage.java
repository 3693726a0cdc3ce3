package com.example.dispatch.model;

/** Subject is null for channels that do not carry one. */
public record RenderedMessage(String subject, String body) {}
