package com.example.dispatch.model;

public record ChannelOptIn(String type, Channel channel, boolean enabled) {}
