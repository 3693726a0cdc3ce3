package com.example.dispatch.gateway;

public record GatewayReceipt(String providerMessageId) {}
