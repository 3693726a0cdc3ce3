package com.example.dispatch.service;

import java.util.UUID;

/** In-process signal that a delivery log of the request reached a reconcilable status. */
public record DeliverySettledEvent(UUID requestId) {}
