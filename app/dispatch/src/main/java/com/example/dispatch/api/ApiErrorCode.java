package com.example.dispatch.api;

public enum ApiErrorCode {
  VALIDATION_FAILED,
  INVALID_STATE_TRANSITION,
  CONCURRENCY_CONFLICT,
  NOT_FOUND,
  TEMPLATE_NOT_FOUND,
  MISSING_PLACEHOLDER
}
