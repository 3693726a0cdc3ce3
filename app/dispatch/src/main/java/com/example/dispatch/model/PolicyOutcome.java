package com.example.dispatch.model;

public enum PolicyOutcome {
  ALLOW,
  DEFER,
  BLOCK
}
