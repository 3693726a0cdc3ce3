package com.example.dispatch.model;

public enum RecipientOutcome {
  PENDING,
  SUCCEEDED,
  FAILED,
  BLOCKED;

  public boolean isTerminal() {
    return this != PENDING;
  }
}
