package com.example.dispatch.model;

public enum RequestStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  BLOCKED,
  CANCELED;

  public boolean isTerminal() {
    return this != PENDING && this != PROCESSING;
  }
}
