package com.example.dispatch.model;

public enum DeliveryStatus {
  QUEUED_FOR_DISPATCH(0),
  SENT(1),
  DELIVERED(2),
  READ(3),
  FAILED(2);

  private final int rank;

  DeliveryStatus(int rank) {
    this.rank = rank;
  }

  public boolean isTerminal() {
    return this == DELIVERED || this == READ || this == FAILED;
  }

  public boolean isSuccess() {
    return this == SENT || this == DELIVERED || this == READ;
  }

  /** FAILED only follows QUEUED_FOR_DISPATCH; success states only climb. */
  public boolean canAdvanceTo(DeliveryStatus next) {
    if (this == FAILED || next == QUEUED_FOR_DISPATCH) {
      return false;
    }
    if (next == FAILED) {
      return this == QUEUED_FOR_DISPATCH;
    }
    return next.rank > rank;
  }
}
