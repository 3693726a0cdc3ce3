package com.example.dispatch.model;

public class InvalidStateTransitionException extends RuntimeException {

  public InvalidStateTransitionException(String message) {
    super(message);
  }
}
