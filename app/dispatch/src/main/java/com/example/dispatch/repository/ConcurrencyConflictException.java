package com.example.dispatch.repository;

public class ConcurrencyConflictException extends RuntimeException {

  public ConcurrencyConflictException(String message) {
    super(message);
  }
}
