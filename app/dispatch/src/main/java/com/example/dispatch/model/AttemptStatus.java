package com.example.dispatch.model;

public enum AttemptStatus {
  SENT,
  TRANSIENT_FAILURE,
  PERMANENT_FAILURE
}
