package com.example.dispatch.model;

public enum Urgency {
  HIGH,
  MEDIUM,
  LOW
}
