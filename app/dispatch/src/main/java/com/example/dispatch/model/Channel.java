package com.example.dispatch.model;

public enum Channel {
  EMAIL,
  SMS,
  PUSH
}
