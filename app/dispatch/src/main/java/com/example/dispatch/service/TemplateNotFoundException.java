package com.example.dispatch.service;

public class TemplateNotFoundException extends RuntimeException {

  public TemplateNotFoundException(String message) {
    super(message);
  }
}
