package com.example.dispatch.service;

/** A {@code {{key}}} token without default had no value in the render data. */
public class MissingPlaceholderException extends RuntimeException {

  private final String placeholder;

  public MissingPlaceholderException(String templateName, String placeholder) {
    super("template " + templateName + " is missing value for placeholder " + placeholder);
    this.placeholder = placeholder;
  }

  public String placeholder() {
    return placeholder;
  }
}
