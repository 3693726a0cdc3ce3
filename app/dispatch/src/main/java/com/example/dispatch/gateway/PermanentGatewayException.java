package com.example.dispatch.gateway;

public class PermanentGatewayException extends RuntimeException {

  public PermanentGatewayException(String message) {
    super(message);
  }
}
