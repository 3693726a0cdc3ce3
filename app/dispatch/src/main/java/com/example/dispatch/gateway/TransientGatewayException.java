package com.example.dispatch.gateway;

public class TransientGatewayException extends RuntimeException {

  public TransientGatewayException(String message) {
    super(message);
  }

  public TransientGatewayException(String message, Throwable cause) {
    super(message, cause);
  }
}
