package com.aiadvent.router.dispatch.exception;

public class RequestValidationException extends DispatchException {

  public RequestValidationException(String message) {
    super(message);
  }
}
