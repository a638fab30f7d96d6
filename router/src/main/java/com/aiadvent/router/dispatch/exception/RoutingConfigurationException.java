package com.aiadvent.router.dispatch.exception;

public class RoutingConfigurationException extends DispatchException {

  public RoutingConfigurationException(String message) {
    super(message);
  }
}
