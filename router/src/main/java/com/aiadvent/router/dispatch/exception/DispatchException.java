package com.aiadvent.router.dispatch.exception;

/** Base type for every failure raised by the dispatch core. */
public abstract class DispatchException extends RuntimeException {

  protected DispatchException(String message) {
    super(message);
  }

  protected DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
