package com.aiadvent.router.dispatch.cache;

public class VectorDimensionMismatchException extends IllegalArgumentException {

  public VectorDimensionMismatchException(int left, int right) {
    super("Vectors must be of the same length: " + left + " != " + right);
  }
}
