package com.aiadvent.router.dispatch.cache;

public final class VectorSimilarity {

  private VectorSimilarity() {}

  /**
   * Cosine similarity of two equal-length vectors; {@code 0} when either vector has zero norm.
   *
   * @throws VectorDimensionMismatchException when the lengths differ
   */
  public static double cosine(float[] left, float[] right) {
    if (left == null || right == null) {
      throw new IllegalArgumentException("Vectors must not be null");
    }
    if (left.length != right.length) {
      throw new VectorDimensionMismatchException(left.length, right.length);
    }
    double dot = 0.0;
    double leftNorm = 0.0;
    double rightNorm = 0.0;
    for (int i = 0; i < left.length; i++) {
      dot += (double) left[i] * right[i];
      leftNorm += (double) left[i] * left[i];
      rightNorm += (double) right[i] * right[i];
    }
    if (leftNorm == 0.0 || rightNorm == 0.0) {
      return 0.0;
    }
    double similarity = dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    // rounding can push identical vectors a hair past 1
    return Math.max(-1.0, Math.min(1.0, similarity));
  }
}
