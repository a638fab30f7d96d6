package com.aiadvent.router.dispatch.classifier;

public enum ComplexityTier {
  SIMPLE,
  MODERATE,
  COMPLEX
}
