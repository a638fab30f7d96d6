package com.aiadvent.router.dispatch.provider.model;

public enum UsageSource {
  NATIVE,
  FALLBACK,
  UNKNOWN
}
