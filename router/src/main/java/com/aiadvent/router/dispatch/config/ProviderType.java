package com.aiadvent.router.dispatch.config;

/** Wire protocol spoken by a configured backend. */
public enum ProviderType {
  OPENAI
}
