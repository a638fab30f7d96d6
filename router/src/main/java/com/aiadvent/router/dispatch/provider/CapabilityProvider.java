package com.aiadvent.router.dispatch.provider;

import com.aiadvent.router.dispatch.routing.RequestOptions;

/**
 * A backend able to serve one registered model. The dispatch core only ever talks to this
 * interface; wire formats stay inside the implementations.
 */
public interface CapabilityProvider {

  /**
   * @throws com.aiadvent.router.dispatch.exception.ProviderException on any backend failure
   */
  CompletionResponse generateCompletion(String text, RequestOptions options);

  /**
   * @throws com.aiadvent.router.dispatch.exception.ProviderException when embeddings are
   *     unsupported or unavailable
   */
  float[] generateEmbedding(String text);

  /** Whether {@link #generateEmbedding} is backed by a configured model at all. */
  default boolean supportsEmbeddings() {
    return true;
  }

  /** Local, deterministic estimate of the units {@code text} consumes. Never touches the network. */
  int estimateUnits(String text);
}
