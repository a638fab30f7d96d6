package com.aiadvent.router.dispatch.routing;

import com.aiadvent.router.dispatch.execution.ResilientExecutor;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import com.aiadvent.router.dispatch.provider.CapabilityProvider;

/** A profile bound to the provider serving it and the executor its calls pass through. */
public record RegisteredCandidate(
    CapabilityProfile profile, CapabilityProvider provider, ResilientExecutor executor) {

  public String key() {
    return profile.key();
  }
}
