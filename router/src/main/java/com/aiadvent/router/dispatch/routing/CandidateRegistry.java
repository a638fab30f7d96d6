package com.aiadvent.router.dispatch.routing;

import com.aiadvent.router.dispatch.execution.ResilientExecutor;
import com.aiadvent.router.dispatch.provider.CapabilityProfile;
import com.aiadvent.router.dispatch.provider.CapabilityProvider;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Registration-ordered set of candidates. Registration happens during startup; afterwards the
 * registry is only read.
 */
public class CandidateRegistry {

  private final List<RegisteredCandidate> candidates = new CopyOnWriteArrayList<>();
  private final Function<String, ResilientExecutor> executorFactory;

  public CandidateRegistry(Function<String, ResilientExecutor> executorFactory) {
    Assert.notNull(executorFactory, "executorFactory must not be null");
    this.executorFactory = executorFactory;
  }

  public synchronized RegisteredCandidate register(
      CapabilityProfile profile, CapabilityProvider provider) {
    Assert.notNull(profile, "profile must not be null");
    Assert.notNull(provider, "provider must not be null");
    if (find(profile.key()).isPresent()) {
      throw new IllegalStateException("Candidate '" + profile.key() + "' is already registered");
    }
    RegisteredCandidate candidate =
        new RegisteredCandidate(profile, provider, executorFactory.apply(profile.key()));
    candidates.add(candidate);
    return candidate;
  }

  public List<RegisteredCandidate> candidates() {
    return List.copyOf(candidates);
  }

  public Optional<RegisteredCandidate> find(String key) {
    if (!StringUtils.hasText(key)) {
      return Optional.empty();
    }
    return candidates.stream().filter(candidate -> candidate.key().equals(key)).findFirst();
  }

  public Optional<RegisteredCandidate> find(String providerName, String modelName) {
    return candidates.stream()
        .filter(candidate -> providerName == null || candidate.profile().providerName().equals(providerName))
        .filter(candidate -> modelName == null || candidate.profile().modelName().equals(modelName))
        .findFirst();
  }

  public int size() {
    return candidates.size();
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
