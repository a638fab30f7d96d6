package com.aiadvent.router.dispatch.execution;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.router.dispatch.exception.ProviderException;
import com.aiadvent.router.dispatch.exception.RateLimitedException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RateLimitAwareBackOffPolicyTest {

  private final RateLimitAwareBackOffPolicy policy =
      new RateLimitAwareBackOffPolicy(
          Duration.ofSeconds(2), 2.0, Duration.ofSeconds(10), new RecordingSleeper());

  @Test
  void doublesUntilCapped() {
    ProviderException failure = new ProviderException("p:m", "boom");

    assertThat(policy.nextDelay(failure, 0)).isEqualTo(2_000L);
    assertThat(policy.nextDelay(failure, 1)).isEqualTo(4_000L);
    assertThat(policy.nextDelay(failure, 2)).isEqualTo(8_000L);
    assertThat(policy.nextDelay(failure, 3)).isEqualTo(10_000L);
  }

  @Test
  void prefersRetryAfterWhenPresent() {
    RateLimitedException rateLimited =
        new RateLimitedException("p:m", "slow down", Duration.ofSeconds(30));

    assertThat(policy.nextDelay(rateLimited, 0)).isEqualTo(30_000L);
  }

  @Test
  void rateLimitWithoutHintUsesComputedDelay() {
    RateLimitedException rateLimited = new RateLimitedException("p:m", "slow down", null);

    assertThat(policy.nextDelay(rateLimited, 1)).isEqualTo(4_000L);
  }
}
