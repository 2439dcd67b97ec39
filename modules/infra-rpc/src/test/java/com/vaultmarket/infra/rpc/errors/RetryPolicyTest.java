package com.vaultmarket.infra.rpc.errors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  @Test
  void shouldRetryOnlyAmbiguousOutcomesWithinAttemptBudget() {
    RetryPolicy policy = new FixedBackoffRetryPolicy(3, Duration.ofMillis(10));

    assertTrue(policy.shouldRetry(1, RpcErrorCode.TIMEOUT));
    assertTrue(policy.shouldRetry(2, RpcErrorCode.TIMEOUT));
    assertFalse(policy.shouldRetry(3, RpcErrorCode.TIMEOUT));
    assertFalse(policy.shouldRetry(1, RpcErrorCode.INSUFFICIENT_FUNDS));
    assertFalse(policy.shouldRetry(1, null));
  }

  @Test
  void shouldGrowExponentialBackoffUpToCap() {
    RetryPolicy policy =
        new ExponentialBackoffRetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(350), 2.0d);

    assertEquals(Duration.ofMillis(100), policy.backoffForAttempt(1));
    assertEquals(Duration.ofMillis(200), policy.backoffForAttempt(2));
    assertEquals(Duration.ofMillis(350), policy.backoffForAttempt(3));
    assertEquals(Duration.ofMillis(350), policy.backoffForAttempt(9));
  }

  @Test
  void shouldNeverBackOffWhenInitialBackoffIsZero() {
    RetryPolicy policy =
        new ExponentialBackoffRetryPolicy(2, Duration.ZERO, Duration.ofSeconds(1), 3.0d);

    assertEquals(Duration.ZERO, policy.backoffForAttempt(4));
  }

  @Test
  void shouldHoldBackoffSteadyForNegativeOrNanMultiplier() {
    for (double multiplier : new double[] {-2.0d, Double.NaN}) {
      RetryPolicy policy =
          new ExponentialBackoffRetryPolicy(
              4, Duration.ofMillis(100), Duration.ofSeconds(1), multiplier);

      assertEquals(Duration.ofMillis(100), policy.backoffForAttempt(1));
      assertEquals(Duration.ofMillis(100), policy.backoffForAttempt(3));
    }
  }
}
