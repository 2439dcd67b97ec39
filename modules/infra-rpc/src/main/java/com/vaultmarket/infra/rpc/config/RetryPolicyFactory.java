package com.vaultmarket.infra.rpc.config;

import com.vaultmarket.infra.rpc.errors.ExponentialBackoffRetryPolicy;
import com.vaultmarket.infra.rpc.errors.FixedBackoffRetryPolicy;
import com.vaultmarket.infra.rpc.errors.RetryPolicy;
import java.time.Duration;

public final class RetryPolicyFactory {
  private RetryPolicyFactory() {}

  public static RetryPolicy create(InfraRpcProperties.Retry retry) {
    if (retry == null) {
      return new FixedBackoffRetryPolicy(1, Duration.ZERO);
    }

    String mode = retry.getMode() == null ? "fixed" : retry.getMode().trim().toLowerCase();
    if ("exponential".equals(mode)) {
      return new ExponentialBackoffRetryPolicy(
          retry.getMaxAttempts(),
          Duration.ofMillis(Math.max(0L, retry.getInitialBackoffMs())),
          Duration.ofMillis(Math.max(0L, retry.getMaxBackoffMs())),
          retry.getMultiplier());
    }
    if ("fixed".equals(mode)) {
      return new FixedBackoffRetryPolicy(
          retry.getMaxAttempts(), Duration.ofMillis(Math.max(0L, retry.getFixedBackoffMs())));
    }
    throw new IllegalArgumentException("Unsupported infra.rpc.retry.mode: " + retry.getMode());
  }
}
