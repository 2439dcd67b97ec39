package com.vaultmarket.infra.rpc.errors;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import java.time.Duration;

/** Decides whether a call that ended without a usable answer is sent again. */
public interface RetryPolicy {
  boolean shouldRetry(int attempt, RpcErrorCode reason);

  Duration backoffForAttempt(int attempt);

  default boolean isRetryable(RpcErrorCode reason) {
    return reason != null && reason.isAmbiguous();
  }
}
