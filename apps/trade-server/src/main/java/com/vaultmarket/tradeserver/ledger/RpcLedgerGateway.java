package com.vaultmarket.tradeserver.ledger;

import com.vaultmarket.domain.common.ErrorCategory;
import com.vaultmarket.domain.settlement.ChargeOutcome;
import com.vaultmarket.domain.settlement.LedgerGateway;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.ledger.TransferReply;
import com.vaultmarket.infra.rpc.errors.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Charges buyers through the ledger server. A call that times out is sent again with the same
 * transfer id, which the ledger applies at most once; when the retries run out the outcome is
 * reported as unknown.
 */
public class RpcLedgerGateway implements LedgerGateway {
  private static final Logger log = LoggerFactory.getLogger(RpcLedgerGateway.class);

  private final LedgerClient ledgerClient;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public RpcLedgerGateway(LedgerClient ledgerClient, RetryPolicy retryPolicy) {
    this(ledgerClient, retryPolicy, duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos()));
  }

  public RpcLedgerGateway(LedgerClient ledgerClient, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.ledgerClient = Objects.requireNonNull(ledgerClient, "ledgerClient must not be null");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  @Override
  public ChargeOutcome transfer(String transferId, String from, String to, long amount) {
    int attempt = 1;
    while (true) {
      RpcResponse<TransferReply> response = ledgerClient.transfer(transferId, from, to, amount);
      if (response.replied()) {
        return outcomeOf(response.reply());
      }
      RpcErrorCode reason = response.errorCode();
      if (!response.isAmbiguous()) {
        log.warn(
            "Transfer not sent transferId={} reason={} detail={}",
            transferId,
            reason,
            response.detail());
        return ChargeOutcome.rejected(reason.name(), ErrorCategory.INTERNAL, response.error());
      }
      if (!retryPolicy.shouldRetry(attempt, reason)) {
        log.warn(
            "Transfer outcome unknown transferId={} attempts={} detail={}",
            transferId,
            attempt,
            response.detail());
        return ChargeOutcome.unknown(reason.name(), "Bank timeout: " + response.error());
      }
      log.info("Retrying ambiguous transfer transferId={} attempt={}", transferId, attempt);
      if (!sleep(retryPolicy.backoffForAttempt(attempt))) {
        return ChargeOutcome.unknown(reason.name(), "Interrupted while retrying transfer");
      }
      attempt++;
    }
  }

  private static ChargeOutcome outcomeOf(TransferReply reply) {
    if (reply.ok()) {
      return ChargeOutcome.applied();
    }
    RpcErrorCode code = reply.errorCode() == null ? RpcErrorCode.INTERNAL : reply.errorCode();
    return ChargeOutcome.rejected(code.name(), categoryOf(code), reply.error());
  }

  static ErrorCategory categoryOf(RpcErrorCode code) {
    return switch (code) {
      case VALIDATION, UNKNOWN_REQUEST, ALREADY_EXISTS, NOT_FOUND -> ErrorCategory.VALIDATION;
      case BAD_CREDENTIAL, NOT_APPROVED, UNKNOWN_ACCOUNT, NOT_OWNER -> ErrorCategory.AUTHORIZATION;
      case INSUFFICIENT_FUNDS, INSUFFICIENT_STOCK, NOTHING_MOVED ->
          ErrorCategory.INSUFFICIENT_RESOURCE;
      case TIMEOUT -> ErrorCategory.TRANSPORT_AMBIGUITY;
      case UNRECOVERED_INCONSISTENCY -> ErrorCategory.UNRECOVERED_INCONSISTENCY;
      case CONTAINER_UNAVAILABLE, UNAVAILABLE, INTERNAL -> ErrorCategory.INTERNAL;
    };
  }

  private boolean sleep(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return true;
    }
    try {
      sleeper.sleep(duration);
      return true;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
