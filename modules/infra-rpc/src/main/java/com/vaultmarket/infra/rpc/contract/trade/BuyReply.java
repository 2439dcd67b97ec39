package com.vaultmarket.infra.rpc.contract.trade;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

/**
 * Outcome of a purchase. {@code state} is the final settlement state; a failed purchase may still
 * report {@code moved > 0} when delivered goods could not all be returned.
 */
public record BuyReply(
    boolean ok,
    RpcErrorCode errorCode,
    String error,
    int moved,
    long total,
    String state,
    String settlementId,
    String message)
    implements RpcReply {
  public static BuyReply failure(RpcErrorCode errorCode, String error) {
    return new BuyReply(false, errorCode, error, 0, 0L, null, null, null);
  }
}
