package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record WithdrawReply(
    boolean ok,
    RpcErrorCode errorCode,
    String error,
    int moved,
    long unitPrice,
    long charged,
    long balance)
    implements RpcReply {
  public static WithdrawReply success(int moved, long unitPrice, long charged, long balance) {
    return new WithdrawReply(true, null, null, moved, unitPrice, charged, balance);
  }

  public static WithdrawReply failure(RpcErrorCode errorCode, String error) {
    return new WithdrawReply(false, errorCode, error, 0, 0L, 0L, 0L);
  }
}
