package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record TransferReply(
    boolean ok,
    RpcErrorCode errorCode,
    String error,
    String transferId,
    long fromBalance,
    boolean replayed)
    implements RpcReply {
  public static TransferReply success(String transferId, long fromBalance, boolean replayed) {
    return new TransferReply(true, null, null, transferId, fromBalance, replayed);
  }

  public static TransferReply failure(RpcErrorCode errorCode, String error, String transferId) {
    return new TransferReply(false, errorCode, error, transferId, 0L, false);
  }
}
