package com.vaultmarket.infra.rpc.contract.trade;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record BalanceReply(boolean ok, RpcErrorCode errorCode, String error, long balance)
    implements RpcReply {
  public static BalanceReply success(long balance) {
    return new BalanceReply(true, null, null, balance);
  }

  public static BalanceReply failure(RpcErrorCode errorCode, String error) {
    return new BalanceReply(false, errorCode, error, 0L);
  }
}
