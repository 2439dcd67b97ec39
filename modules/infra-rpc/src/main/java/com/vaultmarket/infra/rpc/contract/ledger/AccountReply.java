package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record AccountReply(
    boolean ok, RpcErrorCode errorCode, String error, String user, long balance, boolean approved)
    implements RpcReply {
  public static AccountReply success(String user, long balance, boolean approved) {
    return new AccountReply(true, null, null, user, balance, approved);
  }

  public static AccountReply failure(RpcErrorCode errorCode, String error) {
    return new AccountReply(false, errorCode, error, null, 0L, false);
  }
}
