package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import java.util.Map;

/** Units moved into the vault per item and the total credited for them. */
public record DepositReply(
    boolean ok,
    RpcErrorCode errorCode,
    String error,
    Map<String, Integer> moved,
    long credited,
    long balance)
    implements RpcReply {
  public DepositReply {
    moved = moved == null ? Map.of() : Map.copyOf(moved);
  }

  public static DepositReply success(Map<String, Integer> moved, long credited, long balance) {
    return new DepositReply(true, null, null, moved, credited, balance);
  }

  public static DepositReply failure(RpcErrorCode errorCode, String error) {
    return new DepositReply(false, errorCode, error, Map.of(), 0L, 0L);
  }
}
