package com.vaultmarket.infra.rpc.contract.trade;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record AddStockReply(
    boolean ok, RpcErrorCode errorCode, String error, int moved, int quantityOnHand)
    implements RpcReply {
  public static AddStockReply success(int moved, int quantityOnHand) {
    return new AddStockReply(true, null, null, moved, quantityOnHand);
  }

  public static AddStockReply failure(RpcErrorCode errorCode, String error) {
    return new AddStockReply(false, errorCode, error, 0, 0);
  }
}
