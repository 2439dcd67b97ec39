package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import java.util.Map;

public record VaultStockReply(
    boolean ok, RpcErrorCode errorCode, String error, Map<String, StockLine> stock)
    implements RpcReply {
  public VaultStockReply {
    stock = stock == null ? Map.of() : Map.copyOf(stock);
  }

  public static VaultStockReply success(Map<String, StockLine> stock) {
    return new VaultStockReply(true, null, null, stock);
  }

  public static VaultStockReply failure(RpcErrorCode errorCode, String error) {
    return new VaultStockReply(false, errorCode, error, Map.of());
  }

  public record StockLine(int count, long price) {}
}
