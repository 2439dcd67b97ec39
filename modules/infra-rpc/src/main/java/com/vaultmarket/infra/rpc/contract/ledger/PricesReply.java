package com.vaultmarket.infra.rpc.contract.ledger;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import java.util.Map;

/** Current unit price per priced item, at the vault stock seen when the reply was built. */
public record PricesReply(
    boolean ok, RpcErrorCode errorCode, String error, Map<String, ItemQuote> prices)
    implements RpcReply {
  public PricesReply {
    prices = prices == null ? Map.of() : Map.copyOf(prices);
  }

  public static PricesReply success(Map<String, ItemQuote> prices) {
    return new PricesReply(true, null, null, prices);
  }

  public static PricesReply failure(RpcErrorCode errorCode, String error) {
    return new PricesReply(false, errorCode, error, Map.of());
  }

  public record ItemQuote(long price, int stock, long base) {}
}
