package com.vaultmarket.infra.rpc.contract.trade;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import java.util.List;

public record ListingsReply(
    boolean ok, RpcErrorCode errorCode, String error, List<ListingView> listings)
    implements RpcReply {
  public ListingsReply {
    listings = listings == null ? List.of() : List.copyOf(listings);
  }

  public static ListingsReply success(List<ListingView> listings) {
    return new ListingsReply(true, null, null, listings);
  }

  public static ListingsReply failure(RpcErrorCode errorCode, String error) {
    return new ListingsReply(false, errorCode, error, List.of());
  }
}
