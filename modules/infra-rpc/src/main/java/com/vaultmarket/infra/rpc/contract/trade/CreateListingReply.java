package com.vaultmarket.infra.rpc.contract.trade;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;

public record CreateListingReply(boolean ok, RpcErrorCode errorCode, String error, long listingId)
    implements RpcReply {
  public static CreateListingReply success(long listingId) {
    return new CreateListingReply(true, null, null, listingId);
  }

  public static CreateListingReply failure(RpcErrorCode errorCode, String error) {
    return new CreateListingReply(false, errorCode, error, 0L);
  }
}
