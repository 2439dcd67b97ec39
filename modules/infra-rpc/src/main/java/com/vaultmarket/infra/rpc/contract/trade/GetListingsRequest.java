package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("getListings")
public record GetListingsRequest() implements TradeRequest<ListingsReply> {
  @Override
  public Class<ListingsReply> replyType() {
    return ListingsReply.class;
  }
}
