package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.RpcRequest;

/** Requests served on the trade request address, tagged by {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TradeLoginRequest.class, name = "login"),
  @JsonSubTypes.Type(value = GetBalanceRequest.class, name = "getBalance"),
  @JsonSubTypes.Type(value = GetListingsRequest.class, name = "getListings"),
  @JsonSubTypes.Type(value = CreateListingRequest.class, name = "createListing"),
  @JsonSubTypes.Type(value = AddStockRequest.class, name = "addStock"),
  @JsonSubTypes.Type(value = BuyRequest.class, name = "buy")
})
public interface TradeRequest<R extends RpcReply> extends RpcRequest<R> {}
