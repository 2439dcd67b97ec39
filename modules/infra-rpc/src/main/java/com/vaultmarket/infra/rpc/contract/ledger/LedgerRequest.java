package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.RpcRequest;

/** Requests served on the ledger request address, tagged by {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = LoginRequest.class, name = "login"),
  @JsonSubTypes.Type(value = CreateAccountRequest.class, name = "createAccount"),
  @JsonSubTypes.Type(value = GetAccountRequest.class, name = "getAccount"),
  @JsonSubTypes.Type(value = GetPricesRequest.class, name = "getPrices"),
  @JsonSubTypes.Type(value = GetVaultStockRequest.class, name = "getVaultStock"),
  @JsonSubTypes.Type(value = DepositFromClientChestRequest.class, name = "depositFromClientChest"),
  @JsonSubTypes.Type(value = WithdrawToClientChestRequest.class, name = "withdrawToClientChest"),
  @JsonSubTypes.Type(value = TransferRequest.class, name = "transfer")
})
public interface LedgerRequest<R extends RpcReply> extends RpcRequest<R> {}
