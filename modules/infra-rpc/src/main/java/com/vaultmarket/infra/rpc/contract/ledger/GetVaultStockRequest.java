package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("getVaultStock")
public record GetVaultStockRequest() implements LedgerRequest<VaultStockReply> {
  @Override
  public Class<VaultStockReply> replyType() {
    return VaultStockReply.class;
  }
}
