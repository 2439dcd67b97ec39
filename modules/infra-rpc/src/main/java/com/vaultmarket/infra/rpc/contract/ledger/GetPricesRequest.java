package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("getPrices")
public record GetPricesRequest() implements LedgerRequest<PricesReply> {
  @Override
  public Class<PricesReply> replyType() {
    return PricesReply.class;
  }
}
