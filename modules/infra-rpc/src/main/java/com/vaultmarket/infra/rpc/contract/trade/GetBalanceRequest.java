package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("getBalance")
public record GetBalanceRequest(String user) implements TradeRequest<BalanceReply> {
  public GetBalanceRequest {
    user = RequestFields.requireText(user, "user");
  }

  @Override
  public Class<BalanceReply> replyType() {
    return BalanceReply.class;
  }
}
