package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("login")
public record TradeLoginRequest(String user, String credential)
    implements TradeRequest<AckReply> {
  public TradeLoginRequest {
    user = RequestFields.requireText(user, "user");
    if (credential == null) {
      throw new IllegalArgumentException("credential must not be null");
    }
  }

  @Override
  public Class<AckReply> replyType() {
    return AckReply.class;
  }
}
