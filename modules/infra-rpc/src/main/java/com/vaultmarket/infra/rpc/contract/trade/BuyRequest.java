package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("buy")
public record BuyRequest(String user, long listingId, int count, String chestName)
    implements TradeRequest<BuyReply> {
  public BuyRequest {
    user = RequestFields.requireText(user, "user");
    RequestFields.requirePositive(listingId, "listingId");
    RequestFields.requirePositive(count, "count");
    chestName = RequestFields.requireText(chestName, "chestName");
  }

  @Override
  public Class<BuyReply> replyType() {
    return BuyReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
