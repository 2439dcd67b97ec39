package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("addStock")
public record AddStockRequest(String user, long listingId, String item, int count, String chestName)
    implements TradeRequest<AddStockReply> {
  public AddStockRequest {
    user = RequestFields.requireText(user, "user");
    RequestFields.requirePositive(listingId, "listingId");
    item = RequestFields.requireText(item, "item");
    RequestFields.requirePositive(count, "count");
    chestName = RequestFields.requireText(chestName, "chestName");
  }

  @Override
  public Class<AddStockReply> replyType() {
    return AddStockReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
