package com.vaultmarket.infra.rpc.contract.trade;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("createListing")
public record CreateListingRequest(String user, String item, long price)
    implements TradeRequest<CreateListingReply> {
  public CreateListingRequest {
    user = RequestFields.requireText(user, "user");
    item = RequestFields.requireText(item, "item");
    RequestFields.requirePositive(price, "price");
  }

  @Override
  public Class<CreateListingReply> replyType() {
    return CreateListingReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
