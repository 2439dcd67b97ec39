package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("withdrawToClientChest")
public record WithdrawToClientChestRequest(String user, String chestName, String item, int count)
    implements LedgerRequest<WithdrawReply> {
  public WithdrawToClientChestRequest {
    user = RequestFields.requireText(user, "user");
    chestName = RequestFields.requireText(chestName, "chestName");
    item = RequestFields.requireText(item, "item");
    RequestFields.requirePositive(count, "count");
  }

  @Override
  public Class<WithdrawReply> replyType() {
    return WithdrawReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
