package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("depositFromClientChest")
public record DepositFromClientChestRequest(String user, String chestName)
    implements LedgerRequest<DepositReply> {
  public DepositFromClientChestRequest {
    user = RequestFields.requireText(user, "user");
    chestName = RequestFields.requireText(chestName, "chestName");
  }

  @Override
  public Class<DepositReply> replyType() {
    return DepositReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
