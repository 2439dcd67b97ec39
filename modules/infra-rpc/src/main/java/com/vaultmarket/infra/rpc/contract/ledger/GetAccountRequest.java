package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("getAccount")
public record GetAccountRequest(String user) implements LedgerRequest<AccountReply> {
  public GetAccountRequest {
    user = RequestFields.requireText(user, "user");
  }

  @Override
  public Class<AccountReply> replyType() {
    return AccountReply.class;
  }
}
