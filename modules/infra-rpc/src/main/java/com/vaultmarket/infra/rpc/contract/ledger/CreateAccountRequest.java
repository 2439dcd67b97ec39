package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.RequestFields;

@JsonTypeName("createAccount")
public record CreateAccountRequest(String user, String credential)
    implements LedgerRequest<AckReply> {
  public CreateAccountRequest {
    user = RequestFields.requireText(user, "user");
    RequestFields.requireText(credential, "credential");
  }

  @Override
  public Class<AckReply> replyType() {
    return AckReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
