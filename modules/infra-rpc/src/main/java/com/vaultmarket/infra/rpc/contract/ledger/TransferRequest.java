package com.vaultmarket.infra.rpc.contract.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.vaultmarket.infra.rpc.contract.RequestFields;

/**
 * Moves funds between two approved accounts. Callers that may resend the same transfer must
 * supply a stable {@code transferId}; the ledger generates one when it is absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeName("transfer")
public record TransferRequest(String transferId, String from, String to, long amount)
    implements LedgerRequest<TransferReply> {
  public TransferRequest {
    if (transferId != null && transferId.isBlank()) {
      transferId = null;
    }
    from = RequestFields.requireText(from, "from");
    to = RequestFields.requireText(to, "to");
    RequestFields.requirePositive(amount, "amount");
  }

  @Override
  public Class<TransferReply> replyType() {
    return TransferReply.class;
  }

  @Override
  public boolean mutating() {
    return true;
  }
}
