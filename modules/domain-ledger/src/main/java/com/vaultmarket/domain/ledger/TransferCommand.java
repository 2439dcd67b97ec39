package com.vaultmarket.domain.ledger;

/** A request to move {@code amount} from one account to another, keyed by {@code transferId}. */
public record TransferCommand(String transferId, String from, String to, long amount) {
  public TransferCommand {
    from = from == null ? null : from.trim();
    to = to == null ? null : to.trim();
  }

  public boolean sameIntent(TransferRecord record) {
    return record.from().equals(from) && record.to().equals(to) && record.amount() == amount;
  }
}
