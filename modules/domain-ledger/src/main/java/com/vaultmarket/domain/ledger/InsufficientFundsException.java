package com.vaultmarket.domain.ledger;

public class InsufficientFundsException extends LedgerException {
  private final String identity;
  private final long requested;
  private final long available;

  public InsufficientFundsException(String identity, long requested, long available) {
    super(
        LedgerError.INSUFFICIENT_FUNDS,
        String.format(
            "Insufficient funds for account %s: requested=%d, available=%d",
            identity, requested, available));
    this.identity = identity;
    this.requested = requested;
    this.available = available;
  }

  public String identity() {
    return identity;
  }

  public long requested() {
    return requested;
  }

  public long available() {
    return available;
  }
}
