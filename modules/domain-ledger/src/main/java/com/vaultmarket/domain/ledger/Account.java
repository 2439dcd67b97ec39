package com.vaultmarket.domain.ledger;

import java.time.Instant;
import java.util.Objects;

public record Account(
    String identity, String credential, boolean approved, long balance, Instant createdAt) {
  public Account {
    if (identity == null || identity.isBlank()) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, "identity must not be blank");
    }
    Objects.requireNonNull(credential, "credential must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    if (balance < 0) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, "balance must be >= 0");
    }
  }

  public static Account register(String identity, String credential, Instant now) {
    return new Account(identity, credential, false, 0L, now);
  }

  public Account withBalance(long nextBalance) {
    return new Account(identity, credential, approved, nextBalance, createdAt);
  }

  public Account approve() {
    return approved ? this : new Account(identity, credential, true, balance, createdAt);
  }

  @Override
  public String toString() {
    return "Account[identity="
        + identity
        + ", approved="
        + approved
        + ", balance="
        + balance
        + ", createdAt="
        + createdAt
        + "]";
  }
}
