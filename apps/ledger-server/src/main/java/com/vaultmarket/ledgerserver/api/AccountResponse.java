package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.domain.ledger.Account;
import java.time.Instant;

public record AccountResponse(String user, boolean approved, long balance, Instant createdAt) {
  public static AccountResponse from(Account account) {
    return new AccountResponse(
        account.identity(), account.approved(), account.balance(), account.createdAt());
  }
}
