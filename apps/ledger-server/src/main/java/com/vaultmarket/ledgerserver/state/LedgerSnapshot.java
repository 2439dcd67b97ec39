package com.vaultmarket.ledgerserver.state;

import com.vaultmarket.domain.ledger.Account;
import com.vaultmarket.domain.ledger.TransferRecord;
import com.vaultmarket.domain.pricing.ItemPriceRecord;
import com.vaultmarket.domain.pricing.PriceConfiguration;
import java.util.List;

/** Everything the ledger server persists, written as one document after each mutation. */
public record LedgerSnapshot(
    int version,
    List<Account> accounts,
    List<TransferRecord> transfers,
    List<ItemPriceRecord> items,
    PriceConfiguration price,
    String vaultName) {
  public static final int CURRENT_VERSION = 1;

  public LedgerSnapshot {
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
    transfers = transfers == null ? List.of() : List.copyOf(transfers);
    items = items == null ? List.of() : List.copyOf(items);
  }
}
