package com.vaultmarket.domain.settlement;

import com.vaultmarket.domain.ledger.LedgerException;
import com.vaultmarket.domain.ledger.LedgerStore;
import com.vaultmarket.domain.ledger.TransferCommand;
import java.util.Objects;

/** Binds settlement to a ledger store living in the same process. */
public class LocalLedgerGateway implements LedgerGateway {
  private final LedgerStore ledgerStore;

  public LocalLedgerGateway(LedgerStore ledgerStore) {
    this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore must not be null");
  }

  @Override
  public ChargeOutcome transfer(String transferId, String from, String to, long amount) {
    try {
      ledgerStore.transfer(new TransferCommand(transferId, from, to, amount));
      return ChargeOutcome.applied();
    } catch (LedgerException ex) {
      return ChargeOutcome.rejected(ex.error().name(), ex.category(), ex.getMessage());
    }
  }
}
