package com.vaultmarket.domain.settlement;

/**
 * The settlement's view of the ledger authority, local or remote. Implementations must pass the
 * transfer id through unchanged so the ledger can deduplicate replays.
 */
public interface LedgerGateway {
  ChargeOutcome transfer(String transferId, String from, String to, long amount);
}
