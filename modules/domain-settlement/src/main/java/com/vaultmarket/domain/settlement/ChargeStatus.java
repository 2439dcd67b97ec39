package com.vaultmarket.domain.settlement;

public enum ChargeStatus {
  APPLIED,
  REJECTED,
  /** No reply arrived in time; the ledger may or may not have applied the transfer. */
  UNKNOWN
}
