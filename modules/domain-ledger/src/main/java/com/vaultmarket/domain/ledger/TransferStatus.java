package com.vaultmarket.domain.ledger;

public enum TransferStatus {
  APPLIED,
  REJECTED
}
