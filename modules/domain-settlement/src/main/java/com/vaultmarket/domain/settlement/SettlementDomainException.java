package com.vaultmarket.domain.settlement;

public class SettlementDomainException extends RuntimeException {
  public SettlementDomainException(String message) {
    super(message);
  }
}
