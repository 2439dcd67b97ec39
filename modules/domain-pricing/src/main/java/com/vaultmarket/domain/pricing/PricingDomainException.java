package com.vaultmarket.domain.pricing;

public class PricingDomainException extends RuntimeException {
  public PricingDomainException(String message) {
    super(message);
  }
}
