package com.vaultmarket.domain.common;

/** Failure classes shared by every store and by the settlement choreography. */
public enum ErrorCategory {
  /** Bad input shape or non-positive amount, count or price. */
  VALIDATION,
  /** Unknown account, bad credential, unapproved account or foreign listing. */
  AUTHORIZATION,
  /** Insufficient funds or insufficient physical stock. */
  INSUFFICIENT_RESOURCE,
  /** The remote side may or may not have applied the effect. */
  TRANSPORT_AMBIGUITY,
  /** Compensation under-delivered; needs manual reconciliation from the audit trail. */
  UNRECOVERED_INCONSISTENCY,
  INTERNAL;

  public boolean isClean() {
    return this == VALIDATION || this == AUTHORIZATION || this == INSUFFICIENT_RESOURCE;
  }
}
