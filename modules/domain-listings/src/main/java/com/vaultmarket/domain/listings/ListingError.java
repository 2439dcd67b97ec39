package com.vaultmarket.domain.listings;

import com.vaultmarket.domain.common.ErrorCategory;

public enum ListingError {
  INVALID_REQUEST(ErrorCategory.VALIDATION),
  NOT_FOUND(ErrorCategory.VALIDATION),
  ITEM_MISMATCH(ErrorCategory.VALIDATION),
  NOT_OWNER(ErrorCategory.AUTHORIZATION),
  NOTHING_MOVED(ErrorCategory.INSUFFICIENT_RESOURCE),
  NOT_AVAILABLE(ErrorCategory.INSUFFICIENT_RESOURCE);

  private final ErrorCategory category;

  ListingError(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
