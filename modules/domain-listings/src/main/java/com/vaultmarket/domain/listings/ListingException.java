package com.vaultmarket.domain.listings;

import com.vaultmarket.domain.common.ErrorCategory;
import java.util.Objects;

public class ListingException extends RuntimeException {
  private final ListingError error;

  public ListingException(ListingError error, String message) {
    super(message);
    this.error = Objects.requireNonNull(error, "error must not be null");
  }

  public ListingError error() {
    return error;
  }

  public ErrorCategory category() {
    return error.category();
  }
}
