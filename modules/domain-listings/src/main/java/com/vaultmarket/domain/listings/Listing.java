package com.vaultmarket.domain.listings;

import java.time.Instant;
import java.util.Objects;

/**
 * A seller's standing sell order. {@code quantityOnHand} counts units physically sitting in the
 * shared vault on behalf of this listing; the unit price is the seller's fixed ask.
 */
public record Listing(
    long id, String seller, String item, long unitPrice, int quantityOnHand, Instant createdAt) {
  public Listing {
    if (id <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "id must be > 0");
    }
    requireNonBlank(seller, "seller");
    requireNonBlank(item, "item");
    if (unitPrice <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "unitPrice must be > 0");
    }
    if (quantityOnHand < 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "quantityOnHand must be >= 0");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public Listing withQuantityOnHand(int quantity) {
    return new Listing(id, seller, item, unitPrice, quantity, createdAt);
  }

  public boolean isAvailable() {
    return quantityOnHand > 0;
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ListingException(ListingError.INVALID_REQUEST, field + " must not be blank");
    }
  }
}
