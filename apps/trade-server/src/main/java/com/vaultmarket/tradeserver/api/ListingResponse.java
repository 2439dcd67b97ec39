package com.vaultmarket.tradeserver.api;

import com.vaultmarket.domain.listings.Listing;
import java.time.Instant;

public record ListingResponse(
    long id, String seller, String item, long unitPrice, int quantityOnHand, Instant createdAt) {
  public static ListingResponse from(Listing listing) {
    return new ListingResponse(
        listing.id(),
        listing.seller(),
        listing.item(),
        listing.unitPrice(),
        listing.quantityOnHand(),
        listing.createdAt());
  }
}
