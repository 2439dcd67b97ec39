package com.vaultmarket.tradeserver.state;

import com.vaultmarket.domain.listings.Listing;
import java.util.List;

/** Listings, the next listing id and the vault container, written whole after each mutation. */
public record TradeSnapshot(
    int version, List<Listing> listings, long nextListingId, String vaultName) {
  public static final int CURRENT_VERSION = 1;

  public TradeSnapshot {
    listings = listings == null ? List.of() : List.copyOf(listings);
    if (nextListingId <= 0) {
      nextListingId = 1L;
    }
  }
}
