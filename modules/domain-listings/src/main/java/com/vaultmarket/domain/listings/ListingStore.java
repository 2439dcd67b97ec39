package com.vaultmarket.domain.listings;

import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.MoveResult;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seller-owned listings backed by the shared vault. Quantity-on-hand only ever grows by units the
 * mover confirms were delivered into the vault and only shrinks by units delivered to a buyer.
 */
public class ListingStore {
  /** Highest ask at which any int quantity still totals within a {@code long}. */
  public static final long MAX_UNIT_PRICE = Long.MAX_VALUE / Integer.MAX_VALUE;

  private static final Logger log = LoggerFactory.getLogger(ListingStore.class);

  private final Map<Long, Listing> listings = new TreeMap<>();
  private final ListingSequence sequence;
  private final InventoryMover mover;
  private final Supplier<String> vaultName;
  private final AuditTrail auditTrail;
  private final Clock clock;

  public ListingStore(
      InventoryMover mover, Supplier<String> vaultName, AuditTrail auditTrail, Clock clock) {
    this(List.of(), new ListingSequence(), mover, vaultName, auditTrail, clock);
  }

  public ListingStore(
      Collection<Listing> initialListings,
      ListingSequence sequence,
      InventoryMover mover,
      Supplier<String> vaultName,
      AuditTrail auditTrail,
      Clock clock) {
    this.sequence = Objects.requireNonNull(sequence, "sequence must not be null");
    this.mover = Objects.requireNonNull(mover, "mover must not be null");
    this.vaultName = Objects.requireNonNull(vaultName, "vaultName must not be null");
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    for (Listing listing : initialListings) {
      listings.put(listing.id(), listing);
      sequence.observe(listing.id());
    }
  }

  public Listing create(String seller, String item, long unitPrice) {
    if (item == null || item.isBlank()) {
      throw new ListingException(ListingError.INVALID_REQUEST, "Item must not be empty");
    }
    if (unitPrice <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "Price must be > 0");
    }
    if (unitPrice > MAX_UNIT_PRICE) {
      throw new ListingException(
          ListingError.INVALID_REQUEST, "Price must be <= " + MAX_UNIT_PRICE);
    }
    if (seller == null || seller.isBlank()) {
      throw new ListingException(ListingError.INVALID_REQUEST, "Seller must not be empty");
    }
    Listing listing =
        new Listing(sequence.next(), seller, item.trim(), unitPrice, 0, clock.instant());
    listings.put(listing.id(), listing);
    auditTrail.append(
        "Listing #"
            + listing.id()
            + " created by "
            + seller
            + ": "
            + listing.item()
            + " @ "
            + unitPrice);
    return listing;
  }

  /**
   * Moves up to {@code requestedCount} units from the seller's container into the vault and
   * credits the listing with exactly what arrived.
   */
  public StockAddResult addStock(
      long listingId, String seller, String item, int requestedCount, String sourceContainer) {
    if (listingId <= 0 || requestedCount <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "Bad params");
    }
    Listing listing = listing(listingId);
    if (!listing.seller().equals(seller)) {
      throw new ListingException(ListingError.NOT_OWNER, "Not your listing");
    }
    if (!listing.item().equals(item)) {
      throw new ListingException(ListingError.ITEM_MISMATCH, "Item mismatch");
    }

    MoveResult move = mover.move(sourceContainer, vaultName.get(), item, requestedCount);
    if (!move.movedAnything()) {
      String reason = move.note() == null ? "No items moved" : move.note();
      throw new ListingException(ListingError.NOTHING_MOVED, reason);
    }

    Listing stocked = listing.withQuantityOnHand(listing.quantityOnHand() + move.moved());
    listings.put(listingId, stocked);
    auditTrail.append(
        "Listing #" + listingId + " stocked +" + move.moved() + " " + item + " by " + seller);
    if (move.isShort()) {
      log.info(
          "Partial stock add listingId={} requested={} moved={}",
          listingId,
          requestedCount,
          move.moved());
    }
    return new StockAddResult(stocked, move);
  }

  /** Decrements quantity-on-hand by exactly the units delivered to a buyer. */
  public Listing recordSale(long listingId, int unitsDelivered, String buyer) {
    if (unitsDelivered <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "unitsDelivered must be > 0");
    }
    Listing listing = listing(listingId);
    int remaining = listing.quantityOnHand() - unitsDelivered;
    if (remaining < 0) {
      log.warn(
          "Sale exceeded quantity on hand listingId={} onHand={} delivered={}",
          listingId,
          listing.quantityOnHand(),
          unitsDelivered);
      remaining = 0;
    }
    Listing sold = listing.withQuantityOnHand(remaining);
    listings.put(listingId, sold);
    auditTrail.append(
        "Listing #"
            + listingId
            + " sold "
            + unitsDelivered
            + " "
            + listing.item()
            + " to "
            + buyer
            + " @ "
            + listing.unitPrice());
    return sold;
  }

  /**
   * Writes off units that left the vault without being paid for and could not be brought back, so
   * the listing never claims stock the vault no longer holds.
   */
  public Listing recordLoss(long listingId, int unitsLost, String reference) {
    if (unitsLost <= 0) {
      throw new ListingException(ListingError.INVALID_REQUEST, "unitsLost must be > 0");
    }
    Listing listing = listing(listingId);
    Listing reduced = listing.withQuantityOnHand(Math.max(0, listing.quantityOnHand() - unitsLost));
    listings.put(listingId, reduced);
    auditTrail.append(
        "Listing #"
            + listingId
            + " wrote off "
            + unitsLost
            + " "
            + listing.item()
            + " unpaid ["
            + reference
            + "]");
    return reduced;
  }

  public Optional<Listing> find(long listingId) {
    return Optional.ofNullable(listings.get(listingId));
  }

  public Listing listing(long listingId) {
    return find(listingId)
        .orElseThrow(() -> new ListingException(ListingError.NOT_FOUND, "Listing not found"));
  }

  public List<Listing> all() {
    return List.copyOf(listings.values());
  }

  /** Listings with stock, cheapest first within each item. */
  public List<Listing> available() {
    return listings.values().stream()
        .filter(Listing::isAvailable)
        .sorted(Comparator.comparing(Listing::item).thenComparingLong(Listing::unitPrice))
        .toList();
  }

  public int quantityOnHand(String item) {
    return listings.values().stream()
        .filter(listing -> listing.item().equals(item))
        .mapToInt(Listing::quantityOnHand)
        .sum();
  }

  public long nextId() {
    return sequence.peek();
  }

  public String vaultName() {
    return vaultName.get();
  }
}
