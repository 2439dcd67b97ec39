package com.vaultmarket.domain.settlement;

import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.common.ErrorCategory;
import com.vaultmarket.domain.inventory.ContainerNetwork;
import com.vaultmarket.domain.inventory.InventoryContainer;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.MoveResult;
import com.vaultmarket.domain.inventory.VaultScanner;
import com.vaultmarket.domain.listings.Listing;
import com.vaultmarket.domain.listings.ListingStore;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Purchase choreography: move goods out of the vault first, then charge the buyer. A failed or
 * ambiguous charge is compensated by moving the delivered units back into the vault.
 *
 * <p>The settlement id doubles as the ledger transfer id so a replayed charge cannot be applied
 * twice.
 */
public class SettlementProtocol {
  private static final Logger log = LoggerFactory.getLogger(SettlementProtocol.class);

  private final ListingStore listingStore;
  private final InventoryMover mover;
  private final ContainerNetwork network;
  private final LedgerGateway ledgerGateway;
  private final PriceQuoter priceQuoter;
  private final AuditTrail auditTrail;
  private final Clock clock;
  private final Supplier<String> settlementIds;

  public SettlementProtocol(
      ListingStore listingStore,
      InventoryMover mover,
      ContainerNetwork network,
      LedgerGateway ledgerGateway,
      PriceQuoter priceQuoter,
      AuditTrail auditTrail,
      Clock clock) {
    this(
        listingStore,
        mover,
        network,
        ledgerGateway,
        priceQuoter,
        auditTrail,
        clock,
        () -> "settle-" + UUID.randomUUID());
  }

  public SettlementProtocol(
      ListingStore listingStore,
      InventoryMover mover,
      ContainerNetwork network,
      LedgerGateway ledgerGateway,
      PriceQuoter priceQuoter,
      AuditTrail auditTrail,
      Clock clock,
      Supplier<String> settlementIds) {
    this.listingStore = Objects.requireNonNull(listingStore, "listingStore must not be null");
    this.mover = Objects.requireNonNull(mover, "mover must not be null");
    this.network = Objects.requireNonNull(network, "network must not be null");
    this.ledgerGateway = Objects.requireNonNull(ledgerGateway, "ledgerGateway must not be null");
    this.priceQuoter = Objects.requireNonNull(priceQuoter, "priceQuoter must not be null");
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.settlementIds = Objects.requireNonNull(settlementIds, "settlementIds must not be null");
  }

  public SettlementResult purchase(PurchaseRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    Attempt attempt = new Attempt(settlementIds.get(), request);

    if (request.listingId() <= 0
        || request.requestedCount() <= 0
        || isBlank(request.buyer())
        || isBlank(request.destinationContainer())) {
      return attempt.fail(SettlementError.INVALID_REQUEST, "Bad params");
    }
    Optional<Listing> found = listingStore.find(request.listingId());
    if (found.isEmpty()) {
      return attempt.fail(SettlementError.LISTING_NOT_FOUND, "Listing not found");
    }
    Listing listing = found.get();
    attempt.item = listing.item();
    attempt.unitPrice = listing.unitPrice();
    if (listing.seller().equals(request.buyer())) {
      return attempt.fail(SettlementError.OWN_LISTING, "Cannot buy your own listing");
    }
    if (!listing.isAvailable()) {
      return attempt.fail(SettlementError.NOT_AVAILABLE, "Not available");
    }

    String vaultName = listingStore.vaultName();
    Optional<InventoryContainer> vault = network.find(vaultName);
    if (vault.isEmpty()) {
      return attempt.fail(SettlementError.VAULT_UNAVAILABLE, "Vault not found: " + vaultName);
    }
    int liveStock = VaultScanner.scan(vault.get()).count(listing.item());
    if (liveStock <= 0) {
      return attempt.fail(SettlementError.OUT_OF_STOCK, "Out of stock");
    }
    OptionalLong reference = priceQuoter.quote(listing.item(), liveStock);
    attempt.referencePrice = reference.isPresent() ? reference.getAsLong() : null;

    int take = Math.min(request.requestedCount(), Math.min(listing.quantityOnHand(), liveStock));
    if (take > Long.MAX_VALUE / listing.unitPrice()) {
      return attempt.fail(SettlementError.INVALID_REQUEST, "Purchase total out of range");
    }

    attempt.advance(SettlementState.DELIVERING);
    MoveResult delivery =
        mover.move(vaultName, request.destinationContainer(), listing.item(), take);
    if (!delivery.movedAnything()) {
      String reason = delivery.note() == null ? "Nothing delivered" : delivery.note();
      return attempt.fail(SettlementError.NOTHING_DELIVERED, reason);
    }
    attempt.delivered = delivery.moved();

    attempt.advance(SettlementState.CHARGING);
    long total = Math.multiplyExact((long) attempt.delivered, listing.unitPrice());
    ChargeOutcome charge =
        ledgerGateway.transfer(attempt.id, request.buyer(), listing.seller(), total);
    if (charge.isApplied()) {
      return settle(attempt, listing, total);
    }
    return compensate(attempt, listing, vaultName, charge);
  }

  private SettlementResult settle(Attempt attempt, Listing listing, long total) {
    listingStore.recordSale(listing.id(), attempt.delivered, attempt.request.buyer());
    attempt.totalCharged = total;
    attempt.advance(SettlementState.SETTLED);
    auditTrail.append(
        "Purchase "
            + attempt.request.buyer()
            + " bought "
            + attempt.delivered
            + " "
            + listing.item()
            + " from "
            + listing.seller()
            + " (#"
            + listing.id()
            + ") for "
            + total
            + " ["
            + attempt.id
            + "]");
    log.info(
        "Settlement settled settlementId={} listingId={} delivered={} total={}",
        attempt.id,
        listing.id(),
        attempt.delivered,
        total);
    return attempt.result(null, null, "Purchased " + attempt.delivered + " " + listing.item());
  }

  private SettlementResult compensate(
      Attempt attempt, Listing listing, String vaultName, ChargeOutcome charge) {
    attempt.advance(SettlementState.CHARGE_FAILED_COMPENSATING);
    log.warn(
        "Charge failed, returning goods settlementId={} status={} error={} message={}",
        attempt.id,
        charge.status(),
        charge.errorCode(),
        charge.message());

    MoveResult reversal =
        mover.move(
            attempt.request.destinationContainer(), vaultName, listing.item(), attempt.delivered);
    attempt.recovered = reversal.moved();
    String ledgerMessage = "Bank transfer failed: " + describe(charge);

    if (attempt.recovered >= attempt.delivered) {
      attempt.advance(SettlementState.REVERTED);
      if (charge.status() == ChargeStatus.UNKNOWN) {
        auditTrail.append(
            "Purchase reverted with unknown charge outcome; verify transfer "
                + attempt.id
                + " ("
                + attempt.request.buyer()
                + " -> "
                + listing.seller()
                + ", "
                + Math.multiplyExact((long) attempt.delivered, listing.unitPrice())
                + ")");
      }
      log.info(
          "Settlement reverted settlementId={} listingId={} recovered={}",
          attempt.id,
          listing.id(),
          attempt.recovered);
      return attempt.result(charge.errorCode(), charge.category(), ledgerMessage);
    }

    int lost = attempt.delivered - attempt.recovered;
    long uncharged = Math.multiplyExact((long) lost, listing.unitPrice());
    attempt.advance(SettlementState.CHARGE_FAILED_UNRECOVERED);
    listingStore.recordLoss(listing.id(), lost, attempt.id);
    auditTrail.append(
        "RECONCILE settlement "
            + attempt.id
            + ": listing #"
            + listing.id()
            + " "
            + lost
            + " "
            + listing.item()
            + " left with "
            + attempt.request.buyer()
            + " into "
            + attempt.request.destinationContainer()
            + " without charge; seller "
            + listing.seller()
            + " is owed "
            + uncharged
            + " (charge "
            + charge.status()
            + ": "
            + describe(charge)
            + ")");
    log.error(
        "Settlement unrecovered settlementId={} listingId={} buyer={} seller={} delivered={}"
            + " recovered={} unchargedAmount={}",
        attempt.id,
        listing.id(),
        attempt.request.buyer(),
        listing.seller(),
        attempt.delivered,
        attempt.recovered,
        uncharged);
    return attempt.result(
        SettlementError.UNRECOVERED_INCONSISTENCY.name(),
        ErrorCategory.UNRECOVERED_INCONSISTENCY,
        ledgerMessage + "; only " + attempt.recovered + " of " + attempt.delivered + " returned");
  }

  private static String describe(ChargeOutcome charge) {
    if (charge.message() != null && !charge.message().isBlank()) {
      return charge.message();
    }
    return charge.errorCode() == null ? "unknown error" : charge.errorCode();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private final class Attempt {
    private final String id;
    private final PurchaseRequest request;
    private SettlementState state = SettlementState.QUOTED;
    private String item;
    private long unitPrice;
    private Long referencePrice;
    private int delivered;
    private int recovered;
    private long totalCharged;

    private Attempt(String id, PurchaseRequest request) {
      this.id = id;
      this.request = request;
    }

    private void advance(SettlementState next) {
      SettlementStateMachine.validateTransition(state, next);
      log.debug("Settlement transition settlementId={} from={} to={}", id, state, next);
      state = next;
    }

    private SettlementResult fail(SettlementError error, String message) {
      advance(SettlementState.DELIVERY_FAILED);
      log.info(
          "Settlement delivery failed settlementId={} listingId={} error={} message={}",
          id,
          request.listingId(),
          error,
          message);
      return result(error.name(), error.category(), message);
    }

    private SettlementResult result(String errorCode, ErrorCategory category, String message) {
      return new SettlementResult(
          id,
          state,
          request.listingId(),
          request.buyer(),
          item,
          request.requestedCount(),
          delivered,
          recovered,
          unitPrice,
          totalCharged,
          referencePrice,
          errorCode,
          category,
          message,
          clock.instant());
    }
  }
}
