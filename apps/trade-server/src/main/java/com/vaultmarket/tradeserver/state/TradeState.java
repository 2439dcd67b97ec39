package com.vaultmarket.tradeserver.state;

import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.listings.ListingSequence;
import com.vaultmarket.domain.listings.ListingStore;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The trade process's in-memory state: listings and the vault they are stocked in. Only touched
 * from the dispatch thread.
 */
public class TradeState {
  private static final Logger log = LoggerFactory.getLogger(TradeState.class);

  private final ListingStore listings;
  private final AuditTrail auditTrail;
  private final JsonSnapshotStore<TradeSnapshot> snapshotStore;
  private String vaultName;

  TradeState(
      TradeSnapshot snapshot,
      InventoryMover mover,
      AuditTrail auditTrail,
      Clock clock,
      JsonSnapshotStore<TradeSnapshot> snapshotStore) {
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
    this.vaultName = snapshot.vaultName();
    this.listings =
        new ListingStore(
            snapshot.listings(),
            new ListingSequence(snapshot.nextListingId()),
            mover,
            this::vaultName,
            auditTrail,
            clock);
  }

  public static TradeState load(
      JsonSnapshotStore<TradeSnapshot> snapshotStore,
      InventoryMover mover,
      AuditTrail auditTrail,
      Clock clock,
      String defaultVaultName) {
    TradeSnapshot stored =
        snapshotStore
            .load()
            .orElseGet(
                () -> new TradeSnapshot(TradeSnapshot.CURRENT_VERSION, null, 1L, defaultVaultName));
    String vault = stored.vaultName() == null ? defaultVaultName : stored.vaultName();
    TradeSnapshot snapshot =
        new TradeSnapshot(stored.version(), stored.listings(), stored.nextListingId(), vault);
    TradeState state = new TradeState(snapshot, mover, auditTrail, clock, snapshotStore);
    log.info(
        "Loaded trade state listings={} nextListingId={} vault={}",
        snapshot.listings().size(),
        state.listings.nextId(),
        vault);
    return state;
  }

  public TradeSnapshot snapshot() {
    return new TradeSnapshot(
        TradeSnapshot.CURRENT_VERSION, listings.all(), listings.nextId(), vaultName);
  }

  public void save() {
    snapshotStore.save(snapshot());
  }

  public void configureVault(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("vault name must not be blank");
    }
    this.vaultName = name.trim();
    auditTrail.append("Vault container set: " + vaultName);
  }

  public ListingStore listings() {
    return listings;
  }

  public String vaultName() {
    return vaultName;
  }

  public AuditTrail auditTrail() {
    return auditTrail;
  }
}
