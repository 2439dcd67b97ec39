package com.vaultmarket.ledgerserver.state;

import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.ledger.LedgerStore;
import com.vaultmarket.domain.pricing.ItemCatalog;
import com.vaultmarket.domain.pricing.ItemPriceRecord;
import com.vaultmarket.domain.pricing.PriceConfiguration;
import com.vaultmarket.domain.pricing.PricingEngine;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ledger process's in-memory state: accounts, item catalog, price curve and the configured
 * vault. Only touched from the dispatch thread; {@link #save()} writes all of it at once.
 */
public class LedgerState {
  private static final Logger log = LoggerFactory.getLogger(LedgerState.class);

  private final LedgerStore ledger;
  private final ItemCatalog catalog;
  private final PricingEngine pricing;
  private final AuditTrail auditTrail;
  private final JsonSnapshotStore<LedgerSnapshot> snapshotStore;
  private PriceConfiguration priceConfiguration;
  private String vaultName;

  LedgerState(
      LedgerStore ledger,
      ItemCatalog catalog,
      PriceConfiguration priceConfiguration,
      String vaultName,
      AuditTrail auditTrail,
      JsonSnapshotStore<LedgerSnapshot> snapshotStore) {
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    this.priceConfiguration =
        Objects.requireNonNull(priceConfiguration, "priceConfiguration must not be null");
    this.vaultName = vaultName;
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore must not be null");
    this.pricing = new PricingEngine(catalog, this::priceConfiguration);
  }

  /**
   * Restores the last snapshot, falling back to defaults for anything it does not carry. A
   * snapshot that exists but cannot be read fails the startup.
   */
  public static LedgerState load(
      JsonSnapshotStore<LedgerSnapshot> snapshotStore,
      AuditTrail auditTrail,
      Clock clock,
      String defaultVaultName) {
    Optional<LedgerSnapshot> stored = snapshotStore.load();
    LedgerSnapshot snapshot =
        stored.orElseGet(
            () ->
                new LedgerSnapshot(
                    LedgerSnapshot.CURRENT_VERSION, null, null, null, null, defaultVaultName));
    LedgerStore ledger =
        new LedgerStore(snapshot.accounts(), snapshot.transfers(), auditTrail, clock);
    PriceConfiguration price =
        snapshot.price() == null ? PriceConfiguration.defaults() : snapshot.price();
    String vault = snapshot.vaultName() == null ? defaultVaultName : snapshot.vaultName();
    log.info(
        "Loaded ledger state accounts={} transfers={} items={} vault={}",
        snapshot.accounts().size(),
        snapshot.transfers().size(),
        snapshot.items().size(),
        vault);
    return new LedgerState(
        ledger, new ItemCatalog(snapshot.items()), price, vault, auditTrail, snapshotStore);
  }

  public LedgerSnapshot snapshot() {
    return new LedgerSnapshot(
        LedgerSnapshot.CURRENT_VERSION,
        ledger.accounts(),
        ledger.transfers(),
        catalog.all(),
        priceConfiguration,
        vaultName);
  }

  public void save() {
    snapshotStore.save(snapshot());
  }

  public ItemPriceRecord upsertItem(String item, long basePrice) {
    ItemPriceRecord record = catalog.upsert(item, basePrice);
    auditTrail.append("Item priced: " + record.item() + " base " + format(basePrice));
    return record;
  }

  public boolean removeItem(String item) {
    boolean removed = catalog.remove(item);
    if (removed) {
      auditTrail.append("Item removed: " + item);
    }
    return removed;
  }

  public PriceConfiguration updatePriceConfiguration(PriceConfiguration next) {
    Objects.requireNonNull(next, "next must not be null");
    this.priceConfiguration = next;
    auditTrail.append(
        "Price config updated: maxStock="
            + next.maxStock()
            + " minPrice="
            + next.minPrice()
            + " elasticity="
            + next.elasticity()
            + " currency="
            + next.currencySymbol());
    return next;
  }

  public void configureVault(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("vault name must not be blank");
    }
    this.vaultName = name.trim();
    auditTrail.append("Vault container set: " + vaultName);
  }

  public String format(long amount) {
    return priceConfiguration.format(amount);
  }

  public LedgerStore ledger() {
    return ledger;
  }

  public ItemCatalog catalog() {
    return catalog;
  }

  public PricingEngine pricing() {
    return pricing;
  }

  public PriceConfiguration priceConfiguration() {
    return priceConfiguration;
  }

  /** Configured vault container, or null before an admin has set one. */
  public String vaultName() {
    return vaultName;
  }

  public AuditTrail auditTrail() {
    return auditTrail;
  }
}
