package com.vaultmarket.ledgerserver.bank;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.domain.common.InMemoryAuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.ledger.InsufficientFundsException;
import com.vaultmarket.domain.ledger.LedgerError;
import com.vaultmarket.domain.ledger.LedgerException;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import com.vaultmarket.ledgerserver.state.LedgerSnapshot;
import com.vaultmarket.ledgerserver.state.LedgerState;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VaultBankingServiceTest {
  private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  @TempDir Path dataDir;

  private SimulatedContainerNetwork network;
  private SimulatedContainer vault;
  private SimulatedContainer chest;
  private LedgerState state;
  private VaultBankingService service;

  @BeforeEach
  void setUp() {
    network = new SimulatedContainerNetwork();
    vault = network.attach("vault", 54);
    chest = network.attach("client-1", 27);
    state =
        LedgerState.load(
            new JsonSnapshotStore<>(dataDir.resolve("ledger.json"), LedgerSnapshot.class),
            new InMemoryAuditTrail(100, clock),
            clock,
            "vault");
    state.upsertItem("iron", 100);
    state.ledger().register("alice", "pw");
    state.ledger().approve("alice");
    service = new VaultBankingService(state, network, new InventoryMover(network));
  }

  @Test
  void shouldCreditEachStackAtTheRunningVaultPrice() {
    chest.insert("iron", 70);

    DepositResult result = service.deposit("alice", "client-1");

    // 64 units at stock 0 pay the base price, the next 6 are priced at stock 64.
    assertEquals(Map.of("iron", 70), result.moved());
    assertEquals(64 * 100 + 6 * 92, result.credited());
    assertEquals(result.credited(), state.ledger().account("alice").balance());
    assertEquals(70, vault.countOf("iron"));
    assertEquals(0, chest.countOf("iron"));
  }

  @Test
  void shouldLeaveUnpricedItemsInTheClientChest() {
    chest.insert("iron", 5);
    chest.insert("dirt", 30);

    DepositResult result = service.deposit("alice", "client-1");

    assertEquals(5, result.totalMoved());
    assertEquals(30, chest.countOf("dirt"));
    assertEquals(0, vault.countOf("dirt"));
  }

  @Test
  void shouldFailDepositWhenNothingPricedWasMoved() {
    chest.insert("dirt", 30);

    VaultBankingException ex =
        assertThrows(VaultBankingException.class, () -> service.deposit("alice", "client-1"));

    assertEquals(VaultBankingError.NOTHING_MOVED, ex.error());
    assertEquals(0L, state.ledger().account("alice").balance());
  }

  @Test
  void shouldRejectDepositForUnapprovedAccountBeforeMovingGoods() {
    state.ledger().register("bob", "pw");
    chest.insert("iron", 5);

    LedgerException ex =
        assertThrows(LedgerException.class, () -> service.deposit("bob", "client-1"));

    assertEquals(LedgerError.NOT_APPROVED, ex.error());
    assertEquals(5, chest.countOf("iron"));
  }

  @Test
  void shouldReportMissingClientChest() {
    VaultBankingException ex =
        assertThrows(VaultBankingException.class, () -> service.deposit("alice", "nowhere"));

    assertEquals(VaultBankingError.CONTAINER_UNAVAILABLE, ex.error());
  }

  @Test
  void shouldWithdrawAtThePriceForCurrentStock() {
    vault.insert("iron", 10);
    state.ledger().adjust("alice", 10_000);

    WithdrawResult result = service.withdraw("alice", "client-1", "iron", 4);

    // 100 / (1 + 1.2 * 10 / 1000) = 98.8, rounded down.
    assertEquals(98L, result.unitPrice());
    assertEquals(4, result.moved());
    assertEquals(392L, result.charged());
    assertEquals(10_000L - 392L, result.balance());
    assertEquals(4, chest.countOf("iron"));
  }

  @Test
  void shouldChargeOnlyForDeliveredUnitsWhenTheChestFillsUp() {
    SimulatedContainer small = network.attach("small", 1);
    small.insert("iron", 60);
    vault.insert("iron", 10);
    state.ledger().adjust("alice", 10_000);

    WithdrawResult result = service.withdraw("alice", "small", "iron", 10);

    assertTrue(result.isShort());
    assertEquals(4, result.moved());
    assertEquals(4 * 98L, result.charged());
    assertEquals(10_000L - 4 * 98L, state.ledger().account("alice").balance());
    assertEquals(6, vault.countOf("iron"));
  }

  @Test
  void shouldRejectWithdrawBeyondVaultStock() {
    vault.insert("iron", 3);
    state.ledger().adjust("alice", 10_000);

    VaultBankingException ex =
        assertThrows(
            VaultBankingException.class, () -> service.withdraw("alice", "client-1", "iron", 5));

    assertEquals(VaultBankingError.INSUFFICIENT_STOCK, ex.error());
    assertEquals(3, vault.countOf("iron"));
  }

  @Test
  void shouldRejectWithdrawOfUnpricedItem() {
    vault.insert("dirt", 10);
    state.ledger().adjust("alice", 10_000);

    VaultBankingException ex =
        assertThrows(
            VaultBankingException.class, () -> service.withdraw("alice", "client-1", "dirt", 1));

    assertEquals(VaultBankingError.NOT_PRICED, ex.error());
  }

  @Test
  void shouldRejectWithdrawTheAccountCannotAfford() {
    vault.insert("iron", 10);
    state.ledger().adjust("alice", 50);

    assertThrows(
        InsufficientFundsException.class,
        () -> service.withdraw("alice", "client-1", "iron", 1));
    assertEquals(10, vault.countOf("iron"));
    assertEquals(50L, state.ledger().account("alice").balance());
  }

  @Test
  void shouldQuoteCatalogItemsAtLiveVaultStock() {
    state.upsertItem("gold", 500);
    vault.insert("iron", 500);

    List<ItemQuote> quotes = service.prices();

    assertEquals(2, quotes.size());
    ItemQuote gold = quotes.get(0);
    ItemQuote iron = quotes.get(1);
    assertEquals(new ItemQuote("gold", 500, 0, 500), gold);
    // 100 / (1 + 1.2 * 0.5) = 62.5
    assertEquals(new ItemQuote("iron", 62, 500, 100), iron);
  }

  @Test
  void shouldListOnlyPricedItemsInVaultStock() {
    vault.insert("iron", 10);
    vault.insert("dirt", 10);

    List<ItemQuote> stock = service.vaultStock();

    assertEquals(1, stock.size());
    assertEquals("iron", stock.get(0).item());
    assertEquals(10, stock.get(0).stock());
  }

  @Test
  void shouldReportUnconfiguredVaultOnStockView() {
    LedgerState noVault =
        LedgerState.load(
            new JsonSnapshotStore<>(dataDir.resolve("other.json"), LedgerSnapshot.class),
            new InMemoryAuditTrail(10, clock),
            clock,
            null);
    VaultBankingService unconfigured =
        new VaultBankingService(noVault, network, new InventoryMover(network));

    VaultBankingException ex = assertThrows(VaultBankingException.class, unconfigured::vaultStock);

    assertEquals(VaultBankingError.VAULT_NOT_CONFIGURED, ex.error());
    assertTrue(unconfigured.prices().isEmpty());
  }
}
