package com.vaultmarket.domain.settlement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.domain.common.ErrorCategory;
import com.vaultmarket.domain.common.InMemoryAuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.ledger.LedgerStore;
import com.vaultmarket.domain.listings.Listing;
import com.vaultmarket.domain.listings.ListingStore;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalLedgerGatewayTest {
  private final Clock clock = Clock.systemUTC();
  private LedgerStore ledger;
  private LocalLedgerGateway gateway;

  @BeforeEach
  void setUp() {
    ledger = new LedgerStore(new InMemoryAuditTrail(), clock);
    for (String name : new String[] {"alice", "bob"}) {
      ledger.register(name, "pin");
      ledger.approve(name);
    }
    ledger.adjust("bob", 100);
    gateway = new LocalLedgerGateway(ledger);
  }

  @Test
  void shouldApplyTransferOnce() {
    assertTrue(gateway.transfer("settle-1", "bob", "alice", 40).isApplied());
    assertTrue(gateway.transfer("settle-1", "bob", "alice", 40).isApplied());

    assertEquals(60L, ledger.account("bob").balance());
    assertEquals(40L, ledger.account("alice").balance());
  }

  @Test
  void shouldMapLedgerRejection() {
    ChargeOutcome outcome = gateway.transfer("settle-2", "bob", "alice", 1000);

    assertEquals(ChargeStatus.REJECTED, outcome.status());
    assertEquals("INSUFFICIENT_FUNDS", outcome.errorCode());
    assertEquals(ErrorCategory.INSUFFICIENT_RESOURCE, outcome.category());
  }

  @Test
  void shouldSettleEndToEndAgainstInProcessLedger() {
    SimulatedContainerNetwork network = new SimulatedContainerNetwork();
    SimulatedContainer vault = network.attach("vault", 27);
    SimulatedContainer sellerChest = network.attach("chest_alice", 9);
    network.attach("chest_bob", 9);
    InMemoryAuditTrail audit = new InMemoryAuditTrail();
    InventoryMover mover = new InventoryMover(network);
    ListingStore listings = new ListingStore(mover, () -> "vault", audit, clock);
    SettlementProtocol protocol =
        new SettlementProtocol(
            listings, mover, network, gateway, PriceQuoter.none(), audit, clock);
    Listing listing = listings.create("alice", "widget", 10);
    sellerChest.insert("widget", 5);
    listings.addStock(listing.id(), "alice", "widget", 5, "chest_alice");
    long totalBefore = ledger.totalBalance();

    SettlementResult result =
        protocol.purchase(new PurchaseRequest(listing.id(), "bob", 3, "chest_bob"));

    assertEquals(SettlementState.SETTLED, result.state());
    assertEquals(70L, ledger.account("bob").balance());
    assertEquals(30L, ledger.account("alice").balance());
    assertEquals(totalBefore, ledger.totalBalance());
    assertEquals(2, vault.countOf("widget"));
    assertTrue(ledger.findTransfer(result.settlementId()).orElseThrow().applied());
  }
}
