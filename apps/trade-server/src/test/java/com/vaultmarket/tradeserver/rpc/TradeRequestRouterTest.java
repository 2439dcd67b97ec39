package com.vaultmarket.tradeserver.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.vaultmarket.domain.common.InMemoryAuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.ledger.LedgerStore;
import com.vaultmarket.domain.listings.ListingError;
import com.vaultmarket.domain.settlement.LocalLedgerGateway;
import com.vaultmarket.domain.settlement.PriceQuoter;
import com.vaultmarket.domain.settlement.SettlementError;
import com.vaultmarket.domain.settlement.SettlementProtocol;
import com.vaultmarket.infra.rpc.client.RpcCallStatus;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.ledger.AccountReply;
import com.vaultmarket.infra.rpc.contract.trade.AddStockReply;
import com.vaultmarket.infra.rpc.contract.trade.AddStockRequest;
import com.vaultmarket.infra.rpc.contract.trade.BalanceReply;
import com.vaultmarket.infra.rpc.contract.trade.BuyReply;
import com.vaultmarket.infra.rpc.contract.trade.BuyRequest;
import com.vaultmarket.infra.rpc.contract.trade.CreateListingReply;
import com.vaultmarket.infra.rpc.contract.trade.CreateListingRequest;
import com.vaultmarket.infra.rpc.contract.trade.GetBalanceRequest;
import com.vaultmarket.infra.rpc.contract.trade.GetListingsRequest;
import com.vaultmarket.infra.rpc.contract.trade.ListingsReply;
import com.vaultmarket.infra.rpc.contract.trade.TradeLoginRequest;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import com.vaultmarket.tradeserver.ledger.LedgerClient;
import com.vaultmarket.tradeserver.settlement.SettlementJournal;
import com.vaultmarket.tradeserver.state.TradeSnapshot;
import com.vaultmarket.tradeserver.state.TradeState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeRequestRouterTest {
  private static final String DIAMOND = "minecraft:diamond";

  private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  @TempDir Path dataDir;
  @Mock private LedgerClient ledgerClient;

  private Path snapshotFile;
  private SimulatedContainerNetwork network;
  private LedgerStore ledger;
  private TradeState state;
  private SettlementJournal journal;
  private TradeRequestRouter router;

  @BeforeEach
  void setUp() {
    snapshotFile = dataDir.resolve("trade.json");
    network = new SimulatedContainerNetwork();
    network.attach("vault", 54);
    network.attach("seller-1", 27);
    network.attach("buyer-1", 27);
    InventoryMover mover = new InventoryMover(network);
    InMemoryAuditTrail audit = new InMemoryAuditTrail(200, clock);
    state =
        TradeState.load(
            new JsonSnapshotStore<>(snapshotFile, TradeSnapshot.class),
            mover,
            audit,
            clock,
            "vault");

    ledger = new LedgerStore(new InMemoryAuditTrail(200, clock), clock);
    openAccount("alice", 0L);
    openAccount("bob", 100L);

    AtomicInteger ids = new AtomicInteger();
    SettlementProtocol settlement =
        new SettlementProtocol(
            state.listings(),
            mover,
            network,
            new LocalLedgerGateway(ledger),
            PriceQuoter.none(),
            audit,
            clock,
            () -> "settle-" + ids.incrementAndGet());
    journal = new SettlementJournal(10, new SimpleMeterRegistry());
    router = new TradeRequestRouter(state, settlement, journal, ledgerClient);
  }

  @Test
  void shouldCreateListingAndPersistIt() {
    RpcReply reply = router.handle(new CreateListingRequest("alice", DIAMOND, 10L));

    CreateListingReply created = assertInstanceOf(CreateListingReply.class, reply);
    assertTrue(created.ok());
    assertEquals(1L, created.listingId());
    assertTrue(Files.exists(snapshotFile));
  }

  @Test
  void shouldStockListingWithWhatActuallyMoved() {
    router.handle(new CreateListingRequest("alice", DIAMOND, 10L));
    network.container("seller-1").orElseThrow().insert(DIAMOND, 3);

    RpcReply reply = router.handle(new AddStockRequest("alice", 1L, DIAMOND, 5, "seller-1"));

    AddStockReply stocked = assertInstanceOf(AddStockReply.class, reply);
    assertTrue(stocked.ok());
    assertEquals(3, stocked.moved());
    assertEquals(3, stocked.quantityOnHand());
    assertEquals(3, network.container("vault").orElseThrow().countOf(DIAMOND));
  }

  @Test
  void shouldRejectStockingSomeoneElsesListing() {
    router.handle(new CreateListingRequest("alice", DIAMOND, 10L));

    RpcReply reply = router.handle(new AddStockRequest("bob", 1L, DIAMOND, 1, "seller-1"));

    assertFalse(reply.ok());
    assertEquals(RpcErrorCode.NOT_OWNER, reply.errorCode());
  }

  @Test
  void shouldSettlePurchaseAndChargeBuyer() {
    stockListing(5);

    RpcReply reply = router.handle(new BuyRequest("bob", 1L, 4, "buyer-1"));

    BuyReply bought = assertInstanceOf(BuyReply.class, reply);
    assertTrue(bought.ok());
    assertEquals(4, bought.moved());
    assertEquals(40L, bought.total());
    assertEquals("SETTLED", bought.state());
    assertEquals("settle-1", bought.settlementId());
    assertEquals(60L, ledger.account("bob").balance());
    assertEquals(40L, ledger.account("alice").balance());
    assertEquals(1, state.listings().listing(1L).quantityOnHand());
    assertEquals(4, network.container("buyer-1").orElseThrow().countOf(DIAMOND));
    assertEquals(1, journal.recent(10).size());
  }

  @Test
  void shouldDeliverOnlyWhatIsAvailable() {
    stockListing(2);

    BuyReply bought = (BuyReply) router.handle(new BuyRequest("bob", 1L, 5, "buyer-1"));

    assertTrue(bought.ok());
    assertEquals(2, bought.moved());
    assertEquals(20L, bought.total());
    assertEquals(80L, ledger.account("bob").balance());
  }

  @Test
  void shouldRevertPurchaseTheBuyerCannotAfford() {
    stockListing(5);
    openAccount("carol", 15L);

    BuyReply bought = (BuyReply) router.handle(new BuyRequest("carol", 1L, 5, "buyer-1"));

    assertFalse(bought.ok());
    assertEquals(RpcErrorCode.INSUFFICIENT_FUNDS, bought.errorCode());
    assertEquals("REVERTED", bought.state());
    assertEquals(0, bought.moved());
    assertEquals(15L, ledger.account("carol").balance());
    assertEquals(5, state.listings().listing(1L).quantityOnHand());
    assertEquals(5, network.container("vault").orElseThrow().countOf(DIAMOND));
  }

  @Test
  void shouldRefuseToSellToTheSeller() {
    stockListing(5);

    BuyReply bought = (BuyReply) router.handle(new BuyRequest("alice", 1L, 1, "buyer-1"));

    assertFalse(bought.ok());
    assertEquals(RpcErrorCode.VALIDATION, bought.errorCode());
    assertEquals("DELIVERY_FAILED", bought.state());
  }

  @Test
  void shouldListListingsById() {
    router.handle(new CreateListingRequest("alice", "minecraft:emerald", 3L));
    router.handle(new CreateListingRequest("alice", DIAMOND, 10L));

    ListingsReply reply = (ListingsReply) router.handle(new GetListingsRequest());

    assertEquals(2, reply.listings().size());
    assertEquals(1L, reply.listings().get(0).id());
    assertEquals(DIAMOND, reply.listings().get(1).item());
  }

  @Test
  void shouldForwardLoginToLedger() {
    when(ledgerClient.login("bob", "pw"))
        .thenReturn(
            new RpcResponse<>(
                RpcCallStatus.REPLIED,
                AckReply.failure(RpcErrorCode.NOT_APPROVED, "Account not approved"),
                "c-1",
                null,
                Duration.ofMillis(2)));

    RpcReply reply = router.handle(new TradeLoginRequest("bob", "pw"));

    assertFalse(reply.ok());
    assertEquals(RpcErrorCode.NOT_APPROVED, reply.errorCode());
  }

  @Test
  void shouldReportTimeoutWhenLedgerIsSilent() {
    when(ledgerClient.account("bob"))
        .thenReturn(
            new RpcResponse<AccountReply>(
                RpcCallStatus.TIMEOUT, null, "c-1", "No reply", Duration.ofSeconds(6)));

    BalanceReply reply = (BalanceReply) router.handle(new GetBalanceRequest("bob"));

    assertFalse(reply.ok());
    assertEquals(RpcErrorCode.TIMEOUT, reply.errorCode());
    assertTrue(reply.error().startsWith("Bank unavailable"));
  }

  @Test
  void shouldReturnBalanceFromLedger() {
    when(ledgerClient.account("bob"))
        .thenReturn(
            new RpcResponse<>(
                RpcCallStatus.REPLIED,
                AccountReply.success("bob", 100L, true),
                "c-1",
                null,
                Duration.ofMillis(2)));

    BalanceReply reply = (BalanceReply) router.handle(new GetBalanceRequest("bob"));

    assertTrue(reply.ok());
    assertEquals(100L, reply.balance());
  }

  @Test
  void readOnlyRequestsShouldNotPersist() {
    router.handle(new GetListingsRequest());

    assertFalse(Files.exists(snapshotFile));
    verifyNoInteractions(ledgerClient);
  }

  @Test
  void shouldMapDomainErrorsToReplyCodes() {
    assertEquals(RpcErrorCode.NOT_FOUND, TradeRequestRouter.errorCode(ListingError.NOT_FOUND));
    assertEquals(
        RpcErrorCode.INSUFFICIENT_STOCK,
        TradeRequestRouter.errorCode(SettlementError.OUT_OF_STOCK));
    assertEquals(
        RpcErrorCode.UNRECOVERED_INCONSISTENCY,
        TradeRequestRouter.errorCode("UNRECOVERED_INCONSISTENCY"));
    assertEquals(RpcErrorCode.TIMEOUT, TradeRequestRouter.errorCode("TIMEOUT"));
    assertEquals(RpcErrorCode.INTERNAL, TradeRequestRouter.errorCode("SOMETHING_ELSE"));
  }

  private void stockListing(int units) {
    router.handle(new CreateListingRequest("alice", DIAMOND, 10L));
    network.container("seller-1").orElseThrow().insert(DIAMOND, units);
    router.handle(new AddStockRequest("alice", 1L, DIAMOND, units, "seller-1"));
  }

  private void openAccount(String user, long balance) {
    ledger.register(user, "pw");
    ledger.approve(user);
    if (balance > 0) {
      ledger.credit(user, balance, "opening balance");
    }
  }
}
