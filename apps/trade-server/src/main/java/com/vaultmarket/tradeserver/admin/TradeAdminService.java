package com.vaultmarket.tradeserver.admin;

import com.vaultmarket.domain.common.AuditRecord;
import com.vaultmarket.domain.inventory.VaultScanner;
import com.vaultmarket.domain.inventory.VaultStockSnapshot;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.listings.Listing;
import com.vaultmarket.domain.settlement.SettlementResult;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.tradeserver.settlement.SettlementJournal;
import com.vaultmarket.tradeserver.state.TradeState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Admin console operations, serialized with RPC requests on the process dispatcher. */
public class TradeAdminService {
  private final TradeState state;
  private final SimulatedContainerNetwork network;
  private final SettlementJournal journal;
  private final ProcessDispatcher dispatcher;

  public TradeAdminService(
      TradeState state,
      SimulatedContainerNetwork network,
      SettlementJournal journal,
      ProcessDispatcher dispatcher) {
    this.state = Objects.requireNonNull(state, "state must not be null");
    this.network = Objects.requireNonNull(network, "network must not be null");
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
  }

  public List<Listing> listings() {
    return dispatcher.call(() -> state.listings().all());
  }

  public Listing listing(long listingId) {
    return dispatcher.call(() -> state.listings().listing(listingId));
  }

  public List<SettlementResult> settlements(int limit) {
    return journal.recent(limit);
  }

  public List<SettlementResult> unrecoveredSettlements() {
    return journal.unrecovered();
  }

  public String vaultName() {
    return dispatcher.call(state::vaultName);
  }

  /** Live vault contents next to what the listings claim is stocked there. */
  public VaultView vault() {
    return dispatcher.call(
        () -> {
          String vaultName = state.vaultName();
          VaultStockSnapshot stock =
              VaultScanner.scan(network, vaultName).orElseGet(VaultStockSnapshot::empty);
          List<VaultView.Line> lines =
              stock.items().stream()
                  .sorted()
                  .map(
                      item ->
                          new VaultView.Line(
                              item, stock.count(item), state.listings().quantityOnHand(item)))
                  .toList();
          return new VaultView(vaultName, network.find(vaultName).isPresent(), lines);
        });
  }

  public String configureVault(String name) {
    return dispatcher.call(
        () -> {
          if (network.find(name == null ? null : name.trim()).isEmpty()) {
            throw new IllegalArgumentException("No such container: " + name);
          }
          state.configureVault(name);
          state.save();
          return state.vaultName();
        });
  }

  public List<AuditRecord> auditTail(int limit) {
    return dispatcher.call(() -> state.auditTrail().tail(limit));
  }

  public List<ContainerView> containers() {
    return dispatcher.call(
        () -> network.names().stream().map(this::view).flatMap(Optional::stream).toList());
  }

  public ContainerView container(String name) {
    return dispatcher.call(
        () ->
            view(name)
                .orElseThrow(() -> new IllegalArgumentException("No such container: " + name)));
  }

  public int insert(String containerName, String item, int count) {
    return dispatcher.call(() -> simulated(containerName).insert(item, count));
  }

  public int extract(String containerName, String item, int count) {
    return dispatcher.call(() -> simulated(containerName).extract(item, count));
  }

  private SimulatedContainer simulated(String name) {
    return network
        .container(name)
        .orElseThrow(() -> new IllegalArgumentException("No such container: " + name));
  }

  private Optional<ContainerView> view(String name) {
    return network
        .container(name)
        .map(
            container ->
                new ContainerView(
                    container.name(),
                    container.slotCount(),
                    VaultScanner.scan(container).counts()));
  }
}
