package com.vaultmarket.ledgerserver.admin;

import com.vaultmarket.domain.common.AuditRecord;
import com.vaultmarket.domain.inventory.VaultScanner;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainer;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.ledger.Account;
import com.vaultmarket.domain.ledger.TransferRecord;
import com.vaultmarket.domain.pricing.ItemPriceRecord;
import com.vaultmarket.domain.pricing.PriceConfiguration;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.ledgerserver.bank.ItemQuote;
import com.vaultmarket.ledgerserver.bank.VaultBankingService;
import com.vaultmarket.ledgerserver.state.LedgerState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Admin console operations. Each one runs on the process dispatcher so it never interleaves with
 * an RPC request, and every mutation is saved before it returns.
 */
public class LedgerAdminService {
  private final LedgerState state;
  private final VaultBankingService banking;
  private final SimulatedContainerNetwork network;
  private final ProcessDispatcher dispatcher;

  public LedgerAdminService(
      LedgerState state,
      VaultBankingService banking,
      SimulatedContainerNetwork network,
      ProcessDispatcher dispatcher) {
    this.state = Objects.requireNonNull(state, "state must not be null");
    this.banking = Objects.requireNonNull(banking, "banking must not be null");
    this.network = Objects.requireNonNull(network, "network must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
  }

  public Account register(String user, String credential) {
    return mutate(() -> state.ledger().register(user, credential));
  }

  public List<Account> accounts() {
    return dispatcher.call(() -> state.ledger().accounts());
  }

  public Account account(String user) {
    return dispatcher.call(() -> state.ledger().account(user));
  }

  public Account approve(String user) {
    return mutate(() -> state.ledger().approve(user));
  }

  public Account adjust(String user, long delta) {
    return mutate(() -> state.ledger().adjust(user, delta));
  }

  public Optional<TransferRecord> transfer(String transferId) {
    return dispatcher.call(() -> state.ledger().findTransfer(transferId));
  }

  public List<ItemPriceRecord> items() {
    return dispatcher.call(() -> state.catalog().all());
  }

  public ItemPriceRecord upsertItem(String item, long basePrice) {
    return mutate(() -> state.upsertItem(item, basePrice));
  }

  public boolean removeItem(String item) {
    return mutate(() -> state.removeItem(item));
  }

  public PriceConfiguration priceConfiguration() {
    return dispatcher.call(state::priceConfiguration);
  }

  /** Applies the given fields over the current configuration; null fields keep their value. */
  public PriceConfiguration updatePriceConfiguration(
      Long maxStock, Long minPrice, Double elasticity, String currencySymbol) {
    return mutate(
        () -> {
          PriceConfiguration current = state.priceConfiguration();
          PriceConfiguration next =
              PriceConfiguration.validated(
                  maxStock == null ? current.maxStock() : maxStock,
                  minPrice == null ? current.minPrice() : minPrice,
                  elasticity == null ? current.elasticity() : elasticity,
                  currencySymbol == null ? current.currencySymbol() : currencySymbol);
          return state.updatePriceConfiguration(next);
        });
  }

  public String vaultName() {
    return dispatcher.call(state::vaultName);
  }

  public String configureVault(String name) {
    return mutate(
        () -> {
          if (network.find(name == null ? null : name.trim()).isEmpty()) {
            throw new IllegalArgumentException("No such container: " + name);
          }
          state.configureVault(name);
          return state.vaultName();
        });
  }

  public List<ItemQuote> vaultStock() {
    return dispatcher.call(banking::vaultStock);
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

  /** Places items into a simulated container; returns how many fit. */
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

  private <T> T mutate(Supplier<T> change) {
    return dispatcher.call(
        () -> {
          T result = change.get();
          state.save();
          return result;
        });
  }
}
