package com.vaultmarket.ledgerserver.bank;

import com.vaultmarket.domain.inventory.ContainerNetwork;
import com.vaultmarket.domain.inventory.InventoryContainer;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.ItemStack;
import com.vaultmarket.domain.inventory.MoveResult;
import com.vaultmarket.domain.inventory.VaultScanner;
import com.vaultmarket.domain.inventory.VaultStockSnapshot;
import com.vaultmarket.domain.ledger.Account;
import com.vaultmarket.domain.ledger.InsufficientFundsException;
import com.vaultmarket.domain.ledger.LedgerError;
import com.vaultmarket.domain.ledger.LedgerException;
import com.vaultmarket.domain.pricing.ItemPriceRecord;
import com.vaultmarket.ledgerserver.state.LedgerState;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchanges goods in the vault for ledger credit at the elastic price. Every price is derived from
 * a fresh scan of the vault at the moment of use.
 */
public class VaultBankingService {
  private static final Logger log = LoggerFactory.getLogger(VaultBankingService.class);

  private final LedgerState state;
  private final ContainerNetwork network;
  private final InventoryMover mover;

  public VaultBankingService(LedgerState state, ContainerNetwork network, InventoryMover mover) {
    this.state = Objects.requireNonNull(state, "state must not be null");
    this.network = Objects.requireNonNull(network, "network must not be null");
    this.mover = Objects.requireNonNull(mover, "mover must not be null");
  }

  /** Quotes every catalog item; a missing vault quotes at zero stock. */
  public List<ItemQuote> prices() {
    VaultStockSnapshot stock = scanVaultOrEmpty();
    List<ItemQuote> quotes = new ArrayList<>();
    for (ItemPriceRecord record : state.catalog().all()) {
      int count = stock.count(record.item());
      OptionalLong price = state.pricing().price(record.item(), count);
      if (price.isPresent()) {
        quotes.add(new ItemQuote(record.item(), price.getAsLong(), count, record.basePrice()));
      }
    }
    return quotes;
  }

  /** Priced items currently in the vault; unpriced items are left out. */
  public List<ItemQuote> vaultStock() {
    VaultStockSnapshot stock = VaultScanner.scan(vault());
    List<ItemQuote> lines = new ArrayList<>();
    for (String item : stock.items()) {
      int count = stock.count(item);
      OptionalLong price = state.pricing().price(item, count);
      if (price.isPresent()) {
        long base = state.catalog().find(item).map(ItemPriceRecord::basePrice).orElse(0L);
        lines.add(new ItemQuote(item, price.getAsLong(), count, base));
      }
    }
    return lines;
  }

  /**
   * Moves every priced stack out of the client's container into the vault and credits the account
   * with what arrived. Each stack is priced at the vault stock including the units deposited
   * before it.
   */
  public DepositResult deposit(String user, String chestName) {
    Account account = approvedAccount(user);
    InventoryContainer source = container(chestName);
    InventoryContainer vault = vault();

    Map<String, Integer> running = new HashMap<>(VaultScanner.scan(vault).counts());
    Map<String, Integer> moved = new TreeMap<>();
    long credited = 0L;
    for (ItemStack stack : new TreeMap<>(source.list()).values()) {
      String item = stack.item();
      int before = running.getOrDefault(item, 0);
      OptionalLong unitPrice = state.pricing().price(item, before);
      if (unitPrice.isEmpty()) {
        continue;
      }
      MoveResult move = mover.move(source, vault, item, stack.count());
      if (!move.movedAnything()) {
        continue;
      }
      running.put(item, before + move.moved());
      moved.merge(item, move.moved(), Integer::sum);
      long value = Math.multiplyExact((long) move.moved(), unitPrice.getAsLong());
      credited = Math.addExact(credited, value);
    }

    if (moved.isEmpty()) {
      throw new VaultBankingException(
          VaultBankingError.NOTHING_MOVED, "No priced items or nothing moved");
    }
    int units = moved.values().stream().mapToInt(Integer::intValue).sum();
    long balance = account.balance();
    // A zero floor price can make the whole deposit worth nothing.
    if (credited > 0) {
      balance =
          state
              .ledger()
              .credit(user, credited, "deposit of " + units + " items from " + chestName)
              .balance();
    }
    log.info("Deposit user={} chest={} units={} credited={}", user, chestName, units, credited);
    return new DepositResult(moved, credited, balance);
  }

  /**
   * Moves {@code count} units from the vault to the client's container at the current price. A
   * short move is billed for the delivered units only.
   */
  public WithdrawResult withdraw(String user, String chestName, String item, int count) {
    if (count <= 0) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, "count must be > 0");
    }
    Account account = approvedAccount(user);
    InventoryContainer vault = vault();
    InventoryContainer destination = container(chestName);

    int available = VaultScanner.scan(vault).count(item);
    if (available < count) {
      throw new VaultBankingException(
          VaultBankingError.INSUFFICIENT_STOCK,
          "Not enough stock: requested " + count + ", vault holds " + available);
    }
    OptionalLong price = state.pricing().price(item, available);
    if (price.isEmpty()) {
      throw new VaultBankingException(VaultBankingError.NOT_PRICED, "Item not priced: " + item);
    }
    long unitPrice = price.getAsLong();
    long cost = Math.multiplyExact(unitPrice, (long) count);
    if (account.balance() < cost) {
      throw new InsufficientFundsException(user, cost, account.balance());
    }

    MoveResult move = mover.move(vault, destination, item, count);
    if (!move.movedAnything()) {
      String reason = move.note() == null ? "Nothing moved" : move.note();
      throw new VaultBankingException(VaultBankingError.NOTHING_MOVED, reason);
    }
    long charged = Math.multiplyExact(unitPrice, (long) move.moved());
    long balance = account.balance();
    if (charged > 0) {
      balance =
          state
              .ledger()
              .debit(user, charged, "withdrew " + move.moved() + "x " + item + " to " + chestName)
              .balance();
    }
    if (move.isShort()) {
      log.warn(
          "Partial withdraw user={} item={} requested={} moved={} charged={}",
          user,
          item,
          count,
          move.moved(),
          charged);
    }
    return new WithdrawResult(count, move.moved(), unitPrice, charged, balance);
  }

  private Account approvedAccount(String user) {
    Account account = state.ledger().account(user);
    if (!account.approved()) {
      throw new LedgerException(LedgerError.NOT_APPROVED, "Account not approved: " + user);
    }
    return account;
  }

  private InventoryContainer vault() {
    String vaultName = state.vaultName();
    if (vaultName == null) {
      throw new VaultBankingException(
          VaultBankingError.VAULT_NOT_CONFIGURED, "Vault not configured");
    }
    return network
        .find(vaultName)
        .orElseThrow(
            () ->
                new VaultBankingException(
                    VaultBankingError.CONTAINER_UNAVAILABLE, "Vault missing: " + vaultName));
  }

  private InventoryContainer container(String name) {
    return network
        .find(name)
        .orElseThrow(
            () ->
                new VaultBankingException(
                    VaultBankingError.CONTAINER_UNAVAILABLE, "Client chest missing: " + name));
  }

  private VaultStockSnapshot scanVaultOrEmpty() {
    String vaultName = state.vaultName();
    if (vaultName == null) {
      return VaultStockSnapshot.empty();
    }
    return VaultScanner.scan(network, vaultName)
        .orElseGet(
            () -> {
              log.warn("Vault container not found name={}, quoting at zero stock", vaultName);
              return VaultStockSnapshot.empty();
            });
  }
}
