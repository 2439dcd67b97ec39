package com.vaultmarket.domain.ledger;

import com.vaultmarket.domain.common.AuditTrail;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative accounts and balances. Every mutation happens on the owning process's dispatch
 * thread, so the maps are not synchronized.
 *
 * <p>Transfers are idempotent per transfer id: the outcome of the first attempt, applied or
 * rejected, is recorded and returned again for every replay of the same id.
 */
public class LedgerStore {
  private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

  private final Map<String, Account> accounts = new TreeMap<>();
  private final Map<String, TransferRecord> transfers = new LinkedHashMap<>();
  private final AuditTrail auditTrail;
  private final Clock clock;

  public LedgerStore(AuditTrail auditTrail, Clock clock) {
    this(List.of(), List.of(), auditTrail, clock);
  }

  public LedgerStore(
      Collection<Account> initialAccounts,
      Collection<TransferRecord> initialTransfers,
      AuditTrail auditTrail,
      Clock clock) {
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    for (Account account : initialAccounts) {
      accounts.put(account.identity(), account);
    }
    for (TransferRecord record : initialTransfers) {
      transfers.put(record.transferId(), record);
    }
  }

  public Account register(String identity, String credential) {
    requireText(identity, "identity");
    requireText(credential, "credential");
    String name = identity.trim();
    if (accounts.containsKey(name)) {
      throw new LedgerException(LedgerError.ALREADY_EXISTS, "Account already exists: " + name);
    }
    Account account = Account.register(name, credential, clock.instant());
    accounts.put(name, account);
    auditTrail.append("Account created: " + name);
    log.info("Registered account identity={}", name);
    return account;
  }

  public Account authenticate(String identity, String credential) {
    Account account = find(identity).orElse(null);
    if (account == null) {
      throw new LedgerException(LedgerError.NOT_FOUND, "No such account: " + identity);
    }
    if (credential == null || !credentialMatches(account.credential(), credential)) {
      throw new LedgerException(LedgerError.BAD_CREDENTIAL, "Bad credential");
    }
    if (!account.approved()) {
      throw new LedgerException(LedgerError.NOT_APPROVED, "Account not approved yet");
    }
    return account;
  }

  public Account approve(String identity) {
    Account account = account(identity);
    if (account.approved()) {
      return account;
    }
    Account approved = account.approve();
    accounts.put(approved.identity(), approved);
    auditTrail.append("Account approved: " + approved.identity());
    return approved;
  }

  /** Admin credit or debit; the resulting balance is clamped at zero. */
  public Account adjust(String identity, long delta) {
    Account account = account(identity);
    long next = clampedSum(account.balance(), delta);
    Account adjusted = account.withBalance(next);
    accounts.put(adjusted.identity(), adjusted);
    auditTrail.append(
        "Admin adjust "
            + adjusted.identity()
            + " by "
            + signed(delta)
            + " (balance "
            + next
            + ")");
    return adjusted;
  }

  public TransferReceipt transfer(TransferCommand command) {
    Objects.requireNonNull(command, "command must not be null");
    requireText(command.transferId(), "transferId");
    requireText(command.from(), "from");
    requireText(command.to(), "to");

    TransferRecord existing = transfers.get(command.transferId());
    if (existing != null) {
      return replay(command, existing);
    }

    try {
      long fromBalance = applyTransfer(command);
      TransferRecord record = TransferRecord.applied(command, clock.instant());
      transfers.put(record.transferId(), record);
      auditTrail.append(
          "Transfer "
              + command.from()
              + " -> "
              + command.to()
              + ": "
              + command.amount()
              + " ["
              + command.transferId()
              + "]");
      return new TransferReceipt(record, fromBalance, false);
    } catch (LedgerException ex) {
      transfers.put(
          command.transferId(), TransferRecord.rejected(command, ex, clock.instant()));
      throw ex;
    }
  }

  /** Credits an approved account, e.g. for goods deposited into the vault. */
  public Account credit(String identity, long amount, String reason) {
    requirePositive(amount);
    Account account = approvedAccount(identity, LedgerError.NOT_FOUND);
    Account credited = account.withBalance(Math.addExact(account.balance(), amount));
    accounts.put(credited.identity(), credited);
    auditTrail.append("Credit " + credited.identity() + " +" + amount + " (" + reason + ")");
    return credited;
  }

  /** Debits an approved account that can cover the amount, e.g. for goods withdrawn. */
  public Account debit(String identity, long amount, String reason) {
    requirePositive(amount);
    Account account = approvedAccount(identity, LedgerError.NOT_FOUND);
    if (account.balance() < amount) {
      throw new InsufficientFundsException(account.identity(), amount, account.balance());
    }
    Account debited = account.withBalance(account.balance() - amount);
    accounts.put(debited.identity(), debited);
    auditTrail.append("Debit " + debited.identity() + " -" + amount + " (" + reason + ")");
    return debited;
  }

  /** Looks an account up by name; surrounding whitespace is ignored, as at registration. */
  public Optional<Account> find(String identity) {
    if (identity == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(accounts.get(identity.trim()));
  }

  public Account account(String identity) {
    return find(identity)
        .orElseThrow(
            () -> new LedgerException(LedgerError.NOT_FOUND, "No such account: " + identity));
  }

  public List<Account> accounts() {
    return List.copyOf(accounts.values());
  }

  public long totalBalance() {
    return accounts.values().stream().mapToLong(Account::balance).sum();
  }

  public Optional<TransferRecord> findTransfer(String transferId) {
    if (transferId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(transfers.get(transferId));
  }

  public List<TransferRecord> transfers() {
    return List.copyOf(transfers.values());
  }

  private long applyTransfer(TransferCommand command) {
    requirePositive(command.amount());
    if (command.from().equals(command.to())) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, "Cannot transfer to the same account");
    }
    Account from = approvedAccount(command.from(), LedgerError.UNKNOWN_ACCOUNT);
    Account to = approvedAccount(command.to(), LedgerError.UNKNOWN_ACCOUNT);
    if (from.balance() < command.amount()) {
      throw new InsufficientFundsException(from.identity(), command.amount(), from.balance());
    }

    // Both balances are computed before either is written so a failure leaves neither touched.
    Account debited = from.withBalance(from.balance() - command.amount());
    Account credited = to.withBalance(Math.addExact(to.balance(), command.amount()));
    accounts.put(debited.identity(), debited);
    accounts.put(credited.identity(), credited);
    return debited.balance();
  }

  private TransferReceipt replay(TransferCommand command, TransferRecord existing) {
    if (!command.sameIntent(existing)) {
      throw new LedgerException(
          LedgerError.TRANSFER_ID_CONFLICT,
          "Transfer id " + command.transferId() + " was already used for a different transfer");
    }
    log.info(
        "Replaying transfer transferId={} status={}", existing.transferId(), existing.status());
    if (!existing.applied()) {
      throw new LedgerException(existing.error(), existing.message());
    }
    long fromBalance = find(existing.from()).map(Account::balance).orElse(0L);
    return new TransferReceipt(existing, fromBalance, true);
  }

  private Account approvedAccount(String identity, LedgerError missingError) {
    Account account = find(identity).orElse(null);
    if (account == null) {
      throw new LedgerException(missingError, "Unknown account: " + identity);
    }
    if (!account.approved()) {
      throw new LedgerException(LedgerError.NOT_APPROVED, "Account not approved: " + identity);
    }
    return account;
  }

  private static boolean credentialMatches(String expected, String provided) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
  }

  private static long clampedSum(long balance, long delta) {
    if (delta < 0 && balance + delta <= 0) {
      return 0L;
    }
    return Math.addExact(balance, delta);
  }

  private static String signed(long delta) {
    return delta >= 0 ? "+" + delta : Long.toString(delta);
  }

  private static void requirePositive(long amount) {
    if (amount <= 0) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, "Amount must be > 0");
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new LedgerException(LedgerError.INVALID_REQUEST, field + " must not be blank");
    }
  }
}
