package com.vaultmarket.ledgerserver.rpc;

import com.vaultmarket.domain.ledger.Account;
import com.vaultmarket.domain.ledger.LedgerError;
import com.vaultmarket.domain.ledger.LedgerException;
import com.vaultmarket.domain.ledger.TransferCommand;
import com.vaultmarket.domain.ledger.TransferReceipt;
import com.vaultmarket.domain.pricing.PricingDomainException;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.ErrorReply;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.ledger.AccountReply;
import com.vaultmarket.infra.rpc.contract.ledger.CreateAccountRequest;
import com.vaultmarket.infra.rpc.contract.ledger.DepositFromClientChestRequest;
import com.vaultmarket.infra.rpc.contract.ledger.DepositReply;
import com.vaultmarket.infra.rpc.contract.ledger.GetAccountRequest;
import com.vaultmarket.infra.rpc.contract.ledger.GetPricesRequest;
import com.vaultmarket.infra.rpc.contract.ledger.GetVaultStockRequest;
import com.vaultmarket.infra.rpc.contract.ledger.LedgerRequest;
import com.vaultmarket.infra.rpc.contract.ledger.LoginRequest;
import com.vaultmarket.infra.rpc.contract.ledger.PricesReply;
import com.vaultmarket.infra.rpc.contract.ledger.TransferReply;
import com.vaultmarket.infra.rpc.contract.ledger.TransferRequest;
import com.vaultmarket.infra.rpc.contract.ledger.VaultStockReply;
import com.vaultmarket.infra.rpc.contract.ledger.WithdrawReply;
import com.vaultmarket.infra.rpc.contract.ledger.WithdrawToClientChestRequest;
import com.vaultmarket.infra.rpc.server.RpcRequestHandler;
import com.vaultmarket.ledgerserver.bank.DepositResult;
import com.vaultmarket.ledgerserver.bank.ItemQuote;
import com.vaultmarket.ledgerserver.bank.VaultBankingError;
import com.vaultmarket.ledgerserver.bank.VaultBankingException;
import com.vaultmarket.ledgerserver.bank.VaultBankingService;
import com.vaultmarket.ledgerserver.bank.WithdrawResult;
import com.vaultmarket.ledgerserver.state.LedgerState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves ledger requests against the process state. Business failures become error replies;
 * anything else escapes to the server, which answers {@code INTERNAL}. Every mutating request is
 * followed by a snapshot save, whatever its outcome.
 */
public class LedgerRequestRouter implements RpcRequestHandler<LedgerRequest<?>> {
  private static final Logger log = LoggerFactory.getLogger(LedgerRequestRouter.class);

  private final LedgerState state;
  private final VaultBankingService banking;
  private final Supplier<String> transferIds;

  public LedgerRequestRouter(LedgerState state, VaultBankingService banking) {
    this(state, banking, () -> "tx-" + UUID.randomUUID());
  }

  public LedgerRequestRouter(
      LedgerState state, VaultBankingService banking, Supplier<String> transferIds) {
    this.state = Objects.requireNonNull(state, "state must not be null");
    this.banking = Objects.requireNonNull(banking, "banking must not be null");
    this.transferIds = Objects.requireNonNull(transferIds, "transferIds must not be null");
  }

  @Override
  public RpcReply handle(LedgerRequest<?> request) {
    try {
      return route(request);
    } catch (LedgerException ex) {
      return rejected(request, errorCode(ex.error()), ex.getMessage());
    } catch (VaultBankingException ex) {
      return rejected(request, errorCode(ex.error()), ex.getMessage());
    } catch (PricingDomainException | IllegalArgumentException ex) {
      return rejected(request, RpcErrorCode.VALIDATION, ex.getMessage());
    } finally {
      if (request.mutating()) {
        state.save();
      }
    }
  }

  private RpcReply route(LedgerRequest<?> request) {
    if (request instanceof LoginRequest login) {
      state.ledger().authenticate(login.user(), login.credential());
      return AckReply.success("Login OK");
    }
    if (request instanceof CreateAccountRequest create) {
      state.ledger().register(create.user(), create.credential());
      return AckReply.success("Account created. Awaiting approval.");
    }
    if (request instanceof GetAccountRequest get) {
      Account account = state.ledger().account(get.user());
      return AccountReply.success(account.identity(), account.balance(), account.approved());
    }
    if (request instanceof GetPricesRequest) {
      Map<String, PricesReply.ItemQuote> prices = new LinkedHashMap<>();
      for (ItemQuote quote : banking.prices()) {
        prices.put(
            quote.item(),
            new PricesReply.ItemQuote(quote.price(), quote.stock(), quote.basePrice()));
      }
      return PricesReply.success(prices);
    }
    if (request instanceof GetVaultStockRequest) {
      Map<String, VaultStockReply.StockLine> stock = new LinkedHashMap<>();
      for (ItemQuote line : banking.vaultStock()) {
        stock.put(line.item(), new VaultStockReply.StockLine(line.stock(), line.price()));
      }
      return VaultStockReply.success(stock);
    }
    if (request instanceof DepositFromClientChestRequest deposit) {
      DepositResult result = banking.deposit(deposit.user(), deposit.chestName());
      return DepositReply.success(result.moved(), result.credited(), result.balance());
    }
    if (request instanceof WithdrawToClientChestRequest withdraw) {
      WithdrawResult result =
          banking.withdraw(
              withdraw.user(), withdraw.chestName(), withdraw.item(), withdraw.count());
      return WithdrawReply.success(
          result.moved(), result.unitPrice(), result.charged(), result.balance());
    }
    if (request instanceof TransferRequest transfer) {
      return transfer(transfer);
    }
    return ErrorReply.of(
        RpcErrorCode.UNKNOWN_REQUEST, "Unknown request: " + request.getClass().getSimpleName());
  }

  private TransferReply transfer(TransferRequest request) {
    String transferId = request.transferId() == null ? transferIds.get() : request.transferId();
    try {
      TransferReceipt receipt =
          state
              .ledger()
              .transfer(
                  new TransferCommand(transferId, request.from(), request.to(), request.amount()));
      return TransferReply.success(transferId, receipt.fromBalance(), receipt.replayed());
    } catch (LedgerException ex) {
      log.info(
          "Transfer rejected transferId={} error={} message={}",
          transferId,
          ex.error(),
          ex.getMessage());
      return TransferReply.failure(errorCode(ex.error()), ex.getMessage(), transferId);
    }
  }

  private static RpcReply rejected(LedgerRequest<?> request, RpcErrorCode code, String message) {
    log.info(
        "Ledger request rejected type={} errorCode={} message={}",
        request.getClass().getSimpleName(),
        code,
        message);
    return ErrorReply.of(code, message);
  }

  static RpcErrorCode errorCode(LedgerError error) {
    return switch (error) {
      case INVALID_REQUEST, TRANSFER_ID_CONFLICT -> RpcErrorCode.VALIDATION;
      case ALREADY_EXISTS -> RpcErrorCode.ALREADY_EXISTS;
      case NOT_FOUND -> RpcErrorCode.NOT_FOUND;
      case BAD_CREDENTIAL -> RpcErrorCode.BAD_CREDENTIAL;
      case NOT_APPROVED -> RpcErrorCode.NOT_APPROVED;
      case UNKNOWN_ACCOUNT -> RpcErrorCode.UNKNOWN_ACCOUNT;
      case INSUFFICIENT_FUNDS -> RpcErrorCode.INSUFFICIENT_FUNDS;
    };
  }

  static RpcErrorCode errorCode(VaultBankingError error) {
    return switch (error) {
      case VAULT_NOT_CONFIGURED, CONTAINER_UNAVAILABLE -> RpcErrorCode.CONTAINER_UNAVAILABLE;
      case NOT_PRICED -> RpcErrorCode.VALIDATION;
      case INSUFFICIENT_STOCK -> RpcErrorCode.INSUFFICIENT_STOCK;
      case NOTHING_MOVED -> RpcErrorCode.NOTHING_MOVED;
    };
  }
}
