package com.vaultmarket.tradeserver.rpc;

import com.vaultmarket.domain.listings.Listing;
import com.vaultmarket.domain.listings.ListingError;
import com.vaultmarket.domain.listings.ListingException;
import com.vaultmarket.domain.listings.StockAddResult;
import com.vaultmarket.domain.settlement.PurchaseRequest;
import com.vaultmarket.domain.settlement.SettlementError;
import com.vaultmarket.domain.settlement.SettlementProtocol;
import com.vaultmarket.domain.settlement.SettlementResult;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.ErrorReply;
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
import com.vaultmarket.infra.rpc.contract.trade.ListingView;
import com.vaultmarket.infra.rpc.contract.trade.ListingsReply;
import com.vaultmarket.infra.rpc.contract.trade.TradeLoginRequest;
import com.vaultmarket.infra.rpc.contract.trade.TradeRequest;
import com.vaultmarket.infra.rpc.server.RpcRequestHandler;
import com.vaultmarket.tradeserver.ledger.LedgerClient;
import com.vaultmarket.tradeserver.settlement.SettlementJournal;
import com.vaultmarket.tradeserver.state.TradeState;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves trade requests. Account questions are forwarded to the ledger server; listings and
 * purchases are served from the process state, which is saved after every mutating request.
 */
public class TradeRequestRouter implements RpcRequestHandler<TradeRequest<?>> {
  private static final Logger log = LoggerFactory.getLogger(TradeRequestRouter.class);

  private final TradeState state;
  private final SettlementProtocol settlement;
  private final SettlementJournal journal;
  private final LedgerClient ledgerClient;

  public TradeRequestRouter(
      TradeState state,
      SettlementProtocol settlement,
      SettlementJournal journal,
      LedgerClient ledgerClient) {
    this.state = Objects.requireNonNull(state, "state must not be null");
    this.settlement = Objects.requireNonNull(settlement, "settlement must not be null");
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.ledgerClient = Objects.requireNonNull(ledgerClient, "ledgerClient must not be null");
  }

  @Override
  public RpcReply handle(TradeRequest<?> request) {
    try {
      return route(request);
    } catch (ListingException ex) {
      return rejected(request, errorCode(ex.error()), ex.getMessage());
    } catch (IllegalArgumentException ex) {
      return rejected(request, RpcErrorCode.VALIDATION, ex.getMessage());
    } finally {
      // Goods may already have moved when an unexpected fault escapes; keep disk in step.
      if (request.mutating()) {
        state.save();
      }
    }
  }

  private RpcReply route(TradeRequest<?> request) {
    if (request instanceof TradeLoginRequest login) {
      return login(login);
    }
    if (request instanceof GetBalanceRequest balance) {
      return balance(balance);
    }
    if (request instanceof GetListingsRequest) {
      List<ListingView> views =
          state.listings().all().stream().map(TradeRequestRouter::view).toList();
      return ListingsReply.success(views);
    }
    if (request instanceof CreateListingRequest create) {
      Listing listing = state.listings().create(create.user(), create.item(), create.price());
      return CreateListingReply.success(listing.id());
    }
    if (request instanceof AddStockRequest add) {
      StockAddResult result =
          state
              .listings()
              .addStock(add.listingId(), add.user(), add.item(), add.count(), add.chestName());
      return AddStockReply.success(result.moved(), result.listing().quantityOnHand());
    }
    if (request instanceof BuyRequest buy) {
      return buy(buy);
    }
    return ErrorReply.of(
        RpcErrorCode.UNKNOWN_REQUEST, "Unknown request: " + request.getClass().getSimpleName());
  }

  private AckReply login(TradeLoginRequest request) {
    RpcResponse<AckReply> response = ledgerClient.login(request.user(), request.credential());
    if (response.replied()) {
      return response.reply();
    }
    return AckReply.failure(response.errorCode(), "Bank unavailable: " + response.error());
  }

  private BalanceReply balance(GetBalanceRequest request) {
    RpcResponse<AccountReply> response = ledgerClient.account(request.user());
    if (response.ok()) {
      return BalanceReply.success(response.reply().balance());
    }
    String error = response.replied() ? response.error() : "Bank unavailable: " + response.error();
    return BalanceReply.failure(response.errorCode(), error);
  }

  private BuyReply buy(BuyRequest request) {
    SettlementResult result =
        settlement.purchase(
            new PurchaseRequest(
                request.listingId(), request.user(), request.count(), request.chestName()));
    journal.record(result);
    // Units the buyer kept count as moved even when the purchase failed.
    int moved = result.ok() ? result.delivered() : result.unrecovered();
    return new BuyReply(
        result.ok(),
        result.ok() ? null : errorCode(result.errorCode()),
        result.ok() ? null : result.message(),
        moved,
        result.totalCharged(),
        result.state().name(),
        result.settlementId(),
        result.message());
  }

  private static ListingView view(Listing listing) {
    return new ListingView(
        listing.id(),
        listing.seller(),
        listing.item(),
        listing.unitPrice(),
        listing.quantityOnHand());
  }

  private static RpcReply rejected(TradeRequest<?> request, RpcErrorCode code, String message) {
    log.info(
        "Trade request rejected type={} errorCode={} message={}",
        request.getClass().getSimpleName(),
        code,
        message);
    return ErrorReply.of(code, message);
  }

  static RpcErrorCode errorCode(ListingError error) {
    return switch (error) {
      case INVALID_REQUEST, ITEM_MISMATCH -> RpcErrorCode.VALIDATION;
      case NOT_FOUND -> RpcErrorCode.NOT_FOUND;
      case NOT_OWNER -> RpcErrorCode.NOT_OWNER;
      case NOTHING_MOVED -> RpcErrorCode.NOTHING_MOVED;
      case NOT_AVAILABLE -> RpcErrorCode.INSUFFICIENT_STOCK;
    };
  }

  /** Maps a settlement failure code, or a ledger code carried through a reverted charge. */
  static RpcErrorCode errorCode(String settlementCode) {
    if (settlementCode == null) {
      return RpcErrorCode.INTERNAL;
    }
    for (SettlementError error : SettlementError.values()) {
      if (error.name().equals(settlementCode)) {
        return errorCode(error);
      }
    }
    for (RpcErrorCode code : RpcErrorCode.values()) {
      if (code.name().equals(settlementCode)) {
        return code;
      }
    }
    return RpcErrorCode.INTERNAL;
  }

  static RpcErrorCode errorCode(SettlementError error) {
    return switch (error) {
      case INVALID_REQUEST, OWN_LISTING -> RpcErrorCode.VALIDATION;
      case LISTING_NOT_FOUND -> RpcErrorCode.NOT_FOUND;
      case NOT_AVAILABLE, OUT_OF_STOCK -> RpcErrorCode.INSUFFICIENT_STOCK;
      case NOTHING_DELIVERED -> RpcErrorCode.NOTHING_MOVED;
      case VAULT_UNAVAILABLE -> RpcErrorCode.CONTAINER_UNAVAILABLE;
      case UNRECOVERED_INCONSISTENCY -> RpcErrorCode.UNRECOVERED_INCONSISTENCY;
    };
  }
}
