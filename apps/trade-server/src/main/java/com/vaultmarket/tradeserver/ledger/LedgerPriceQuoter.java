package com.vaultmarket.tradeserver.ledger;

import com.vaultmarket.domain.settlement.PriceQuoter;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.ledger.PricesReply;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference price from the ledger's elastic pricing. The ledger prices at its own view of the vault
 * stock; a missing answer yields no reference price and never blocks a purchase.
 */
public class LedgerPriceQuoter implements PriceQuoter {
  private static final Logger log = LoggerFactory.getLogger(LedgerPriceQuoter.class);

  private final LedgerClient ledgerClient;
  private final Duration timeout;

  public LedgerPriceQuoter(LedgerClient ledgerClient, Duration timeout) {
    this.ledgerClient = Objects.requireNonNull(ledgerClient, "ledgerClient must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
  }

  @Override
  public OptionalLong quote(String item, int vaultStock) {
    RpcResponse<PricesReply> response = ledgerClient.prices(timeout);
    if (!response.ok()) {
      log.debug("No reference price item={} reason={}", item, response.errorCode());
      return OptionalLong.empty();
    }
    PricesReply.ItemQuote quote = response.reply().prices().get(item);
    return quote == null ? OptionalLong.empty() : OptionalLong.of(quote.price());
  }
}
