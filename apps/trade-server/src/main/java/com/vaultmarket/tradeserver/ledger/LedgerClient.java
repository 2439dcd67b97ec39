package com.vaultmarket.tradeserver.ledger;

import com.vaultmarket.infra.rpc.client.RpcClient;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.ledger.AccountReply;
import com.vaultmarket.infra.rpc.contract.ledger.GetAccountRequest;
import com.vaultmarket.infra.rpc.contract.ledger.GetPricesRequest;
import com.vaultmarket.infra.rpc.contract.ledger.LoginRequest;
import com.vaultmarket.infra.rpc.contract.ledger.PricesReply;
import com.vaultmarket.infra.rpc.contract.ledger.TransferReply;
import com.vaultmarket.infra.rpc.contract.ledger.TransferRequest;
import java.time.Duration;
import java.util.Objects;

/** Typed calls to the ledger server's request address. */
public class LedgerClient {
  private final RpcClient rpcClient;
  private final String ledgerAddress;
  private final Duration timeout;

  public LedgerClient(RpcClient rpcClient, String ledgerAddress, Duration timeout) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.ledgerAddress = Objects.requireNonNull(ledgerAddress, "ledgerAddress must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
  }

  public RpcResponse<AckReply> login(String user, String credential) {
    return rpcClient.call(ledgerAddress, new LoginRequest(user, credential), timeout);
  }

  public RpcResponse<AccountReply> account(String user) {
    return rpcClient.call(ledgerAddress, new GetAccountRequest(user), timeout);
  }

  public RpcResponse<PricesReply> prices(Duration quoteTimeout) {
    return rpcClient.call(ledgerAddress, new GetPricesRequest(), quoteTimeout);
  }

  public RpcResponse<TransferReply> transfer(
      String transferId, String from, String to, long amount) {
    return rpcClient.call(
        ledgerAddress, new TransferRequest(transferId, from, to, amount), timeout);
  }

  public String ledgerAddress() {
    return ledgerAddress;
  }
}
