package com.vaultmarket.infra.rpc.transport;

import java.util.function.Consumer;

/**
 * Unreliable, unordered point-to-point channel. A message sent to an address nobody listens on is
 * lost, and nothing reports whether a sent message arrived.
 */
public interface RpcTransport extends AutoCloseable {
  void send(String address, String message);

  RpcSubscription subscribe(String address, Consumer<String> listener);

  @Override
  void close();
}
