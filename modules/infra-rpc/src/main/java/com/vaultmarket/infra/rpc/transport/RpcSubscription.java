package com.vaultmarket.infra.rpc.transport;

@FunctionalInterface
public interface RpcSubscription extends AutoCloseable {
  @Override
  void close();
}
