package com.vaultmarket.infra.rpc.server;

/** Told about handler faults after the caller has been sent an {@code INTERNAL} reply. */
@FunctionalInterface
public interface RpcHandlerFailureListener {
  RpcHandlerFailureListener IGNORE = (operation, error) -> {};

  void onHandlerFailure(String operation, RuntimeException error);
}
