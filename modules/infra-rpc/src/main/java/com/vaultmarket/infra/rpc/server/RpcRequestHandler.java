package com.vaultmarket.infra.rpc.server;

import com.vaultmarket.infra.rpc.contract.RpcReply;

@FunctionalInterface
public interface RpcRequestHandler<Q> {
  RpcReply handle(Q request);
}
