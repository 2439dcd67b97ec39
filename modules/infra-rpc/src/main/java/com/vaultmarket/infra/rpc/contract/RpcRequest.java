package com.vaultmarket.infra.rpc.contract;

/** A request whose reply decodes into {@code R}. */
public interface RpcRequest<R extends RpcReply> {
  Class<R> replyType();

  /** Whether serving this request changes durable state. */
  default boolean mutating() {
    return false;
  }
}
