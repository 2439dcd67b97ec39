package com.vaultmarket.infra.rpc.contract;

import java.util.Objects;

/** Failure reply with no typed fields; decodes into any reply type as a failure. */
public record ErrorReply(boolean ok, RpcErrorCode errorCode, String error) implements RpcReply {
  public static ErrorReply of(RpcErrorCode errorCode, String error) {
    return new ErrorReply(false, Objects.requireNonNull(errorCode, "errorCode"), error);
  }
}
