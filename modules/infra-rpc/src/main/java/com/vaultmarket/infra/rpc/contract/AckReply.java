package com.vaultmarket.infra.rpc.contract;

public record AckReply(boolean ok, RpcErrorCode errorCode, String error, String message)
    implements RpcReply {
  public static AckReply success(String message) {
    return new AckReply(true, null, null, message);
  }

  public static AckReply failure(RpcErrorCode errorCode, String error) {
    return new AckReply(false, errorCode, error, null);
  }
}
