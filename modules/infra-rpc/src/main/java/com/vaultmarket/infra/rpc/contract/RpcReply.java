package com.vaultmarket.infra.rpc.contract;

public interface RpcReply {
  boolean ok();

  RpcErrorCode errorCode();

  String error();
}
