package com.vaultmarket.infra.rpc.contract;

public enum RpcMessageKind {
  REQUEST,
  REPLY
}
