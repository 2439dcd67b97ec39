package com.vaultmarket.infra.rpc.client;

public enum RpcCallStatus {
  REPLIED,
  TIMEOUT,
  SEND_FAILED,
  MALFORMED_REPLY
}
