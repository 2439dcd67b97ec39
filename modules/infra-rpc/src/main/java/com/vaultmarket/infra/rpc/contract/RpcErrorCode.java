package com.vaultmarket.infra.rpc.contract;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum RpcErrorCode {
  VALIDATION,
  UNKNOWN_REQUEST,
  ALREADY_EXISTS,
  NOT_FOUND,
  BAD_CREDENTIAL,
  NOT_APPROVED,
  UNKNOWN_ACCOUNT,
  NOT_OWNER,
  INSUFFICIENT_FUNDS,
  INSUFFICIENT_STOCK,
  NOTHING_MOVED,
  CONTAINER_UNAVAILABLE,
  TIMEOUT,
  UNAVAILABLE,
  UNRECOVERED_INCONSISTENCY,
  @JsonEnumDefaultValue
  INTERNAL;

  /** True when the caller cannot tell whether the remote side applied the effect. */
  public boolean isAmbiguous() {
    return this == TIMEOUT;
  }
}
