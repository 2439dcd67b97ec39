package com.vaultmarket.infra.rpc.serde;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;

/** A message or payload that could not be turned into a well-formed contract type. */
public class RpcDecodingException extends RuntimeException {
  private final RpcErrorCode errorCode;

  public RpcDecodingException(RpcErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public RpcErrorCode errorCode() {
    return errorCode;
  }
}
