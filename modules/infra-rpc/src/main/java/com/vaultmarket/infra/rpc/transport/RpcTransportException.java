package com.vaultmarket.infra.rpc.transport;

public class RpcTransportException extends RuntimeException {
  private final String address;

  public RpcTransportException(String address, String message, Throwable cause) {
    super(message, cause);
    this.address = address;
  }

  public String address() {
    return address;
  }
}
