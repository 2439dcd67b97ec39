package com.vaultmarket.infra.rpc.transport;

import java.util.regex.Pattern;

/** Addresses double as Kafka topic names, so they keep to lower-case dotted segments. */
public final class RpcAddresses {
  private static final Pattern ADDRESS_PATTERN =
      Pattern.compile("^[a-z][a-z0-9-]*(\\.[a-z0-9][a-z0-9-]*)*$");

  private RpcAddresses() {}

  public static void assertValid(String address) {
    if (!isValid(address)) {
      throw new IllegalArgumentException("Invalid rpc address: " + address);
    }
  }

  public static boolean isValid(String address) {
    return address != null && address.length() <= 200 && ADDRESS_PATTERN.matcher(address).matches();
  }
}
