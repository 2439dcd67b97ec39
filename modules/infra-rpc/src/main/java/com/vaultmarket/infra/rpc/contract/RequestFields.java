package com.vaultmarket.infra.rpc.contract;

/** Shape checks run while a request payload is decoded, before it reaches a handler. */
public final class RequestFields {
  private RequestFields() {}

  public static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value.trim();
  }

  public static void requirePositive(long value, String field) {
    if (value <= 0) {
      throw new IllegalArgumentException(field + " must be > 0");
    }
  }
}
