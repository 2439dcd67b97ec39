package com.vaultmarket.domain.common;

import java.time.Instant;
import java.util.Objects;

public record AuditRecord(Instant recordedAt, String message) {
  public AuditRecord {
    Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  public String toLine() {
    return "[" + recordedAt + "] " + message;
  }
}
