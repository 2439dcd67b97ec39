package com.vaultmarket.tradeserver.api;

import com.vaultmarket.domain.common.AuditRecord;
import java.time.Instant;

public record AuditEntryResponse(Instant recordedAt, String message) {
  public static AuditEntryResponse from(AuditRecord record) {
    return new AuditEntryResponse(record.recordedAt(), record.message());
  }
}
