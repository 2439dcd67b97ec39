package com.vaultmarket.ledgerserver.api;

import com.vaultmarket.domain.ledger.TransferRecord;
import java.time.Instant;

public record TransferResponse(
    String transferId,
    String from,
    String to,
    long amount,
    String status,
    String error,
    String message,
    Instant recordedAt) {
  public static TransferResponse from(TransferRecord record) {
    return new TransferResponse(
        record.transferId(),
        record.from(),
        record.to(),
        record.amount(),
        record.status().name(),
        record.error() == null ? null : record.error().name(),
        record.message(),
        record.recordedAt());
  }
}
