package com.vaultmarket.domain.ledger;

import java.time.Instant;
import java.util.Objects;

public record TransferRecord(
    String transferId,
    String from,
    String to,
    long amount,
    TransferStatus status,
    LedgerError error,
    String message,
    Instant recordedAt) {
  public TransferRecord {
    Objects.requireNonNull(transferId, "transferId must not be null");
    Objects.requireNonNull(from, "from must not be null");
    Objects.requireNonNull(to, "to must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    if (status == TransferStatus.REJECTED && error == null) {
      throw new IllegalArgumentException("rejected transfer must carry an error");
    }
  }

  static TransferRecord applied(TransferCommand command, Instant now) {
    return new TransferRecord(
        command.transferId(),
        command.from(),
        command.to(),
        command.amount(),
        TransferStatus.APPLIED,
        null,
        null,
        now);
  }

  static TransferRecord rejected(TransferCommand command, LedgerException failure, Instant now) {
    return new TransferRecord(
        command.transferId(),
        command.from(),
        command.to(),
        command.amount(),
        TransferStatus.REJECTED,
        failure.error(),
        failure.getMessage(),
        now);
  }

  public boolean applied() {
    return status == TransferStatus.APPLIED;
  }
}
