package com.vaultmarket.domain.ledger;

/** Outcome of an applied transfer; {@code replayed} is true when the id had already been seen. */
public record TransferReceipt(TransferRecord record, long fromBalance, boolean replayed) {}
