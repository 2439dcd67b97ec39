package com.vaultmarket.ledgerserver.api;

import jakarta.validation.constraints.NotNull;

/** Positive values credit, negative values debit; the balance never drops below zero. */
public record AdjustBalanceRequest(@NotNull(message = "delta is required") Long delta) {}
