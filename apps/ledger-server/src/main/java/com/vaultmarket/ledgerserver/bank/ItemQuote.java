package com.vaultmarket.ledgerserver.bank;

/** Current unit price of a catalog item at the vault stock seen when it was quoted. */
public record ItemQuote(String item, long price, int stock, long basePrice) {}
