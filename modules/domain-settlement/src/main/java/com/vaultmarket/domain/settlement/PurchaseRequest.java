package com.vaultmarket.domain.settlement;

public record PurchaseRequest(
    long listingId, String buyer, int requestedCount, String destinationContainer) {}
