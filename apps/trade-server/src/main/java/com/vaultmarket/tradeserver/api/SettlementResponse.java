package com.vaultmarket.tradeserver.api;

import com.vaultmarket.domain.settlement.SettlementResult;
import java.time.Instant;

public record SettlementResponse(
    String settlementId,
    String state,
    long listingId,
    String buyer,
    String item,
    int requested,
    int delivered,
    int recovered,
    int unrecovered,
    long unitPrice,
    long totalCharged,
    Long referencePrice,
    String errorCode,
    String category,
    String message,
    Instant completedAt) {
  public static SettlementResponse from(SettlementResult result) {
    return new SettlementResponse(
        result.settlementId(),
        result.state().name(),
        result.listingId(),
        result.buyer(),
        result.item(),
        result.requested(),
        result.delivered(),
        result.recovered(),
        result.unrecovered(),
        result.unitPrice(),
        result.totalCharged(),
        result.referencePrice(),
        result.errorCode(),
        result.category() == null ? null : result.category().name(),
        result.message(),
        result.completedAt());
  }
}
