package com.vaultmarket.tradeserver.settlement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.vaultmarket.domain.common.ErrorCategory;
import com.vaultmarket.domain.settlement.SettlementResult;
import com.vaultmarket.domain.settlement.SettlementState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SettlementJournalTest {
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

  @Test
  void shouldKeepOnlyNewestResultsNewestFirst() {
    SettlementJournal journal = new SettlementJournal(2, registry);

    journal.record(result("s-1", SettlementState.SETTLED));
    journal.record(result("s-2", SettlementState.REVERTED));
    journal.record(result("s-3", SettlementState.SETTLED));

    List<SettlementResult> recent = journal.recent(10);
    assertEquals(2, recent.size());
    assertEquals("s-3", recent.get(0).settlementId());
    assertEquals("s-2", recent.get(1).settlementId());
    assertEquals(1, journal.recent(1).size());
  }

  @Test
  void shouldCountSettlementsByFinalState() {
    SettlementJournal journal = new SettlementJournal(10, registry);

    journal.record(result("s-1", SettlementState.SETTLED));
    journal.record(result("s-2", SettlementState.SETTLED));
    journal.record(result("s-3", SettlementState.CHARGE_FAILED_UNRECOVERED));

    assertEquals(
        2.0d,
        registry.get("trade.settlement.total").tag("state", "SETTLED").counter().count());
    assertEquals(
        1.0d,
        registry
            .get("trade.settlement.total")
            .tag("state", "CHARGE_FAILED_UNRECOVERED")
            .counter()
            .count());
    assertEquals(1, journal.unrecovered().size());
  }

  @Test
  void shouldRejectNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new SettlementJournal(0, registry));
  }

  private static SettlementResult result(String id, SettlementState state) {
    boolean unrecovered = state == SettlementState.CHARGE_FAILED_UNRECOVERED;
    return new SettlementResult(
        id,
        state,
        1L,
        "bob",
        "minecraft:diamond",
        4,
        4,
        unrecovered ? 1 : 0,
        10L,
        state == SettlementState.SETTLED ? 40L : 0L,
        null,
        unrecovered ? "UNRECOVERED_INCONSISTENCY" : null,
        unrecovered ? ErrorCategory.UNRECOVERED_INCONSISTENCY : null,
        "done",
        Instant.parse("2026-03-01T10:00:00Z"));
  }
}
