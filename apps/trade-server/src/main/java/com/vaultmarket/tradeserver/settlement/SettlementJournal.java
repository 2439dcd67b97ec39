package com.vaultmarket.tradeserver.settlement;

import com.vaultmarket.domain.settlement.SettlementResult;
import com.vaultmarket.domain.settlement.SettlementState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/** Recent settlement results for the admin console, counted per final state. */
public class SettlementJournal {
  private static final String SETTLEMENT_COUNTER = "trade.settlement.total";

  private final int capacity;
  private final MeterRegistry meterRegistry;
  private final Deque<SettlementResult> recent = new ArrayDeque<>();

  public SettlementJournal(int capacity, MeterRegistry meterRegistry) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public synchronized void record(SettlementResult result) {
    Objects.requireNonNull(result, "result must not be null");
    recent.addLast(result);
    while (recent.size() > capacity) {
      recent.removeFirst();
    }
    counter(result.state()).increment();
  }

  /** Newest first. */
  public synchronized List<SettlementResult> recent(int limit) {
    List<SettlementResult> results = new ArrayList<>(Math.min(limit, recent.size()));
    Iterator<SettlementResult> newestFirst = recent.descendingIterator();
    while (newestFirst.hasNext() && results.size() < limit) {
      results.add(newestFirst.next());
    }
    return results;
  }

  public synchronized List<SettlementResult> unrecovered() {
    return recent.stream()
        .filter(result -> result.state() == SettlementState.CHARGE_FAILED_UNRECOVERED)
        .toList();
  }

  private Counter counter(SettlementState state) {
    return Counter.builder(SETTLEMENT_COUNTER)
        .description("Purchases by final settlement state")
        .tag("state", state.name())
        .register(meterRegistry);
  }
}
