package com.vaultmarket.domain.common;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

public class InMemoryAuditTrail implements AuditTrail {
  public static final int DEFAULT_CAPACITY = 800;

  private final Deque<AuditRecord> records = new ArrayDeque<>();
  private final int capacity;
  private final Clock clock;

  public InMemoryAuditTrail() {
    this(DEFAULT_CAPACITY, Clock.systemUTC());
  }

  public InMemoryAuditTrail(int capacity, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public synchronized AuditRecord append(String message) {
    AuditRecord record =
        new AuditRecord(clock.instant(), Objects.requireNonNull(message, "message"));
    remember(record);
    return record;
  }

  /** Adds an already-timestamped record, e.g. one replayed from durable storage. */
  public synchronized void remember(AuditRecord record) {
    records.addLast(record);
    while (records.size() > capacity) {
      records.removeFirst();
    }
  }

  @Override
  public synchronized List<AuditRecord> tail(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<AuditRecord> all = new ArrayList<>(records);
    return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
  }

  public synchronized int size() {
    return records.size();
  }
}
