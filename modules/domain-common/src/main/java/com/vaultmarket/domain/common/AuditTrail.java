package com.vaultmarket.domain.common;

import java.util.List;

/**
 * Append-only record of every mutating operation. Entries are never rewritten; operators read the
 * trail to reconcile goods and money by hand when automatic compensation falls short.
 */
public interface AuditTrail {
  AuditRecord append(String message);

  /** Most recent entries, oldest first, at most {@code limit} of them. */
  List<AuditRecord> tail(int limit);
}
