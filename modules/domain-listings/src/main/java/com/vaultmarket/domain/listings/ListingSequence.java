package com.vaultmarket.domain.listings;

/** Monotonic listing id generator; ids are never reused, even for listings that sold out. */
public class ListingSequence {
  private long nextId;

  public ListingSequence() {
    this(1L);
  }

  public ListingSequence(long nextId) {
    if (nextId <= 0) {
      throw new IllegalArgumentException("nextId must be > 0");
    }
    this.nextId = nextId;
  }

  public long next() {
    return nextId++;
  }

  public long peek() {
    return nextId;
  }

  /** Moves the sequence past an id that already exists, e.g. one restored from storage. */
  void observe(long existingId) {
    if (existingId >= nextId) {
      nextId = existingId + 1;
    }
  }
}
