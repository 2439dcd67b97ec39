package com.vaultmarket.infra.rpc.transport;

import java.time.Duration;
import java.util.Objects;

/** Decides the fate of each message handed to the in-memory transport. */
@FunctionalInterface
public interface DeliveryPolicy {
  DeliveryPolicy DELIVER_ALL = (address, message) -> Delivery.deliver();

  Delivery decide(String address, String message);

  record Delivery(boolean dropped, Duration delay) {
    public Delivery {
      Objects.requireNonNull(delay, "delay must not be null");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delay must not be negative");
      }
    }

    public static Delivery deliver() {
      return new Delivery(false, Duration.ZERO);
    }

    public static Delivery drop() {
      return new Delivery(true, Duration.ZERO);
    }

    public static Delivery delayBy(Duration delay) {
      return new Delivery(false, delay);
    }
  }
}
