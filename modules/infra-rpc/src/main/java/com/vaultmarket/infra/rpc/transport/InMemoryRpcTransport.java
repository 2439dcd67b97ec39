package com.vaultmarket.infra.rpc.transport;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous transport within one JVM. Delivery happens on a single transport thread, so
 * listeners must hand work off rather than block. A {@link DeliveryPolicy} can drop or delay
 * individual messages.
 */
public class InMemoryRpcTransport implements RpcTransport {
  private static final Logger log = LoggerFactory.getLogger(InMemoryRpcTransport.class);

  private final Map<String, List<Consumer<String>>> listeners = new ConcurrentHashMap<>();
  private final ScheduledExecutorService executor;
  private volatile DeliveryPolicy deliveryPolicy;

  public InMemoryRpcTransport() {
    this(DeliveryPolicy.DELIVER_ALL);
  }

  public InMemoryRpcTransport(DeliveryPolicy deliveryPolicy) {
    this.deliveryPolicy = Objects.requireNonNull(deliveryPolicy, "deliveryPolicy must not be null");
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "rpc-in-memory-transport");
              thread.setDaemon(true);
              return thread;
            });
  }

  public void setDeliveryPolicy(DeliveryPolicy deliveryPolicy) {
    this.deliveryPolicy = Objects.requireNonNull(deliveryPolicy, "deliveryPolicy must not be null");
  }

  @Override
  public void send(String address, String message) {
    RpcAddresses.assertValid(address);
    Objects.requireNonNull(message, "message must not be null");
    DeliveryPolicy.Delivery delivery = deliveryPolicy.decide(address, message);
    if (delivery.dropped()) {
      log.debug("Dropping rpc message address={}", address);
      return;
    }
    try {
      executor.schedule(
          () -> deliver(address, message), delivery.delay().toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      throw new RpcTransportException(address, "In-memory transport is closed", ex);
    }
  }

  @Override
  public RpcSubscription subscribe(String address, Consumer<String> listener) {
    RpcAddresses.assertValid(address);
    Objects.requireNonNull(listener, "listener must not be null");
    listeners.computeIfAbsent(address, key -> new CopyOnWriteArrayList<>()).add(listener);
    return () -> listeners.getOrDefault(address, List.of()).remove(listener);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private void deliver(String address, String message) {
    List<Consumer<String>> subscribers = listeners.getOrDefault(address, List.of());
    if (subscribers.isEmpty()) {
      log.debug("No listener for rpc address={}, message lost", address);
      return;
    }
    for (Consumer<String> subscriber : subscribers) {
      try {
        subscriber.accept(message);
      } catch (RuntimeException ex) {
        log.warn("Rpc listener failed address={}", address, ex);
      }
    }
  }
}
