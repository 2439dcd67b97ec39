package com.vaultmarket.infra.rpc.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.infra.rpc.transport.DeliveryPolicy.Delivery;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InMemoryRpcTransportTest {
  private final InMemoryRpcTransport transport = new InMemoryRpcTransport();
  private final BlockingQueue<String> received = new LinkedBlockingQueue<>();

  @AfterEach
  void tearDown() {
    transport.close();
  }

  @Test
  void shouldDeliverToSubscribersOfAddress() throws InterruptedException {
    transport.subscribe("ledger.rpc.1337", received::add);

    transport.send("ledger.rpc.1337", "hello");
    transport.send("trade.rpc.1444", "elsewhere");

    assertEquals("hello", received.poll(2, TimeUnit.SECONDS));
    assertNull(received.poll(100, TimeUnit.MILLISECONDS));
  }

  @Test
  void shouldDropMessagesChosenByPolicy() throws InterruptedException {
    transport.subscribe("ledger.rpc.1337", received::add);
    transport.setDeliveryPolicy(
        (address, message) -> message.startsWith("lost") ? Delivery.drop() : Delivery.deliver());

    transport.send("ledger.rpc.1337", "lost-1");
    transport.send("ledger.rpc.1337", "kept-1");

    assertEquals("kept-1", received.poll(2, TimeUnit.SECONDS));
    assertTrue(received.isEmpty());
  }

  @Test
  void shouldDelayMessagesChosenByPolicy() throws InterruptedException {
    transport.subscribe("ledger.rpc.1337", received::add);
    transport.setDeliveryPolicy((address, message) -> Delivery.delayBy(Duration.ofMillis(300)));

    transport.send("ledger.rpc.1337", "slow");

    assertNull(received.poll(100, TimeUnit.MILLISECONDS));
    assertEquals("slow", received.poll(2, TimeUnit.SECONDS));
  }

  @Test
  void shouldStopDeliveringAfterUnsubscribe() throws InterruptedException {
    RpcSubscription subscription = transport.subscribe("ledger.rpc.1337", received::add);
    subscription.close();

    transport.send("ledger.rpc.1337", "nobody");

    assertNull(received.poll(150, TimeUnit.MILLISECONDS));
  }

  @Test
  void shouldValidateAddresses() {
    assertTrue(RpcAddresses.isValid("ledger.rpc.1337"));
    assertTrue(RpcAddresses.isValid("trade.reply.node-2"));
    assertFalse(RpcAddresses.isValid("Ledger RPC"));
    assertFalse(RpcAddresses.isValid(".ledger"));
    assertThrows(IllegalArgumentException.class, () -> transport.send("bad address", "x"));
  }
}
