package com.vaultmarket.infra.rpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vaultmarket.infra.rpc.contract.RpcEnvelope;
import com.vaultmarket.infra.rpc.contract.RpcMessageKind;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.RpcRequest;
import com.vaultmarket.infra.rpc.observability.RpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcDecodingException;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.transport.RpcAddresses;
import com.vaultmarket.infra.rpc.transport.RpcSubscription;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/reply over an unreliable transport. Replies are matched by correlation id on the
 * client's own reply address; a reply that arrives after its call gave up is dropped.
 */
public class RpcClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

  private final RpcTransport transport;
  private final RpcEnvelopeJsonCodec codec;
  private final RpcTelemetry telemetry;
  private final String producer;
  private final String replyAddress;
  private final Map<String, CompletableFuture<RpcEnvelope>> pending = new ConcurrentHashMap<>();
  private RpcSubscription subscription;

  public RpcClient(
      RpcTransport transport,
      RpcEnvelopeJsonCodec codec,
      RpcTelemetry telemetry,
      String producer,
      String replyAddress) {
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.producer = Objects.requireNonNull(producer, "producer must not be null");
    RpcAddresses.assertValid(replyAddress);
    this.replyAddress = replyAddress;
  }

  public synchronized void start() {
    if (subscription == null) {
      subscription = transport.subscribe(replyAddress, this::onMessage);
    }
  }

  public <R extends RpcReply> RpcResponse<R> call(
      String address, RpcRequest<R> request, Duration timeout) {
    Objects.requireNonNull(request, "request must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");
    start();

    String correlationId = UUID.randomUUID().toString();
    JsonNode payload = codec.toTree(request);
    String operation = operationName(payload, request);
    CompletableFuture<RpcEnvelope> replyFuture = new CompletableFuture<>();
    pending.put(correlationId, replyFuture);
    long started = System.nanoTime();

    try {
      RpcEnvelope envelope =
          RpcEnvelope.request(operation, correlationId, replyAddress, producer, payload);
      transport.send(address, codec.encode(envelope));
    } catch (RuntimeException ex) {
      pending.remove(correlationId);
      telemetry.onCallFailed(address, operation, ex);
      log.warn("Rpc send failed address={} operation={}", address, operation, ex);
      return new RpcResponse<>(
          RpcCallStatus.SEND_FAILED, null, correlationId, ex.getMessage(), elapsedSince(started));
    }

    RpcEnvelope replyEnvelope;
    try {
      replyEnvelope = replyFuture.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      return timedOut(address, operation, correlationId, started, "No reply within " + timeout);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return timedOut(address, operation, correlationId, started, "Interrupted awaiting reply");
    } catch (ExecutionException ex) {
      return timedOut(address, operation, correlationId, started, "Reply wait failed");
    }

    Duration elapsed = elapsedSince(started);
    try {
      R reply = codec.decodePayload(replyEnvelope, request.replyType());
      telemetry.onCallReplied(address, operation, reply.ok(), elapsed.toNanos());
      return new RpcResponse<>(RpcCallStatus.REPLIED, reply, correlationId, null, elapsed);
    } catch (RpcDecodingException ex) {
      telemetry.onCallFailed(address, operation, ex);
      log.warn(
          "Unreadable rpc reply address={} operation={} correlationId={}",
          address,
          operation,
          correlationId,
          ex);
      return new RpcResponse<>(
          RpcCallStatus.MALFORMED_REPLY, null, correlationId, ex.getMessage(), elapsed);
    }
  }

  public int pendingCalls() {
    return pending.size();
  }

  public String replyAddress() {
    return replyAddress;
  }

  @Override
  public synchronized void close() {
    if (subscription != null) {
      subscription.close();
      subscription = null;
    }
    pending.clear();
  }

  private void onMessage(String raw) {
    RpcEnvelope envelope;
    try {
      envelope = codec.decode(raw);
    } catch (RpcDecodingException ex) {
      log.warn("Ignoring malformed message on reply address={}: {}", replyAddress, ex.getMessage());
      return;
    }
    if (envelope.kind() != RpcMessageKind.REPLY) {
      return;
    }
    CompletableFuture<RpcEnvelope> waiting = pending.remove(envelope.correlationId());
    if (waiting == null) {
      telemetry.onLateReply(replyAddress);
      log.info(
          "Dropping late rpc reply correlationId={} operation={}",
          envelope.correlationId(),
          envelope.operation());
      return;
    }
    waiting.complete(envelope);
  }

  private <R extends RpcReply> RpcResponse<R> timedOut(
      String address, String operation, String correlationId, long started, String detail) {
    pending.remove(correlationId);
    telemetry.onCallTimedOut(address, operation);
    log.warn(
        "Rpc call timed out address={} operation={} correlationId={}",
        address,
        operation,
        correlationId);
    return new RpcResponse<>(
        RpcCallStatus.TIMEOUT, null, correlationId, detail, elapsedSince(started));
  }

  private String operationName(JsonNode payload, RpcRequest<?> request) {
    String tagged = codec.operationOf(payload);
    return tagged != null ? tagged : request.getClass().getSimpleName();
  }

  private static Duration elapsedSince(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos);
  }
}
