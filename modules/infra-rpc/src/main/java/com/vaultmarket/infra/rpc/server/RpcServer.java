package com.vaultmarket.infra.rpc.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vaultmarket.infra.rpc.contract.ErrorReply;
import com.vaultmarket.infra.rpc.contract.RpcEnvelope;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcMessageKind;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.infra.rpc.observability.RpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcDecodingException;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.transport.RpcAddresses;
import com.vaultmarket.infra.rpc.transport.RpcSubscription;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Serves one request address. Every message is handled on the process dispatcher, decoded into
 * {@code Q} and answered on the envelope's reply-to address. Malformed requests and handler
 * faults are answered with error replies, never left silent.
 */
public class RpcServer<Q> implements AutoCloseable {
  static final String MDC_CORRELATION_ID = "correlationId";
  static final String MDC_OPERATION = "operation";

  private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

  private final String address;
  private final TypeReference<Q> requestType;
  private final RpcRequestHandler<Q> handler;
  private final RpcTransport transport;
  private final RpcEnvelopeJsonCodec codec;
  private final ProcessDispatcher dispatcher;
  private final RpcTelemetry telemetry;
  private final String producer;
  private final RpcHandlerFailureListener failureListener;
  private RpcSubscription subscription;

  public RpcServer(
      String address,
      TypeReference<Q> requestType,
      RpcRequestHandler<Q> handler,
      RpcTransport transport,
      RpcEnvelopeJsonCodec codec,
      ProcessDispatcher dispatcher,
      RpcTelemetry telemetry,
      String producer,
      RpcHandlerFailureListener failureListener) {
    RpcAddresses.assertValid(address);
    this.address = address;
    this.requestType = Objects.requireNonNull(requestType, "requestType must not be null");
    this.handler = Objects.requireNonNull(handler, "handler must not be null");
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.producer = Objects.requireNonNull(producer, "producer must not be null");
    this.failureListener =
        Objects.requireNonNull(failureListener, "failureListener must not be null");
  }

  public synchronized void start() {
    if (subscription == null) {
      subscription = transport.subscribe(address, raw -> dispatcher.execute(() -> handle(raw)));
      log.info(
          "Rpc server listening address={} requestType={}",
          address,
          requestType.getType().getTypeName());
    }
  }

  @Override
  public synchronized void close() {
    if (subscription != null) {
      subscription.close();
      subscription = null;
    }
  }

  public String address() {
    return address;
  }

  /** Handles one raw message; must run on the dispatch thread. */
  void handle(String raw) {
    long started = System.nanoTime();
    RpcEnvelope envelope;
    try {
      envelope = codec.decode(raw);
    } catch (RpcDecodingException ex) {
      log.warn("Dropping unreadable message on address={}: {}", address, ex.getMessage());
      telemetry.onRequestRejected(address, null, ex.errorCode());
      return;
    }
    if (envelope.kind() != RpcMessageKind.REQUEST) {
      log.debug("Ignoring non-request message on address={}", address);
      return;
    }

    String operation = envelope.operation();
    MDC.put(MDC_CORRELATION_ID, envelope.correlationId());
    MDC.put(MDC_OPERATION, operation == null ? "unknown" : operation);
    try {
      Q request;
      try {
        request = codec.decodePayload(envelope, requestType);
      } catch (RpcDecodingException ex) {
        log.info("Rejecting rpc request errorCode={} reason={}", ex.errorCode(), ex.getMessage());
        telemetry.onRequestRejected(address, operation, ex.errorCode());
        reply(envelope, ErrorReply.of(ex.errorCode(), ex.getMessage()));
        return;
      }

      RuntimeException failure = null;
      RpcReply result;
      try {
        result = handler.handle(request);
        if (result == null) {
          throw new IllegalStateException("Handler returned no reply for " + operation);
        }
      } catch (RuntimeException ex) {
        log.error("Rpc handler failed operation={}", operation, ex);
        failure = ex;
        result = ErrorReply.of(RpcErrorCode.INTERNAL, "Internal error");
      }
      reply(envelope, result);
      telemetry.onRequestHandled(address, operation, outcome(result), System.nanoTime() - started);
      if (failure != null) {
        failureListener.onHandlerFailure(operation, failure);
      }
    } finally {
      MDC.remove(MDC_CORRELATION_ID);
      MDC.remove(MDC_OPERATION);
    }
  }

  private void reply(RpcEnvelope request, RpcReply result) {
    try {
      RpcEnvelope replyEnvelope = request.reply(producer, codec.toTree(result));
      transport.send(request.replyTo(), codec.encode(replyEnvelope));
    } catch (RuntimeException ex) {
      log.warn("Failed to send rpc reply replyTo={}", request.replyTo(), ex);
    }
  }

  private static String outcome(RpcReply result) {
    if (result.ok()) {
      return "ok";
    }
    return result.errorCode() == null ? "error" : result.errorCode().name();
  }
}
