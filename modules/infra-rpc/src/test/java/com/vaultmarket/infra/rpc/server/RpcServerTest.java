package com.vaultmarket.infra.rpc.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.core.type.TypeReference;
import com.vaultmarket.infra.rpc.client.RpcClient;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.ErrorReply;
import com.vaultmarket.infra.rpc.contract.RpcEnvelope;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import com.vaultmarket.infra.rpc.contract.ledger.AccountReply;
import com.vaultmarket.infra.rpc.contract.ledger.CreateAccountRequest;
import com.vaultmarket.infra.rpc.contract.ledger.GetAccountRequest;
import com.vaultmarket.infra.rpc.contract.ledger.LedgerRequest;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.infra.rpc.observability.NoOpRpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.serde.RpcObjectMapperFactory;
import com.vaultmarket.infra.rpc.transport.InMemoryRpcTransport;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

class RpcServerTest {
  private static final String ADDRESS = "ledger.rpc.1337";

  private final RpcEnvelopeJsonCodec codec =
      new RpcEnvelopeJsonCodec(RpcObjectMapperFactory.create());
  private final ProcessDispatcher dispatcher = new ProcessDispatcher("ledger-test");
  private final List<String> failedOperations = new ArrayList<>();
  private final AtomicReference<String> seenCorrelationId = new AtomicReference<>();

  @AfterEach
  void tearDown() {
    dispatcher.close();
  }

  @Test
  void shouldServeRequestsOverTransport() {
    InMemoryRpcTransport transport = new InMemoryRpcTransport();
    RpcServer<LedgerRequest<?>> server = server(transport);
    RpcClient client =
        new RpcClient(transport, codec, new NoOpRpcTelemetry(), "trade-server", "trade.reply.1");
    try {
      server.start();

      RpcResponse<AccountReply> response =
          client.call(ADDRESS, new GetAccountRequest("alice"), Duration.ofSeconds(2));

      assertTrue(response.ok());
      assertEquals(75L, response.reply().balance());
      assertEquals(response.correlationId(), seenCorrelationId.get());
      assertNull(MDC.get(RpcServer.MDC_CORRELATION_ID));
    } finally {
      client.close();
      server.close();
      transport.close();
    }
  }

  @Test
  void shouldReplyInternalAndNotifyListenerWhenHandlerFails() {
    InMemoryRpcTransport transport = new InMemoryRpcTransport();
    RpcServer<LedgerRequest<?>> server = server(transport);
    RpcClient client =
        new RpcClient(transport, codec, new NoOpRpcTelemetry(), "trade-server", "trade.reply.1");
    try {
      server.start();

      RpcResponse<AckReply> response =
          client.call(ADDRESS, new CreateAccountRequest("alice", "1234"), Duration.ofSeconds(2));

      assertFalse(response.ok());
      assertEquals(RpcErrorCode.INTERNAL, response.errorCode());
      dispatcher.run(() -> assertEquals(List.of("createAccount"), failedOperations));
    } finally {
      client.close();
      server.close();
      transport.close();
    }
  }

  @Test
  void shouldAnswerUnknownRequestType() {
    RpcTransport transport = mock(RpcTransport.class);
    RpcServer<LedgerRequest<?>> server = server(transport);
    ObjectNode payload = codec.toTree(new GetAccountRequest("alice")).deepCopy();
    payload.put("type", "mintMoney");

    server.handle(
        codec.encode(RpcEnvelope.request("mintMoney", "c-1", "trade.reply.1", "t", payload)));

    assertEquals(RpcErrorCode.UNKNOWN_REQUEST, sentReply(transport).errorCode());
  }

  @Test
  void shouldAnswerValidationErrorForBadShape() {
    RpcTransport transport = mock(RpcTransport.class);
    RpcServer<LedgerRequest<?>> server = server(transport);
    ObjectNode payload = codec.toTree(new GetAccountRequest("alice")).deepCopy();
    payload.put("user", " ");

    server.handle(
        codec.encode(RpcEnvelope.request("getAccount", "c-2", "trade.reply.1", "t", payload)));

    ErrorReply reply = sentReply(transport);
    assertFalse(reply.ok());
    assertEquals(RpcErrorCode.VALIDATION, reply.errorCode());
  }

  @Test
  void shouldDropUnreadableMessagesWithoutReplying() {
    RpcTransport transport = mock(RpcTransport.class);
    RpcServer<LedgerRequest<?>> server = server(transport);

    server.handle("{broken");

    verify(transport, never()).send(anyString(), anyString());
  }

  private RpcServer<LedgerRequest<?>> server(RpcTransport transport) {
    return new RpcServer<>(
        ADDRESS,
        new TypeReference<LedgerRequest<?>>() {},
        this::route,
        transport,
        codec,
        dispatcher,
        new NoOpRpcTelemetry(),
        "ledger-server",
        (operation, error) -> failedOperations.add(operation));
  }

  private RpcReply route(LedgerRequest<?> request) {
    seenCorrelationId.set(MDC.get(RpcServer.MDC_CORRELATION_ID));
    if (request instanceof GetAccountRequest get) {
      return AccountReply.success(get.user(), 75L, true);
    }
    throw new IllegalStateException("disk full");
  }

  private ErrorReply sentReply(RpcTransport transport) {
    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(transport).send(eq("trade.reply.1"), captor.capture());
    return codec.decodePayload(codec.decode(captor.getValue()), ErrorReply.class);
  }
}
