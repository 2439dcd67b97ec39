package com.vaultmarket.infra.rpc.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vaultmarket.infra.rpc.contract.ErrorReply;
import com.vaultmarket.infra.rpc.contract.RpcEnvelope;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcMessageKind;
import com.vaultmarket.infra.rpc.contract.ledger.AccountReply;
import com.vaultmarket.infra.rpc.contract.ledger.GetPricesRequest;
import com.vaultmarket.infra.rpc.contract.ledger.LedgerRequest;
import com.vaultmarket.infra.rpc.contract.ledger.TransferRequest;
import com.vaultmarket.infra.rpc.contract.trade.BuyRequest;
import com.vaultmarket.infra.rpc.contract.trade.TradeRequest;
import org.junit.jupiter.api.Test;

class RpcEnvelopeJsonCodecTest {
  private static final TypeReference<LedgerRequest<?>> LEDGER_REQUEST =
      new TypeReference<LedgerRequest<?>>() {};
  private static final TypeReference<TradeRequest<?>> TRADE_REQUEST =
      new TypeReference<TradeRequest<?>>() {};

  private final RpcEnvelopeJsonCodec codec =
      new RpcEnvelopeJsonCodec(RpcObjectMapperFactory.create());

  @Test
  void shouldRoundTripTaggedRequestThroughEnvelope() {
    TransferRequest transfer = new TransferRequest("settle-1", "bob", "alice", 20);
    RpcEnvelope envelope =
        RpcEnvelope.request(
            "transfer", "corr-1", "trade.reply.1", "trade-server", codec.toTree(transfer));

    String json = codec.encode(envelope);
    RpcEnvelope decoded = codec.decode(json);
    LedgerRequest<?> request = codec.decodePayload(decoded, LEDGER_REQUEST);

    assertTrue(json.contains("\"type\":\"transfer\""));
    assertEquals(RpcMessageKind.REQUEST, decoded.kind());
    assertEquals("trade.reply.1", decoded.replyTo());
    assertEquals(transfer, request);
  }

  @Test
  void shouldExposeTypeTagAsOperation() {
    assertEquals("getPrices", codec.operationOf(codec.toTree(new GetPricesRequest())));
    assertEquals(
        "buy", codec.operationOf(codec.toTree(new BuyRequest("bob", 1, 2, "chest_bob"))));
    assertNull(codec.operationOf(codec.toTree(ErrorReply.of(RpcErrorCode.INTERNAL, "x"))));
  }

  @Test
  void shouldRejectUnknownRequestType() {
    ObjectNode payload = codec.toTree(new GetPricesRequest()).deepCopy();
    payload.put("type", "launchRockets");
    RpcEnvelope envelope = RpcEnvelope.request("launchRockets", "c", "r.1", "p", payload);

    RpcDecodingException ex =
        assertThrows(
            RpcDecodingException.class, () -> codec.decodePayload(envelope, LEDGER_REQUEST));

    assertEquals(RpcErrorCode.UNKNOWN_REQUEST, ex.errorCode());
  }

  @Test
  void shouldRejectInvalidShapeAsValidation() {
    ObjectNode payload = codec.toTree(new BuyRequest("bob", 1, 2, "chest_bob")).deepCopy();
    payload.put("count", 0);
    RpcEnvelope envelope = RpcEnvelope.request("buy", "c", "r.1", "p", payload);

    RpcDecodingException ex =
        assertThrows(
            RpcDecodingException.class, () -> codec.decodePayload(envelope, TRADE_REQUEST));

    assertEquals(RpcErrorCode.VALIDATION, ex.errorCode());
    assertTrue(ex.getMessage().startsWith("Invalid TradeRequest"));
    assertTrue(ex.getMessage().contains("count must be > 0"));
  }

  @Test
  void shouldDecodeErrorReplyIntoTypedReply() {
    RpcEnvelope request =
        RpcEnvelope.request("getAccount", "c", "r.1", "p", codec.toTree(new GetPricesRequest()));
    RpcEnvelope reply =
        request.reply("ledger", codec.toTree(ErrorReply.of(RpcErrorCode.NOT_FOUND, "No account")));

    AccountReply decoded =
        codec.decodePayload(codec.decode(codec.encode(reply)), AccountReply.class);

    assertFalse(decoded.ok());
    assertEquals(RpcErrorCode.NOT_FOUND, decoded.errorCode());
    assertEquals("No account", decoded.error());
  }

  @Test
  void shouldMapUnknownErrorCodeToInternal() {
    ObjectNode payload = codec.toTree(ErrorReply.of(RpcErrorCode.TIMEOUT, "x")).deepCopy();
    payload.put("errorCode", "SOMETHING_NEW");
    RpcEnvelope reply =
        RpcEnvelope.request("x", "c", "r.1", "p", payload).reply("ledger", payload);

    assertEquals(
        RpcErrorCode.INTERNAL, codec.decodePayload(reply, ErrorReply.class).errorCode());
  }

  @Test
  void shouldRejectMalformedEnvelope() {
    RpcDecodingException ex =
        assertThrows(RpcDecodingException.class, () -> codec.decode("{\"kind\":\"REQUEST\"}"));

    assertEquals(RpcErrorCode.VALIDATION, ex.errorCode());
    assertEquals(
        RpcErrorCode.VALIDATION,
        assertThrows(RpcDecodingException.class, () -> codec.decode("not json")).errorCode());
  }
}
