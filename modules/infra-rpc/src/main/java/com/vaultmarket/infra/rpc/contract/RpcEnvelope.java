package com.vaultmarket.infra.rpc.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One message on the wire. Requests carry the address the reply must go to; replies carry the
 * correlation id of the request they answer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RpcEnvelope(
    UUID messageId,
    RpcMessageKind kind,
    String operation,
    String correlationId,
    String replyTo,
    String producer,
    Instant sentAt,
    JsonNode payload) {
  public RpcEnvelope {
    Objects.requireNonNull(messageId, "messageId must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    requireNonBlank(correlationId, "correlationId");
    requireNonBlank(producer, "producer");
    Objects.requireNonNull(sentAt, "sentAt must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
    if (kind == RpcMessageKind.REQUEST) {
      requireNonBlank(replyTo, "replyTo");
    }
  }

  public static RpcEnvelope request(
      String operation, String correlationId, String replyTo, String producer, JsonNode payload) {
    return new RpcEnvelope(
        UUID.randomUUID(),
        RpcMessageKind.REQUEST,
        operation,
        correlationId,
        replyTo,
        producer,
        Instant.now(),
        payload);
  }

  public RpcEnvelope reply(String replyProducer, JsonNode replyPayload) {
    return new RpcEnvelope(
        UUID.randomUUID(),
        RpcMessageKind.REPLY,
        operation,
        correlationId,
        null,
        replyProducer,
        Instant.now(),
        replyPayload);
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
