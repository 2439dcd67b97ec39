package com.vaultmarket.infra.rpc.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.vaultmarket.infra.rpc.contract.RpcEnvelope;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import java.util.Objects;

public class RpcEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public RpcEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(RpcEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode rpc envelope", ex);
    }
  }

  public RpcEnvelope decode(String json) {
    if (json == null || json.isBlank()) {
      throw new RpcDecodingException(RpcErrorCode.VALIDATION, "Empty rpc message", null);
    }
    try {
      return objectMapper.readValue(json, RpcEnvelope.class);
    } catch (JsonProcessingException ex) {
      throw new RpcDecodingException(
          RpcErrorCode.VALIDATION, "Malformed rpc envelope: " + rootMessage(ex), ex);
    }
  }

  /** Turns a contract object into the JSON tree carried as an envelope payload. */
  public JsonNode toTree(Object payload) {
    return objectMapper.valueToTree(payload);
  }

  /** The {@code type} tag of a tagged request payload, or {@code null} for untagged payloads. */
  public String operationOf(JsonNode payload) {
    JsonNode type = payload == null ? null : payload.get("type");
    return type == null || !type.isTextual() ? null : type.asText();
  }

  public <T> T decodePayload(RpcEnvelope envelope, Class<T> payloadType) {
    return decodePayload(envelope, objectMapper.getTypeFactory().constructType(payloadType));
  }

  /** Decodes into a generic contract type such as {@code LedgerRequest<?>}. */
  public <T> T decodePayload(RpcEnvelope envelope, TypeReference<T> payloadType) {
    return decodePayload(envelope, objectMapper.getTypeFactory().constructType(payloadType));
  }

  private <T> T decodePayload(RpcEnvelope envelope, JavaType payloadType) {
    String typeName = payloadType.getRawClass().getSimpleName();
    try {
      return objectMapper.treeToValue(envelope.payload(), payloadType);
    } catch (InvalidTypeIdException ex) {
      throw new RpcDecodingException(
          RpcErrorCode.UNKNOWN_REQUEST, "Unknown request type: " + ex.getTypeId(), ex);
    } catch (JsonProcessingException ex) {
      throw new RpcDecodingException(
          RpcErrorCode.VALIDATION, "Invalid " + typeName + ": " + rootMessage(ex), ex);
    } catch (IllegalArgumentException ex) {
      throw new RpcDecodingException(
          RpcErrorCode.VALIDATION, "Invalid " + typeName + ": " + ex.getMessage(), ex);
    }
  }

  private static String rootMessage(JsonProcessingException ex) {
    Throwable cause = ex.getCause();
    if (cause instanceof IllegalArgumentException && cause.getMessage() != null) {
      return cause.getMessage();
    }
    return ex.getOriginalMessage();
  }
}
