package com.vaultmarket.infra.rpc.client;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.RpcReply;
import java.time.Duration;
import java.util.Objects;

/**
 * Result of one call. Only a {@link RpcCallStatus#REPLIED} response says anything about what the
 * remote side did; a timeout or unreadable reply leaves the effect unknown.
 */
public record RpcResponse<R extends RpcReply>(
    RpcCallStatus status, R reply, String correlationId, String detail, Duration elapsed) {
  public RpcResponse {
    Objects.requireNonNull(status, "status must not be null");
    if (status == RpcCallStatus.REPLIED) {
      Objects.requireNonNull(reply, "reply must not be null when replied");
    }
  }

  public boolean replied() {
    return status == RpcCallStatus.REPLIED;
  }

  public boolean ok() {
    return replied() && reply.ok();
  }

  /** True when the request may or may not have been applied. */
  public boolean isAmbiguous() {
    return status == RpcCallStatus.TIMEOUT || status == RpcCallStatus.MALFORMED_REPLY;
  }

  public RpcErrorCode errorCode() {
    return switch (status) {
      case REPLIED -> reply.ok() ? null : reply.errorCode();
      case TIMEOUT -> RpcErrorCode.TIMEOUT;
      case SEND_FAILED -> RpcErrorCode.UNAVAILABLE;
      case MALFORMED_REPLY -> RpcErrorCode.TIMEOUT;
    };
  }

  public String error() {
    if (replied()) {
      return reply.error();
    }
    return detail;
  }
}
