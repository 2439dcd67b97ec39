package com.vaultmarket.infra.rpc.observability;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;

public interface RpcTelemetry {
  void onCallReplied(String address, String operation, boolean ok, long durationNanos);

  void onCallTimedOut(String address, String operation);

  void onCallFailed(String address, String operation, Throwable error);

  void onLateReply(String replyAddress);

  void onRequestHandled(String address, String operation, String outcome, long durationNanos);

  void onRequestRejected(String address, String operation, RpcErrorCode errorCode);
}
