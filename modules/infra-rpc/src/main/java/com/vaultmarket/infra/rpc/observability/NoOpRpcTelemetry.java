package com.vaultmarket.infra.rpc.observability;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;

public class NoOpRpcTelemetry implements RpcTelemetry {
  @Override
  public void onCallReplied(String address, String operation, boolean ok, long durationNanos) {}

  @Override
  public void onCallTimedOut(String address, String operation) {}

  @Override
  public void onCallFailed(String address, String operation, Throwable error) {}

  @Override
  public void onLateReply(String replyAddress) {}

  @Override
  public void onRequestHandled(
      String address, String operation, String outcome, long durationNanos) {}

  @Override
  public void onRequestRejected(String address, String operation, RpcErrorCode errorCode) {}
}
