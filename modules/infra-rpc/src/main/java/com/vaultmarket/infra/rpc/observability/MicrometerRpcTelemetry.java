package com.vaultmarket.infra.rpc.observability;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerRpcTelemetry implements RpcTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerRpcTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onCallReplied(String address, String operation, boolean ok, long durationNanos) {
    callCounter(address, operation, ok ? "ok" : "error").increment();

    Timer.builder("infra.rpc.client.duration")
        .description("Round trip latency of answered rpc calls")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onCallTimedOut(String address, String operation) {
    callCounter(address, operation, "timeout").increment();
  }

  @Override
  public void onCallFailed(String address, String operation, Throwable error) {
    Counter.builder("infra.rpc.client.calls.total")
        .description("Total rpc calls by outcome")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onLateReply(String replyAddress) {
    Counter.builder("infra.rpc.client.late_replies.total")
        .description("Replies that arrived after their call had timed out")
        .tag("address", safeValue(replyAddress))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRequestHandled(
      String address, String operation, String outcome, long durationNanos) {
    Counter.builder("infra.rpc.server.requests.total")
        .description("Total rpc requests served by outcome")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.rpc.server.duration")
        .description("Rpc request handling latency")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onRequestRejected(String address, String operation, RpcErrorCode errorCode) {
    Counter.builder("infra.rpc.server.rejected.total")
        .description("Rpc requests rejected before reaching a handler")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .tag("error_code", errorCode == null ? "unknown" : errorCode.name())
        .register(meterRegistry)
        .increment();
  }

  private Counter callCounter(String address, String operation, String outcome) {
    return Counter.builder("infra.rpc.client.calls.total")
        .description("Total rpc calls by outcome")
        .tag("address", safeValue(address))
        .tag("operation", safeValue(operation))
        .tag("outcome", outcome)
        .tag("error", "none")
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
