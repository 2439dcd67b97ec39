package com.vaultmarket.infra.rpc.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerRpcTelemetryTest {
  @Test
  void shouldRecordClientAndServerMetrics() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerRpcTelemetry telemetry = new MicrometerRpcTelemetry(registry);

    telemetry.onCallReplied("ledger.rpc.1337", "transfer", true, 4_000_000L);
    telemetry.onCallTimedOut("ledger.rpc.1337", "transfer");
    telemetry.onCallFailed("ledger.rpc.1337", "transfer", new IllegalStateException("down"));
    telemetry.onLateReply("trade.reply.1");
    telemetry.onRequestHandled("ledger.rpc.1337", "transfer", "ok", 2_000_000L);
    telemetry.onRequestRejected("ledger.rpc.1337", null, RpcErrorCode.VALIDATION);

    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.client.calls.total")
            .tag("operation", "transfer")
            .tag("outcome", "ok")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.client.calls.total")
            .tag("outcome", "timeout")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.client.calls.total")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.client.late_replies.total")
            .tag("address", "trade.reply.1")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.server.requests.total")
            .tag("operation", "transfer")
            .tag("outcome", "ok")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.rpc.server.rejected.total")
            .tag("operation", "unknown")
            .tag("error_code", "VALIDATION")
            .counter()
            .count());
    assertEquals(1L, registry.get("infra.rpc.client.duration").timer().count());
    assertEquals(1L, registry.get("infra.rpc.server.duration").timer().count());
  }
}
