package com.vaultmarket.ledgerserver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.vaultmarket.infra.rpc.client.RpcClient;
import com.vaultmarket.infra.rpc.client.RpcResponse;
import com.vaultmarket.infra.rpc.contract.AckReply;
import com.vaultmarket.infra.rpc.contract.RpcErrorCode;
import com.vaultmarket.infra.rpc.contract.ledger.DepositFromClientChestRequest;
import com.vaultmarket.infra.rpc.contract.ledger.DepositReply;
import com.vaultmarket.infra.rpc.contract.ledger.LoginRequest;
import com.vaultmarket.infra.rpc.observability.NoOpRpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "infra.rpc.transport=in-memory")
class LedgerServerApplicationTest {
  private static final String LEDGER = "ledger.rpc.1337";

  @TempDir static Path dataDir;

  @DynamicPropertySource
  static void dataDirectory(DynamicPropertyRegistry registry) {
    registry.add("ledger.server.data-dir", () -> dataDir.toString());
  }

  @LocalServerPort private int port;

  @Autowired private TestRestTemplate restTemplate;
  @Autowired private RpcTransport rpcTransport;
  @Autowired private RpcEnvelopeJsonCodec rpcEnvelopeJsonCodec;

  private RpcClient client;

  @BeforeEach
  void setUp() {
    client =
        new RpcClient(
            rpcTransport, rpcEnvelopeJsonCodec, new NoOpRpcTelemetry(), "test", "test.replies");
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  void healthEndpointShouldReturnUp() {
    ResponseEntity<Map> response =
        restTemplate.getForEntity(baseUrl("/actuator/health"), Map.class);

    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertNotNull(response.getBody());
    assertEquals("UP", response.getBody().get("status"));
  }

  @Test
  void shouldLoginOverRpcOnceAdminApproved() {
    register("carol", "1234");

    RpcResponse<AckReply> pending =
        client.call(LEDGER, new LoginRequest("carol", "1234"), Duration.ofSeconds(3));
    restTemplate.postForEntity(baseUrl("/v1/admin/accounts/carol/approve"), null, Map.class);
    RpcResponse<AckReply> approved =
        client.call(LEDGER, new LoginRequest("carol", "1234"), Duration.ofSeconds(3));

    assertEquals(RpcErrorCode.NOT_APPROVED, pending.errorCode());
    assertTrue(approved.ok());
  }

  @Test
  void shouldCreditDepositThatAdminPlacedInClientChest() {
    register("dave", "1234");
    restTemplate.postForEntity(baseUrl("/v1/admin/accounts/dave/approve"), null, Map.class);
    restTemplate.put(
        baseUrl("/v1/admin/items"), Map.of("item", "minecraft:iron_ingot", "basePrice", 10));
    restTemplate.postForEntity(
        baseUrl("/v1/admin/simulator/containers/client-2/insert"),
        Map.of("item", "minecraft:iron_ingot", "count", 5),
        Map.class);

    RpcResponse<DepositReply> response =
        client.call(
            LEDGER, new DepositFromClientChestRequest("dave", "client-2"), Duration.ofSeconds(3));

    assertTrue(response.ok(), String.valueOf(response.error()));
    assertEquals(50L, response.reply().credited());
    ResponseEntity<Map> account =
        restTemplate.getForEntity(baseUrl("/v1/admin/accounts/dave"), Map.class);
    assertEquals(50, account.getBody().get("balance"));
  }

  @Test
  void adjustShouldClampBalanceAtZero() {
    register("erin", "1234");

    ResponseEntity<Map> credited =
        restTemplate.postForEntity(
            baseUrl("/v1/admin/accounts/erin/adjustments"), Map.of("delta", 30), Map.class);
    ResponseEntity<Map> debited =
        restTemplate.postForEntity(
            baseUrl("/v1/admin/accounts/erin/adjustments"), Map.of("delta", -100), Map.class);

    assertEquals(30, credited.getBody().get("balance"));
    assertEquals(0, debited.getBody().get("balance"));
  }

  @Test
  void registerShouldRejectBlankUserAsProblemDetail() {
    ResponseEntity<Map> response =
        restTemplate.postForEntity(
            baseUrl("/v1/admin/accounts"), Map.of("user", " ", "credential", "x"), Map.class);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    assertEquals("/problems/validation-error", response.getBody().get("type"));
  }

  @Test
  void unknownAccountShouldBeNotFound() {
    ResponseEntity<Map> response =
        restTemplate.getForEntity(baseUrl("/v1/admin/accounts/nobody"), Map.class);

    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    assertEquals("NOT_FOUND", response.getBody().get("code"));
  }

  @Test
  void auditTailShouldListRecentMutations() {
    register("frank", "1234");

    ResponseEntity<List> response =
        restTemplate.getForEntity(baseUrl("/v1/admin/audit?limit=100"), List.class);

    assertEquals(HttpStatus.OK, response.getStatusCode());
    assertTrue(response.getBody().toString().contains("Account created: frank"));
  }

  private void register(String user, String credential) {
    ResponseEntity<Map> response =
        restTemplate.postForEntity(
            baseUrl("/v1/admin/accounts"),
            Map.of("user", user, "credential", credential),
            Map.class);
    assertEquals(HttpStatus.OK, response.getStatusCode());
  }

  private String baseUrl(String path) {
    return "http://localhost:" + port + path;
  }
}
