package com.vaultmarket.ledgerserver.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.infra.rpc.config.InfraRpcProperties;
import com.vaultmarket.infra.rpc.contract.ledger.LedgerRequest;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.infra.rpc.observability.RpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.server.RpcServer;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import com.vaultmarket.infra.storage.FileAuditTrail;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import com.vaultmarket.ledgerserver.admin.LedgerAdminService;
import com.vaultmarket.ledgerserver.bank.VaultBankingService;
import com.vaultmarket.ledgerserver.rpc.LedgerRequestRouter;
import com.vaultmarket.ledgerserver.state.LedgerSnapshot;
import com.vaultmarket.ledgerserver.state.LedgerState;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LedgerServerProperties.class)
public class LedgerServerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock ledgerClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditTrail ledgerAuditTrail(LedgerServerProperties properties, Clock ledgerClock) {
    return new FileAuditTrail(
        properties.auditPath(), properties.getAuditTailCapacity(), ledgerClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SimulatedContainerNetwork containerNetwork(LedgerServerProperties properties) {
    LedgerServerProperties.Simulation simulation = properties.getSimulation();
    SimulatedContainerNetwork network =
        new SimulatedContainerNetwork(simulation.getMaxStackSize());
    for (LedgerServerProperties.Container container : simulation.getContainers()) {
      network.attach(container.getName(), container.getSlots());
    }
    return network;
  }

  @Bean
  public InventoryMover inventoryMover(SimulatedContainerNetwork containerNetwork) {
    return new InventoryMover(containerNetwork);
  }

  @Bean
  public JsonSnapshotStore<LedgerSnapshot> ledgerSnapshotStore(LedgerServerProperties properties) {
    return new JsonSnapshotStore<>(properties.snapshotPath(), LedgerSnapshot.class);
  }

  @Bean
  public LedgerState ledgerState(
      JsonSnapshotStore<LedgerSnapshot> ledgerSnapshotStore,
      AuditTrail ledgerAuditTrail,
      Clock ledgerClock,
      LedgerServerProperties properties) {
    return LedgerState.load(
        ledgerSnapshotStore, ledgerAuditTrail, ledgerClock, properties.getVaultName());
  }

  @Bean
  public VaultBankingService vaultBankingService(
      LedgerState ledgerState,
      SimulatedContainerNetwork containerNetwork,
      InventoryMover inventoryMover) {
    return new VaultBankingService(ledgerState, containerNetwork, inventoryMover);
  }

  @Bean
  public LedgerRequestRouter ledgerRequestRouter(
      LedgerState ledgerState, VaultBankingService vaultBankingService) {
    return new LedgerRequestRouter(ledgerState, vaultBankingService);
  }

  @Bean
  public FatalStorageFailureHandler fatalStorageFailureHandler(
      ConfigurableApplicationContext applicationContext) {
    return new FatalStorageFailureHandler(applicationContext);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public RpcServer<LedgerRequest<?>> ledgerRpcServer(
      LedgerServerProperties properties,
      LedgerRequestRouter ledgerRequestRouter,
      RpcTransport rpcTransport,
      RpcEnvelopeJsonCodec rpcEnvelopeJsonCodec,
      ProcessDispatcher processDispatcher,
      RpcTelemetry rpcTelemetry,
      InfraRpcProperties rpcProperties,
      FatalStorageFailureHandler fatalStorageFailureHandler) {
    return new RpcServer<>(
        properties.getRequestAddress(),
        new TypeReference<LedgerRequest<?>>() {},
        ledgerRequestRouter,
        rpcTransport,
        rpcEnvelopeJsonCodec,
        processDispatcher,
        rpcTelemetry,
        rpcProperties.getProducer(),
        fatalStorageFailureHandler);
  }

  @Bean
  public LedgerAdminService ledgerAdminService(
      LedgerState ledgerState,
      VaultBankingService vaultBankingService,
      SimulatedContainerNetwork containerNetwork,
      ProcessDispatcher processDispatcher) {
    return new LedgerAdminService(
        ledgerState, vaultBankingService, containerNetwork, processDispatcher);
  }
}
