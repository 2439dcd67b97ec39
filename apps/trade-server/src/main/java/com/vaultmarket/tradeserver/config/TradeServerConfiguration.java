package com.vaultmarket.tradeserver.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vaultmarket.domain.common.AuditTrail;
import com.vaultmarket.domain.inventory.InventoryMover;
import com.vaultmarket.domain.inventory.simulated.SimulatedContainerNetwork;
import com.vaultmarket.domain.settlement.LedgerGateway;
import com.vaultmarket.domain.settlement.PriceQuoter;
import com.vaultmarket.domain.settlement.SettlementProtocol;
import com.vaultmarket.infra.rpc.client.RpcClient;
import com.vaultmarket.infra.rpc.config.InfraRpcProperties;
import com.vaultmarket.infra.rpc.contract.trade.TradeRequest;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.infra.rpc.errors.RetryPolicy;
import com.vaultmarket.infra.rpc.observability.RpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.server.RpcServer;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import com.vaultmarket.infra.storage.FileAuditTrail;
import com.vaultmarket.infra.storage.JsonSnapshotStore;
import com.vaultmarket.tradeserver.admin.TradeAdminService;
import com.vaultmarket.tradeserver.ledger.LedgerClient;
import com.vaultmarket.tradeserver.ledger.LedgerPriceQuoter;
import com.vaultmarket.tradeserver.ledger.RpcLedgerGateway;
import com.vaultmarket.tradeserver.rpc.TradeRequestRouter;
import com.vaultmarket.tradeserver.settlement.SettlementJournal;
import com.vaultmarket.tradeserver.state.TradeSnapshot;
import com.vaultmarket.tradeserver.state.TradeState;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TradeServerProperties.class)
public class TradeServerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock tradeClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public AuditTrail tradeAuditTrail(TradeServerProperties properties, Clock tradeClock) {
    return new FileAuditTrail(
        properties.auditPath(), properties.getAuditTailCapacity(), tradeClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public SimulatedContainerNetwork containerNetwork(TradeServerProperties properties) {
    TradeServerProperties.Simulation simulation = properties.getSimulation();
    SimulatedContainerNetwork network =
        new SimulatedContainerNetwork(simulation.getMaxStackSize());
    for (TradeServerProperties.Container container : simulation.getContainers()) {
      network.attach(container.getName(), container.getSlots());
    }
    return network;
  }

  @Bean
  public InventoryMover inventoryMover(SimulatedContainerNetwork containerNetwork) {
    return new InventoryMover(containerNetwork);
  }

  @Bean
  public JsonSnapshotStore<TradeSnapshot> tradeSnapshotStore(TradeServerProperties properties) {
    return new JsonSnapshotStore<>(properties.snapshotPath(), TradeSnapshot.class);
  }

  @Bean
  public TradeState tradeState(
      JsonSnapshotStore<TradeSnapshot> tradeSnapshotStore,
      InventoryMover inventoryMover,
      AuditTrail tradeAuditTrail,
      Clock tradeClock,
      TradeServerProperties properties) {
    return TradeState.load(
        tradeSnapshotStore,
        inventoryMover,
        tradeAuditTrail,
        tradeClock,
        properties.getVaultName());
  }

  @Bean
  public LedgerClient ledgerClient(
      RpcClient rpcClient, TradeServerProperties properties, InfraRpcProperties rpcProperties) {
    return new LedgerClient(
        rpcClient, properties.getLedgerAddress(), rpcProperties.requestTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public LedgerGateway ledgerGateway(LedgerClient ledgerClient, RetryPolicy rpcRetryPolicy) {
    return new RpcLedgerGateway(ledgerClient, rpcRetryPolicy);
  }

  @Bean
  @ConditionalOnMissingBean
  public PriceQuoter priceQuoter(LedgerClient ledgerClient, TradeServerProperties properties) {
    return new LedgerPriceQuoter(ledgerClient, properties.priceQuoteTimeout());
  }

  @Bean
  public SettlementProtocol settlementProtocol(
      TradeState tradeState,
      InventoryMover inventoryMover,
      SimulatedContainerNetwork containerNetwork,
      LedgerGateway ledgerGateway,
      PriceQuoter priceQuoter,
      AuditTrail tradeAuditTrail,
      Clock tradeClock) {
    return new SettlementProtocol(
        tradeState.listings(),
        inventoryMover,
        containerNetwork,
        ledgerGateway,
        priceQuoter,
        tradeAuditTrail,
        tradeClock);
  }

  @Bean
  public SettlementJournal settlementJournal(
      TradeServerProperties properties, MeterRegistry meterRegistry) {
    return new SettlementJournal(properties.getRecentSettlements(), meterRegistry);
  }

  @Bean
  public TradeRequestRouter tradeRequestRouter(
      TradeState tradeState,
      SettlementProtocol settlementProtocol,
      SettlementJournal settlementJournal,
      LedgerClient ledgerClient) {
    return new TradeRequestRouter(tradeState, settlementProtocol, settlementJournal, ledgerClient);
  }

  @Bean
  public FatalStorageFailureHandler fatalStorageFailureHandler(
      ConfigurableApplicationContext applicationContext) {
    return new FatalStorageFailureHandler(applicationContext);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public RpcServer<TradeRequest<?>> tradeRpcServer(
      TradeServerProperties properties,
      TradeRequestRouter tradeRequestRouter,
      RpcTransport rpcTransport,
      RpcEnvelopeJsonCodec rpcEnvelopeJsonCodec,
      ProcessDispatcher processDispatcher,
      RpcTelemetry rpcTelemetry,
      InfraRpcProperties rpcProperties,
      FatalStorageFailureHandler fatalStorageFailureHandler) {
    return new RpcServer<>(
        properties.getRequestAddress(),
        new TypeReference<TradeRequest<?>>() {},
        tradeRequestRouter,
        rpcTransport,
        rpcEnvelopeJsonCodec,
        processDispatcher,
        rpcTelemetry,
        rpcProperties.getProducer(),
        fatalStorageFailureHandler);
  }

  @Bean
  public TradeAdminService tradeAdminService(
      TradeState tradeState,
      SimulatedContainerNetwork containerNetwork,
      SettlementJournal settlementJournal,
      ProcessDispatcher processDispatcher) {
    return new TradeAdminService(
        tradeState, containerNetwork, settlementJournal, processDispatcher);
  }
}
