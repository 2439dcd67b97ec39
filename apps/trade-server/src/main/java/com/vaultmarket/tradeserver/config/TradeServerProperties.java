package com.vaultmarket.tradeserver.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trade.server")
public class TradeServerProperties {
  private String requestAddress = "trade.rpc.1444";
  private String ledgerAddress = "ledger.rpc.1337";
  private String dataDir = "data/trade";
  private String snapshotFile = "trade_server.json";
  private String auditFile = "trade_server.log";
  private int auditTailCapacity = 800;
  private int recentSettlements = 200;
  private long priceQuoteTimeoutMs = 2000L;
  private String vaultName = "vault";
  private Simulation simulation = new Simulation();

  public String getRequestAddress() {
    return requestAddress;
  }

  public void setRequestAddress(String requestAddress) {
    this.requestAddress = requestAddress;
  }

  public String getLedgerAddress() {
    return ledgerAddress;
  }

  public void setLedgerAddress(String ledgerAddress) {
    this.ledgerAddress = ledgerAddress;
  }

  public String getDataDir() {
    return dataDir;
  }

  public void setDataDir(String dataDir) {
    this.dataDir = dataDir;
  }

  public String getSnapshotFile() {
    return snapshotFile;
  }

  public void setSnapshotFile(String snapshotFile) {
    this.snapshotFile = snapshotFile;
  }

  public String getAuditFile() {
    return auditFile;
  }

  public void setAuditFile(String auditFile) {
    this.auditFile = auditFile;
  }

  public int getAuditTailCapacity() {
    return auditTailCapacity;
  }

  public void setAuditTailCapacity(int auditTailCapacity) {
    this.auditTailCapacity = auditTailCapacity;
  }

  public int getRecentSettlements() {
    return recentSettlements;
  }

  public void setRecentSettlements(int recentSettlements) {
    this.recentSettlements = recentSettlements;
  }

  public long getPriceQuoteTimeoutMs() {
    return priceQuoteTimeoutMs;
  }

  public void setPriceQuoteTimeoutMs(long priceQuoteTimeoutMs) {
    this.priceQuoteTimeoutMs = priceQuoteTimeoutMs;
  }

  public String getVaultName() {
    return vaultName;
  }

  public void setVaultName(String vaultName) {
    this.vaultName = vaultName;
  }

  public Simulation getSimulation() {
    return simulation;
  }

  public void setSimulation(Simulation simulation) {
    this.simulation = simulation;
  }

  public Path snapshotPath() {
    return Path.of(dataDir).resolve(snapshotFile);
  }

  public Path auditPath() {
    return Path.of(dataDir).resolve(auditFile);
  }

  public Duration priceQuoteTimeout() {
    return Duration.ofMillis(Math.max(1L, priceQuoteTimeoutMs));
  }

  public static class Simulation {
    private int maxStackSize = 64;
    private List<Container> containers = new ArrayList<>(List.of(new Container("vault", 54)));

    public int getMaxStackSize() {
      return maxStackSize;
    }

    public void setMaxStackSize(int maxStackSize) {
      this.maxStackSize = maxStackSize;
    }

    public List<Container> getContainers() {
      return containers;
    }

    public void setContainers(List<Container> containers) {
      this.containers = containers;
    }
  }

  public static class Container {
    private String name;
    private int slots = 27;

    public Container() {}

    public Container(String name, int slots) {
      this.name = name;
      this.slots = slots;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public int getSlots() {
      return slots;
    }

    public void setSlots(int slots) {
      this.slots = slots;
    }
  }
}
