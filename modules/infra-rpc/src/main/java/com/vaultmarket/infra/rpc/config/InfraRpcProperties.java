package com.vaultmarket.infra.rpc.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.rpc")
public class InfraRpcProperties {
  public static final String TRANSPORT_KAFKA = "kafka";
  public static final String TRANSPORT_IN_MEMORY = "in-memory";

  private String transport = TRANSPORT_KAFKA;
  private String producer = "vault-market";
  private String replyAddress;
  private long requestTimeoutMs = 6000L;
  private Kafka kafka = new Kafka();
  private Retry retry = new Retry();

  public String getTransport() {
    return transport;
  }

  public void setTransport(String transport) {
    this.transport = transport;
  }

  public String getProducer() {
    return producer;
  }

  public void setProducer(String producer) {
    this.producer = producer;
  }

  public String getReplyAddress() {
    return replyAddress;
  }

  public void setReplyAddress(String replyAddress) {
    this.replyAddress = replyAddress;
  }

  public long getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public void setRequestTimeoutMs(long requestTimeoutMs) {
    this.requestTimeoutMs = requestTimeoutMs;
  }

  public Kafka getKafka() {
    return kafka;
  }

  public void setKafka(Kafka kafka) {
    this.kafka = kafka;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public Duration requestTimeout() {
    return Duration.ofMillis(Math.max(1L, requestTimeoutMs));
  }

  public static class Kafka {
    private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
    private String groupPrefix = "vault-market";
    private String autoOffsetReset = "latest";
    private String acks = "all";
    private int deliveryTimeoutMs = 30000;
    private int requestTimeoutMs = 10000;

    public List<String> getBootstrapServers() {
      return bootstrapServers;
    }

    public void setBootstrapServers(List<String> bootstrapServers) {
      this.bootstrapServers = bootstrapServers;
    }

    public String getGroupPrefix() {
      return groupPrefix;
    }

    public void setGroupPrefix(String groupPrefix) {
      this.groupPrefix = groupPrefix;
    }

    public String getAutoOffsetReset() {
      return autoOffsetReset;
    }

    public void setAutoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = autoOffsetReset;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public String bootstrapServersAsCsv() {
      return String.join(",", bootstrapServers);
    }
  }

  public static class Retry {
    private String mode = "fixed";
    private int maxAttempts = 3;
    private long fixedBackoffMs = 500L;
    private long initialBackoffMs = 250L;
    private long maxBackoffMs = 5000L;
    private double multiplier = 2.0d;

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getFixedBackoffMs() {
      return fixedBackoffMs;
    }

    public void setFixedBackoffMs(long fixedBackoffMs) {
      this.fixedBackoffMs = fixedBackoffMs;
    }

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }
  }
}
