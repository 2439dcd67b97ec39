package com.vaultmarket.infra.rpc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultmarket.infra.rpc.client.RpcClient;
import com.vaultmarket.infra.rpc.dispatch.ProcessDispatcher;
import com.vaultmarket.infra.rpc.errors.RetryPolicy;
import com.vaultmarket.infra.rpc.observability.MicrometerRpcTelemetry;
import com.vaultmarket.infra.rpc.observability.NoOpRpcTelemetry;
import com.vaultmarket.infra.rpc.observability.RpcTelemetry;
import com.vaultmarket.infra.rpc.serde.RpcEnvelopeJsonCodec;
import com.vaultmarket.infra.rpc.serde.RpcObjectMapperFactory;
import com.vaultmarket.infra.rpc.transport.InMemoryRpcTransport;
import com.vaultmarket.infra.rpc.transport.KafkaRpcTransport;
import com.vaultmarket.infra.rpc.transport.RpcTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(InfraRpcProperties.class)
public class InfraRpcAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "rpcObjectMapper")
  public ObjectMapper rpcObjectMapper() {
    return RpcObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public RpcEnvelopeJsonCodec rpcEnvelopeJsonCodec(
      @Qualifier("rpcObjectMapper") ObjectMapper rpcObjectMapper) {
    return new RpcEnvelopeJsonCodec(rpcObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(RpcTelemetry.class)
  public RpcTelemetry micrometerRpcTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerRpcTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(RpcTelemetry.class)
  public RpcTelemetry noOpRpcTelemetry() {
    return new NoOpRpcTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy rpcRetryPolicy(InfraRpcProperties properties) {
    return RetryPolicyFactory.create(properties.getRetry());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public ProcessDispatcher processDispatcher(InfraRpcProperties properties) {
    return new ProcessDispatcher(properties.getProducer());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "infra.rpc", name = "reply-address")
  public RpcClient rpcClient(
      RpcTransport rpcTransport,
      RpcEnvelopeJsonCodec rpcEnvelopeJsonCodec,
      RpcTelemetry rpcTelemetry,
      InfraRpcProperties properties) {
    return new RpcClient(
        rpcTransport,
        rpcEnvelopeJsonCodec,
        rpcTelemetry,
        properties.getProducer(),
        properties.getReplyAddress());
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(
      prefix = "infra.rpc",
      name = "transport",
      havingValue = InfraRpcProperties.TRANSPORT_IN_MEMORY)
  static class InMemoryTransportConfiguration {
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RpcTransport.class)
    public RpcTransport inMemoryRpcTransport() {
      return new InMemoryRpcTransport();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(
      prefix = "infra.rpc",
      name = "transport",
      havingValue = InfraRpcProperties.TRANSPORT_KAFKA,
      matchIfMissing = true)
  static class KafkaTransportConfiguration {
    @Bean
    @ConditionalOnMissingBean(name = "rpcKafkaProducerFactory")
    public ProducerFactory<String, String> rpcKafkaProducerFactory(
        InfraRpcProperties properties) {
      InfraRpcProperties.Kafka kafka = properties.getKafka();

      Map<String, Object> config = new HashMap<>();
      config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.bootstrapServersAsCsv());
      config.put(ProducerConfig.CLIENT_ID_CONFIG, properties.getProducer());
      config.put(ProducerConfig.ACKS_CONFIG, kafka.getAcks());
      config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, kafka.getDeliveryTimeoutMs());
      config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, kafka.getRequestTimeoutMs());
      config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
      config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
      return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    @ConditionalOnMissingBean(name = "rpcKafkaTemplate")
    public KafkaTemplate<String, String> rpcKafkaTemplate(
        @Qualifier("rpcKafkaProducerFactory")
            ProducerFactory<String, String> rpcKafkaProducerFactory) {
      return new KafkaTemplate<>(rpcKafkaProducerFactory);
    }

    @Bean
    @ConditionalOnMissingBean(name = "rpcKafkaConsumerFactory")
    public ConsumerFactory<String, String> rpcKafkaConsumerFactory(
        InfraRpcProperties properties) {
      InfraRpcProperties.Kafka kafka = properties.getKafka();

      Map<String, Object> config = new HashMap<>();
      config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.bootstrapServersAsCsv());
      config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, kafka.getAutoOffsetReset());
      config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
      config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
      config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
      return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(RpcTransport.class)
    public RpcTransport kafkaRpcTransport(
        @Qualifier("rpcKafkaTemplate") KafkaTemplate<String, String> rpcKafkaTemplate,
        @Qualifier("rpcKafkaConsumerFactory")
            ConsumerFactory<String, String> rpcKafkaConsumerFactory,
        InfraRpcProperties properties) {
      return new KafkaRpcTransport(
          rpcKafkaTemplate, rpcKafkaConsumerFactory, properties.getKafka().getGroupPrefix());
    }
  }
}
