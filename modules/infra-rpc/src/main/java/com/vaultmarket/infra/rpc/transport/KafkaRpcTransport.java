package com.vaultmarket.infra.rpc.transport;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;

/** One Kafka topic per address; every subscription runs its own listener container. */
public class KafkaRpcTransport implements RpcTransport {
  private static final Logger log = LoggerFactory.getLogger(KafkaRpcTransport.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final ConsumerFactory<String, String> consumerFactory;
  private final String groupPrefix;
  private final List<KafkaMessageListenerContainer<String, String>> containers =
      new CopyOnWriteArrayList<>();

  public KafkaRpcTransport(
      KafkaTemplate<String, String> kafkaTemplate,
      ConsumerFactory<String, String> consumerFactory,
      String groupPrefix) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.consumerFactory =
        Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    this.groupPrefix = Objects.requireNonNull(groupPrefix, "groupPrefix must not be null");
  }

  @Override
  public void send(String address, String message) {
    RpcAddresses.assertValid(address);
    try {
      kafkaTemplate
          .send(address, message)
          .whenComplete(
              (result, throwable) -> {
                if (throwable != null) {
                  log.warn("Kafka rpc send failed address={}", address, throwable);
                }
              });
    } catch (RuntimeException ex) {
      throw new RpcTransportException(address, "Failed to send rpc message to " + address, ex);
    }
  }

  @Override
  public RpcSubscription subscribe(String address, Consumer<String> listener) {
    RpcAddresses.assertValid(address);
    Objects.requireNonNull(listener, "listener must not be null");
    ContainerProperties properties = new ContainerProperties(address);
    properties.setGroupId(groupPrefix + "." + address);
    properties.setMessageListener(
        (MessageListener<String, String>)
            (ConsumerRecord<String, String> record) -> listener.accept(record.value()));
    KafkaMessageListenerContainer<String, String> container =
        new KafkaMessageListenerContainer<>(consumerFactory, properties);
    container.setBeanName("rpc-" + address);
    container.start();
    containers.add(container);
    log.info("Subscribed to rpc address={} groupId={}", address, properties.getGroupId());
    return () -> {
      containers.remove(container);
      container.stop();
    };
  }

  @Override
  public void close() {
    for (KafkaMessageListenerContainer<String, String> container : containers) {
      container.stop();
    }
    containers.clear();
  }
}
