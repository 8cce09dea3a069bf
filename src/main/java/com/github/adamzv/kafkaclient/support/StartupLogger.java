package com.github.adamzv.kafkaclient.support;

import com.github.adamzv.kafkaclient.ports.KafkaAdminPort;
import com.github.adamzv.kafkaclient.ports.KafkaConsumerPort;
import com.github.adamzv.kafkaclient.ports.KafkaProducerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final KafkaClientsProperties properties;
  private final ObjectProvider<KafkaProducerPort> producer;
  private final ObjectProvider<KafkaConsumerPort> consumer;
  private final ObjectProvider<KafkaAdminPort> admin;

  public StartupLogger(KafkaClientsProperties properties,
                       ObjectProvider<KafkaProducerPort> producer,
                       ObjectProvider<KafkaConsumerPort> consumer,
                       ObjectProvider<KafkaAdminPort> admin) {
    this.properties = properties;
    this.producer = producer;
    this.consumer = consumer;
    this.admin = admin;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info(
        "kafka_clients_ready producer={} producerBrokers={} defaultTopic={} "
            + "consumer={} consumerBrokers={} topics={} group={} admin={} adminBrokers={}",
        producer.getIfAvailable() != null,
        properties.producer() == null ? null : properties.producer().connection().brokers(),
        properties.producer() == null ? null : properties.producer().defaultTopic(),
        consumer.getIfAvailable() != null,
        properties.consumer() == null ? null : properties.consumer().connection().brokers(),
        properties.consumer() == null ? null : properties.consumer().topics(),
        properties.consumer() == null ? null : properties.consumer().group(),
        admin.getIfAvailable() != null,
        properties.admin() == null ? null : properties.admin().brokers()
    );
  }
}
