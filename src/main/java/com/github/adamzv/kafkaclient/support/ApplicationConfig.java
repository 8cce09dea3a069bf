package com.github.adamzv.kafkaclient.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaclient.adapters.kafka.KafkaAdminAdapter;
import com.github.adamzv.kafkaclient.adapters.kafka.KafkaConsumerAdapter;
import com.github.adamzv.kafkaclient.adapters.kafka.KafkaProducerAdapter;
import com.github.adamzv.kafkaclient.ports.KafkaAdminPort;
import com.github.adamzv.kafkaclient.ports.KafkaConsumerPort;
import com.github.adamzv.kafkaclient.ports.KafkaProducerPort;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(KafkaClientsProperties.class)
@Import(StartupLogger.class)
public class ApplicationConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "kafka-client.producer.connection", name = "brokers")
  public KafkaProducerPort kafkaProducer(KafkaClientsProperties properties,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         ObjectProvider<MeterRegistry> meterRegistry) {
    return new KafkaProducerAdapter(
        properties.producer(),
        objectMapper.getIfAvailable(),
        meterRegistry.getIfAvailable(),
        null
    );
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "kafka-client.consumer.connection", name = "brokers")
  public KafkaConsumerPort kafkaConsumer(KafkaClientsProperties properties,
                                         ObjectProvider<MeterRegistry> meterRegistry) {
    return new KafkaConsumerAdapter(properties.consumer(), meterRegistry.getIfAvailable(), null);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "kafka-client.admin", name = "brokers")
  public KafkaAdminPort kafkaAdmin(KafkaClientsProperties properties) {
    return new KafkaAdminAdapter(properties.admin());
  }
}
