package com.github.adamzv.kafkaclient.adapters.kafka;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Puts Kafka fields into the MDC for the duration of a log call and restores whatever was
 * there before.
 */
final class KafkaLogContext implements AutoCloseable {

  static final String COMPONENT = "component";
  static final String TOPIC = "kafka_topic";
  static final String GROUP = "kafka_group";
  static final String BROKER = "kafka_broker";

  private final Map<String, String> previous = new LinkedHashMap<>();

  private KafkaLogContext() {
  }

  static KafkaLogContext of(String component, String brokers) {
    return new KafkaLogContext().with(COMPONENT, component).with(BROKER, brokers);
  }

  KafkaLogContext topic(String topic) {
    return with(TOPIC, topic);
  }

  KafkaLogContext group(String group) {
    return with(GROUP, group);
  }

  private KafkaLogContext with(String key, String value) {
    if (value == null || value.isEmpty()) {
      return this;
    }
    if (!previous.containsKey(key)) {
      previous.put(key, MDC.get(key));
    }
    MDC.put(key, value);
    return this;
  }

  @Override
  public void close() {
    previous.forEach((key, value) -> {
      if (value == null) {
        MDC.remove(key);
      } else {
        MDC.put(key, value);
      }
    });
  }
}
