package com.github.adamzv.kafkaclient.adapters.kafka;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;

final class ClientMetrics {

  static final String RECORDS_PRODUCED = "kafka_client_records_produced_total";
  static final String PRODUCE_ERRORS = "kafka_client_produce_errors_total";
  static final String PRODUCE_DURATION = "kafka_client_produce_duration_seconds";
  static final String RECORDS_CONSUMED = "kafka_client_records_consumed_total";
  static final String FETCH_ERRORS = "kafka_client_fetch_errors_total";
  static final String TRANSACTIONS = "kafka_client_transactions_total";

  private final MeterRegistry registry;

  ClientMetrics(MeterRegistry registry) {
    this.registry = registry == null ? new SimpleMeterRegistry() : registry;
  }

  void produced(String topic) {
    registry.counter(RECORDS_PRODUCED, "topic", tag(topic)).increment();
  }

  void produceFailed(String topic) {
    registry.counter(PRODUCE_ERRORS, "topic", tag(topic)).increment();
  }

  void produceDuration(Duration duration) {
    Timer.builder(PRODUCE_DURATION).register(registry).record(duration);
  }

  void consumed(String topic, int count) {
    registry.counter(RECORDS_CONSUMED, "topic", tag(topic)).increment(count);
  }

  void fetchFailed(String topic) {
    registry.counter(FETCH_ERRORS, "topic", tag(topic)).increment();
  }

  void transaction(String outcome) {
    registry.counter(TRANSACTIONS, "outcome", outcome).increment();
  }

  private static String tag(String value) {
    return value == null || value.isEmpty() ? "unknown" : value;
  }
}
