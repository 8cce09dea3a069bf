package com.github.adamzv.kafkaclient.adapters.kafka;

import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.MDC;

/**
 * Copies the caller's trace identifiers from the MDC onto outbound records.
 */
final class TraceHeaders {

  static final String TRACE_ID_KEY = "traceId";
  static final String REQUEST_ID_KEY = "requestId";
  static final String TRACE_ID_HEADER = "X-Trace-ID";
  static final String REQUEST_ID_HEADER = "X-Request-ID";

  private TraceHeaders() {
  }

  /**
   * Adds the headers that are in the MDC and not already on the record.
   */
  static void apply(ProducerRecord<byte[], byte[]> record) {
    addIfAbsent(record, TRACE_ID_HEADER, MDC.get(TRACE_ID_KEY));
    addIfAbsent(record, REQUEST_ID_HEADER, MDC.get(REQUEST_ID_KEY));
  }

  private static void addIfAbsent(ProducerRecord<byte[], byte[]> record, String header, String value) {
    if (value == null || value.isEmpty() || record.headers().lastHeader(header) != null) {
      return;
    }
    record.headers().add(header, value.getBytes(StandardCharsets.UTF_8));
  }
}
