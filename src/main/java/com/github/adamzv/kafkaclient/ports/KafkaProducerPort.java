package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.ProduceResult;
import java.util.List;

/**
 * Long-lived producer. Safe for concurrent use; {@link #close()} is idempotent.
 */
public interface KafkaProducerPort extends AutoCloseable {

  /**
   * Sends the records and waits for every acknowledgement. Broker rejections are reported per
   * record in the returned list, in input order.
   */
  List<ProduceResult> produce(CallContext ctx, KafkaRecord... records) throws ProblemException;

  List<ProduceResult> produce(CallContext ctx, List<KafkaRecord> records) throws ProblemException;

  /**
   * Enqueues the record. The callback runs exactly once, on a client thread, never while the
   * producer holds an internal lock.
   */
  void produceAsync(CallContext ctx, KafkaRecord record, ProduceCallback callback) throws ProblemException;

  ProduceResult produceJson(CallContext ctx, String topic, String key, Object value) throws ProblemException;

  void produceJsonAsync(CallContext ctx, String topic, String key, Object value, ProduceCallback callback)
      throws ProblemException;

  List<ProduceResult> produceJsonMany(CallContext ctx, Object... values) throws ProblemException;

  void flush(CallContext ctx) throws ProblemException;

  Transaction beginTransaction(CallContext ctx) throws ProblemException;

  /**
   * Runs {@code callback} inside a transaction: commits when it returns, aborts and rethrows
   * when it throws.
   */
  void transact(CallContext ctx, TransactionCallback callback) throws ProblemException;

  /**
   * Publishes {@code records} atomically in one transaction.
   */
  void transactRecords(CallContext ctx, KafkaRecord... records) throws ProblemException;

  String defaultTopic();

  boolean isConnected();

  @Override
  void close();
}
