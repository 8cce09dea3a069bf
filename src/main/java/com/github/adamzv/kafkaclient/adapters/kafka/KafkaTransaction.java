package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.Problems;
import com.github.adamzv.kafkaclient.ports.Transaction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.OutOfOrderSequenceException;
import org.apache.kafka.common.errors.ProducerFencedException;
import org.slf4j.Logger;

/**
 * One transaction on a transactional producer. Records stay in memory until {@link #commit}
 * sends them; the lock guards the buffer and the state flags and is never held across a
 * client call.
 */
final class KafkaTransaction implements Transaction {

  private final Producer<byte[], byte[]> producer;
  private final String transactionalId;
  private final Function<KafkaRecord, ProducerRecord<byte[], byte[]>> converter;
  private final BooleanSupplier producerOpen;
  private final Runnable onFinish;
  private final KafkaCalls calls;
  private final ClientMetrics metrics;
  private final Logger log;
  private final AtomicBoolean released = new AtomicBoolean();

  private final ReentrantLock lock = new ReentrantLock();
  private final List<ProducerRecord<byte[], byte[]>> buffered = new ArrayList<>();
  private boolean aborted;
  private boolean finished;

  KafkaTransaction(Producer<byte[], byte[]> producer,
                   String transactionalId,
                   Function<KafkaRecord, ProducerRecord<byte[], byte[]>> converter,
                   BooleanSupplier producerOpen,
                   Runnable onFinish,
                   KafkaCalls calls,
                   ClientMetrics metrics,
                   Logger log) {
    this.producer = producer;
    this.transactionalId = transactionalId;
    this.converter = converter;
    this.producerOpen = producerOpen;
    this.onFinish = onFinish;
    this.calls = calls;
    this.metrics = metrics;
    this.log = log;
  }

  @Override
  public void produce(KafkaRecord record) {
    if (record == null) {
      throw Problems.invalidArgument("Record must not be null", Map.of());
    }
    ProducerRecord<byte[], byte[]> outbound = converter.apply(record);
    lock.lock();
    try {
      ensureOpen();
      buffered.add(outbound);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void produceMany(KafkaRecord... records) {
    if (records == null) {
      throw Problems.invalidArgument("Records must not be null", Map.of());
    }
    List<ProducerRecord<byte[], byte[]>> outbound = new ArrayList<>(records.length);
    for (KafkaRecord record : records) {
      if (record == null) {
        throw Problems.invalidArgument("Record must not be null", Map.of());
      }
      outbound.add(converter.apply(record));
    }
    lock.lock();
    try {
      ensureOpen();
      buffered.addAll(outbound);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void commit(CallContext ctx) {
    if (ctx == null) {
      throw Problems.nilContext();
    }
    List<ProducerRecord<byte[], byte[]>> records;
    lock.lock();
    try {
      ensureOpen();
      finished = true;
      records = List.copyOf(buffered);
      buffered.clear();
    } finally {
      lock.unlock();
    }

    try {
      if (!producerOpen.getAsBoolean()) {
        throw Problems.clientClosed("producer");
      }
      sendAll(ctx, records);
      producer.commitTransaction();
    } catch (RuntimeException ex) {
      markAborted();
      ProblemException failure = ex instanceof ProblemException problem
          ? problem
          : calls.translate("commitTransaction", ex, Map.of("transactionalId", transactionalId));
      if (isFenced(ex)) {
        log.error("kafka_transaction_fenced transactionalId={} error={}", transactionalId, ex.getMessage());
      } else {
        abortAfterFailure(failure);
      }
      metrics.transaction("aborted");
      release();
      throw failure;
    }
    metrics.transaction("committed");
    release();
    log.info("kafka_transaction_committed transactionalId={} records={}", transactionalId, records.size());
  }

  private void sendAll(CallContext ctx, List<ProducerRecord<byte[], byte[]>> records) {
    List<Future<RecordMetadata>> futures = new ArrayList<>(records.size());
    for (ProducerRecord<byte[], byte[]> record : records) {
      futures.add(producer.send(record));
    }
    for (int i = 0; i < futures.size(); i++) {
      ProducerRecord<byte[], byte[]> record = records.get(i);
      try {
        calls.awaitRaw(futures.get(i), ctx);
      } catch (ExecutionException ex) {
        Map<String, Object> context = Map.of(
            "transactionalId", transactionalId,
            "topic", record.topic(),
            "partition", record.partition() == null ? -1 : record.partition()
        );
        metrics.produceFailed(record.topic());
        throw calls.translate("transactional send", ex.getCause(), context);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw Problems.operationFailed(
            "Interrupted while committing transaction",
            Map.of("transactionalId", transactionalId),
            ex
        );
      }
      metrics.produced(record.topic());
    }
  }

  private void abortAfterFailure(ProblemException failure) {
    try {
      producer.abortTransaction();
      log.warn(
          "kafka_transaction_aborted transactionalId={} code={} message={}",
          transactionalId,
          failure.code(),
          failure.getMessage()
      );
    } catch (RuntimeException abortFailure) {
      failure.addSuppressed(abortFailure);
      log.error(
          "kafka_transaction_abort_failed transactionalId={} error={}",
          transactionalId,
          abortFailure.getMessage()
      );
    }
  }

  @Override
  public void abort(CallContext ctx) {
    if (ctx == null) {
      throw Problems.nilContext();
    }
    lock.lock();
    try {
      if (finished) {
        return;
      }
      aborted = true;
      finished = true;
      buffered.clear();
    } finally {
      lock.unlock();
    }
    try {
      producer.abortTransaction();
    } catch (RuntimeException ex) {
      throw calls.translate("abortTransaction", ex, Map.of("transactionalId", transactionalId));
    } finally {
      release();
    }
    metrics.transaction("aborted");
    log.info("kafka_transaction_aborted transactionalId={}", transactionalId);
  }

  @Override
  public boolean isFinished() {
    lock.lock();
    try {
      return finished;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isAborted() {
    lock.lock();
    try {
      return aborted;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int bufferedCount() {
    lock.lock();
    try {
      return buffered.size();
    } finally {
      lock.unlock();
    }
  }

  private void ensureOpen() {
    if (finished || aborted) {
      throw Problems.transactionAborted();
    }
  }

  private void markAborted() {
    lock.lock();
    try {
      aborted = true;
      finished = true;
    } finally {
      lock.unlock();
    }
  }

  private void release() {
    if (released.compareAndSet(false, true)) {
      onFinish.run();
    }
  }

  /**
   * Fencing-class failures leave the producer unusable; aborting would only fail again.
   */
  static boolean isFenced(Throwable error) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
      if (current instanceof ProducerFencedException
          || current instanceof OutOfOrderSequenceException
          || current instanceof AuthorizationException) {
        return true;
      }
    }
    return false;
  }
}
