package com.github.adamzv.kafkaclient.adapters.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.Problems;
import com.github.adamzv.kafkaclient.domain.ProduceResult;
import com.github.adamzv.kafkaclient.ports.KafkaProducerPort;
import com.github.adamzv.kafkaclient.ports.ProduceCallback;
import com.github.adamzv.kafkaclient.ports.Transaction;
import com.github.adamzv.kafkaclient.ports.TransactionCallback;
import com.github.adamzv.kafkaclient.support.ProducerProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaProducerAdapter implements KafkaProducerPort {

  private static final String CLIENT = "producer";

  private final Logger log;
  private final String bootstrapServers;
  private final String defaultTopic;
  private final String transactionalId;
  private final int maxInFlight;
  private final Duration closeTimeout;
  private final ObjectMapper objectMapper;
  private final ClientMetrics metrics;
  private final KafkaCalls calls;
  private final ExecutorService flushExecutor;
  private final AtomicBoolean transactionActive = new AtomicBoolean();

  private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
  private Producer<byte[], byte[]> producer;
  private boolean closed;

  public KafkaProducerAdapter(ProducerProperties properties) {
    this(properties, null, null, null);
  }

  public KafkaProducerAdapter(ProducerProperties properties,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              Logger logger) {
    this(properties, createClient(properties), objectMapper, meterRegistry, logger);
  }

  /**
   * Wraps an existing client, for example a {@code MockProducer}. The adapter takes ownership
   * and closes it.
   */
  public KafkaProducerAdapter(ProducerProperties properties,
                              Producer<byte[], byte[]> producer,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              Logger logger) {
    validate(properties);
    if (producer == null) {
      throw Problems.invalidArgument("Producer client must not be null", Map.of());
    }
    this.log = logger == null ? LoggerFactory.getLogger(KafkaProducerAdapter.class) : logger;
    this.bootstrapServers = String.join(",", properties.connection().brokerList());
    this.defaultTopic = properties.defaultTopicOrEmpty();
    this.transactionalId = properties.isTransactional() ? properties.transactionalId().trim() : null;
    this.maxInFlight = Math.max(0, properties.batchMaxRecords());
    this.closeTimeout = properties.connection().effectiveRequestTimeout();
    this.objectMapper = objectMapper == null ? new ObjectMapper().findAndRegisterModules() : objectMapper;
    this.metrics = new ClientMetrics(meterRegistry);
    this.calls = new KafkaCalls(bootstrapServers);
    this.producer = producer;
    if (transactionalId != null) {
      initTransactions(producer);
    }
    this.flushExecutor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "kafka-producer-flush");
      thread.setDaemon(true);
      return thread;
    });
    try (KafkaLogContext ignored = logContext(defaultTopic)) {
      log.info(
          "kafka_producer_open brokers={} defaultTopic={} transactionalId={}",
          bootstrapServers,
          defaultTopic,
          transactionalId
      );
    }
  }

  private static Producer<byte[], byte[]> createClient(ProducerProperties properties) {
    validate(properties);
    try {
      return new KafkaProducer<>(new ClientPropertiesFactory().producer(properties));
    } catch (RuntimeException ex) {
      String brokers = String.join(",", properties.connection().brokerList());
      throw new KafkaCalls(brokers).translate("createProducer", ex, Map.of());
    }
  }

  private static void validate(ProducerProperties properties) {
    if (properties == null) {
      throw Problems.nilConfig();
    }
    properties.validate();
  }

  private void initTransactions(Producer<byte[], byte[]> client) {
    try {
      client.initTransactions();
    } catch (RuntimeException ex) {
      client.close(Duration.ZERO);
      throw calls.translate("initTransactions", ex, Map.of("transactionalId", transactionalId));
    }
  }

  @Override
  public List<ProduceResult> produce(CallContext ctx, KafkaRecord... records) {
    return produce(ctx, records == null ? null : Arrays.asList(records));
  }

  @Override
  public List<ProduceResult> produce(CallContext ctx, List<KafkaRecord> records) {
    requireContext(ctx);
    if (records == null) {
      throw Problems.invalidArgument("Records must not be null", Map.of());
    }
    Producer<byte[], byte[]> client = client();
    List<ProducerRecord<byte[], byte[]>> outbound = new ArrayList<>(records.size());
    for (KafkaRecord record : records) {
      outbound.add(toClientRecord(record));
    }

    long started = System.nanoTime();
    List<ProduceResult> results = new ArrayList<>(outbound.size());
    int window = maxInFlight > 0 ? maxInFlight : Math.max(1, outbound.size());
    for (int from = 0; from < outbound.size(); from += window) {
      List<ProducerRecord<byte[], byte[]>> chunk = outbound.subList(from, Math.min(outbound.size(), from + window));
      if (ctx.isCancelled()) {
        cancelRemaining(ctx, chunk, List.of(), results);
        continue;
      }
      List<Future<RecordMetadata>> futures = new ArrayList<>(chunk.size());
      for (ProducerRecord<byte[], byte[]> record : chunk) {
        futures.add(send(client, record));
      }
      awaitAll(ctx, chunk, futures, results);
    }
    metrics.produceDuration(Duration.ofNanos(System.nanoTime() - started));
    return List.copyOf(results);
  }

  private Future<RecordMetadata> send(Producer<byte[], byte[]> client, ProducerRecord<byte[], byte[]> record) {
    try {
      return client.send(record);
    } catch (IllegalStateException ex) {
      if (!isConnected()) {
        throw Problems.clientClosed(CLIENT);
      }
      throw calls.translate("send", ex, Map.of("topic", record.topic()));
    } catch (RuntimeException ex) {
      throw calls.translate("send", ex, Map.of("topic", record.topic()));
    }
  }

  private void awaitAll(CallContext ctx,
                        List<ProducerRecord<byte[], byte[]>> records,
                        List<Future<RecordMetadata>> futures,
                        List<ProduceResult> results) {
    for (int i = 0; i < futures.size(); i++) {
      ProducerRecord<byte[], byte[]> record = records.get(i);
      try {
        RecordMetadata metadata = calls.awaitRaw(futures.get(i), ctx);
        results.add(success(metadata));
      } catch (ExecutionException ex) {
        results.add(failure(record, ex.getCause()));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw Problems.operationFailed("Interrupted while producing", Map.of("topic", record.topic()), ex);
      } catch (ProblemException ex) {
        cancelRemaining(ctx, records.subList(i, records.size()), futures.subList(i, futures.size()), results);
        return;
      }
    }
  }

  /**
   * Keeps acknowledgements that already arrived and marks everything else cancelled.
   */
  private void cancelRemaining(CallContext ctx,
                               List<ProducerRecord<byte[], byte[]>> records,
                               List<Future<RecordMetadata>> futures,
                               List<ProduceResult> results) {
    ProblemException cancelled = ctx.cancellationError();
    for (int i = 0; i < records.size(); i++) {
      ProducerRecord<byte[], byte[]> record = records.get(i);
      Future<RecordMetadata> future = i < futures.size() ? futures.get(i) : null;
      if (future == null || !future.isDone()) {
        results.add(failure(record, cancelled));
        continue;
      }
      try {
        results.add(success(future.get()));
      } catch (ExecutionException ex) {
        results.add(failure(record, ex.getCause()));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        results.add(failure(record, cancelled));
      }
    }
  }

  private ProduceResult success(RecordMetadata metadata) {
    metrics.produced(metadata.topic());
    return ProduceResult.success(metadata.topic(), metadata.partition(), metadata.offset(), metadata.timestamp());
  }

  private ProduceResult failure(ProducerRecord<byte[], byte[]> record, Throwable error) {
    int partition = record.partition() == null ? -1 : record.partition();
    metrics.produceFailed(record.topic());
    try (KafkaLogContext ignored = logContext(record.topic())) {
      log.warn(
          "kafka_produce_failed topic={} partition={} error={} message={}",
          record.topic(),
          partition,
          error.getClass().getSimpleName(),
          error.getMessage()
      );
    }
    return ProduceResult.failure(record.topic(), partition, error);
  }

  @Override
  public void produceAsync(CallContext ctx, KafkaRecord record, ProduceCallback callback) {
    requireContext(ctx);
    if (record == null) {
      throw Problems.invalidArgument("Record must not be null", Map.of());
    }
    if (callback == null) {
      throw Problems.nilHandler();
    }
    OnceCallback once = new OnceCallback(callback);
    String topic = record.topic().isEmpty() ? defaultTopic : record.topic();
    if (ctx.isCancelled()) {
      once.complete(ProduceResult.failure(topic, record.partition(), ctx.cancellationError()));
      return;
    }
    Producer<byte[], byte[]> client;
    ProducerRecord<byte[], byte[]> outbound;
    try {
      client = client();
      outbound = toClientRecord(record);
    } catch (ProblemException ex) {
      once.complete(ProduceResult.failure(topic, record.partition(), ex));
      return;
    }
    try {
      client.send(outbound, (metadata, exception) -> {
        if (exception != null) {
          once.complete(failure(outbound, exception));
        } else {
          once.complete(success(metadata));
        }
      });
    } catch (RuntimeException ex) {
      Throwable error = isConnected() ? ex : Problems.clientClosed(CLIENT);
      once.complete(failure(outbound, error));
    }
  }

  @Override
  public ProduceResult produceJson(CallContext ctx, String topic, String key, Object value) {
    requireContext(ctx);
    return produce(ctx, jsonRecord(topic, key, value)).get(0);
  }

  @Override
  public void produceJsonAsync(CallContext ctx, String topic, String key, Object value, ProduceCallback callback) {
    requireContext(ctx);
    produceAsync(ctx, jsonRecord(topic, key, value), callback);
  }

  @Override
  public List<ProduceResult> produceJsonMany(CallContext ctx, Object... values) {
    requireContext(ctx);
    if (values == null) {
      throw Problems.invalidArgument("Values must not be null", Map.of());
    }
    List<KafkaRecord> records = new ArrayList<>(values.length);
    for (Object value : values) {
      records.add(jsonRecord(null, null, value));
    }
    return produce(ctx, records);
  }

  private KafkaRecord jsonRecord(String topic, String key, Object value) {
    byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException ex) {
      Map<String, Object> details = new HashMap<>();
      details.put("topic", topic == null || topic.isEmpty() ? defaultTopic : topic);
      details.put("type", value == null ? "null" : value.getClass().getName());
      throw Problems.serializationFailed("Cannot serialize value to JSON", details, ex);
    }
    return KafkaRecord.builder().topic(topic).key(key).value(payload).build();
  }

  @Override
  public void flush(CallContext ctx) {
    requireContext(ctx);
    Producer<byte[], byte[]> client = client();
    Future<?> flushed;
    try {
      flushed = flushExecutor.submit(client::flush);
    } catch (RejectedExecutionException ex) {
      throw Problems.clientClosed(CLIENT);
    }
    calls.await(flushed, ctx, "flush", Map.of());
  }

  @Override
  public Transaction beginTransaction(CallContext ctx) {
    requireContext(ctx);
    ctx.checkActive();
    if (transactionalId == null) {
      throw Problems.noTransactionalId();
    }
    Producer<byte[], byte[]> client = client();
    if (!transactionActive.compareAndSet(false, true)) {
      throw Problems.transactionInProgress(transactionalId);
    }
    try {
      client.beginTransaction();
    } catch (RuntimeException ex) {
      transactionActive.set(false);
      throw calls.translate("beginTransaction", ex, Map.of("transactionalId", transactionalId));
    }
    try (KafkaLogContext ignored = logContext(defaultTopic)) {
      log.debug("kafka_transaction_begin transactionalId={}", transactionalId);
    }
    return new KafkaTransaction(
        client,
        transactionalId,
        this::toClientRecord,
        this::isConnected,
        () -> transactionActive.set(false),
        calls,
        metrics,
        log
    );
  }

  @Override
  public void transact(CallContext ctx, TransactionCallback callback) {
    requireContext(ctx);
    if (callback == null) {
      throw Problems.nilHandler();
    }
    Transaction transaction = beginTransaction(ctx);
    try {
      callback.execute(transaction);
    } catch (Throwable failure) {
      try {
        transaction.abort(ctx);
      } catch (RuntimeException abortFailure) {
        failure.addSuppressed(abortFailure);
      }
      if (failure instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (failure instanceof Error error) {
        throw error;
      }
      throw Problems.handlerFailed(
          "Transaction callback failed",
          Map.of("transactionalId", transactionalId),
          failure
      );
    }
    transaction.commit(ctx);
  }

  @Override
  public void transactRecords(CallContext ctx, KafkaRecord... records) {
    if (records == null) {
      throw Problems.invalidArgument("Records must not be null", Map.of());
    }
    transact(ctx, transaction -> transaction.produceMany(records));
  }

  ProducerRecord<byte[], byte[]> toClientRecord(KafkaRecord record) {
    ProducerRecord<byte[], byte[]> outbound = RecordConversions.toProducerRecord(record, defaultTopic);
    TraceHeaders.apply(outbound);
    return outbound;
  }

  @Override
  public String defaultTopic() {
    return defaultTopic;
  }

  @Override
  public boolean isConnected() {
    stateLock.readLock().lock();
    try {
      return !closed;
    } finally {
      stateLock.readLock().unlock();
    }
  }

  @Override
  public void close() {
    Producer<byte[], byte[]> client;
    stateLock.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      client = producer;
      producer = null;
    } finally {
      stateLock.writeLock().unlock();
    }
    flushExecutor.shutdown();
    try (KafkaLogContext ignored = logContext(defaultTopic)) {
      try {
        client.close(closeTimeout);
      } catch (RuntimeException ex) {
        log.warn("kafka_producer_close_failed brokers={} error={}", bootstrapServers, ex.getMessage(), ex);
        return;
      }
      log.info("kafka_producer_closed brokers={}", bootstrapServers);
    }
  }

  private Producer<byte[], byte[]> client() {
    stateLock.readLock().lock();
    try {
      if (closed) {
        throw Problems.clientClosed(CLIENT);
      }
      return producer;
    } finally {
      stateLock.readLock().unlock();
    }
  }

  private KafkaLogContext logContext(String topic) {
    return KafkaLogContext.of(CLIENT, bootstrapServers).topic(topic);
  }

  private static void requireContext(CallContext ctx) {
    if (ctx == null) {
      throw Problems.nilContext();
    }
  }

  private static final class OnceCallback {
    private final ProduceCallback delegate;
    private final AtomicBoolean done = new AtomicBoolean();

    private OnceCallback(ProduceCallback delegate) {
      this.delegate = delegate;
    }

    void complete(ProduceResult result) {
      if (done.compareAndSet(false, true)) {
        delegate.onCompletion(result);
      }
    }
  }
}
