package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.Batch;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.ConsumedRecord;
import com.github.adamzv.kafkaclient.domain.FetchError;
import com.github.adamzv.kafkaclient.domain.FetchResult;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.Problems;
import com.github.adamzv.kafkaclient.ports.BatchHandler;
import com.github.adamzv.kafkaclient.ports.FetchHandler;
import com.github.adamzv.kafkaclient.ports.KafkaConsumerPort;
import com.github.adamzv.kafkaclient.ports.RecordHandler;
import com.github.adamzv.kafkaclient.support.ConsumerProperties;
import com.github.adamzv.kafkaclient.support.StartOffset;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetOutOfRangeException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.RecordDeserializationException;
import org.apache.kafka.common.errors.TopicAuthorizationException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer facade. kafka-clients consumers are single-threaded, so every call into the client
 * goes through {@code accessLock}; {@code wakeup()} is the one call made without it, which is
 * how close and cancellation interrupt a blocked poll.
 */
public class KafkaConsumerAdapter implements KafkaConsumerPort {

  private static final String CLIENT = "consumer";
  private static final Duration CHANNEL_SLICE = Duration.ofMillis(100);

  private final Logger log;
  private final String bootstrapServers;
  private final List<String> topics;
  private final String group;
  private final Duration pollInterval;
  private final Duration requestTimeout;
  private final ClientMetrics metrics;
  private final KafkaCalls calls;

  private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
  private Consumer<byte[], byte[]> consumer;
  private boolean closed;

  private final ReentrantLock accessLock = new ReentrantLock();
  private final Set<String> pausedTopics = ConcurrentHashMap.newKeySet();
  private final Set<TopicPartition> pausedPartitions = ConcurrentHashMap.newKeySet();

  public KafkaConsumerAdapter(ConsumerProperties properties) {
    this(properties, null, null);
  }

  public KafkaConsumerAdapter(ConsumerProperties properties, MeterRegistry meterRegistry, Logger logger) {
    this(properties, createClient(properties), meterRegistry, logger);
  }

  /**
   * Wraps an existing client, for example a {@code MockConsumer}. The adapter takes ownership,
   * subscribes or assigns it, and closes it.
   */
  public KafkaConsumerAdapter(ConsumerProperties properties,
                              Consumer<byte[], byte[]> consumer,
                              MeterRegistry meterRegistry,
                              Logger logger) {
    validate(properties);
    if (consumer == null) {
      throw Problems.invalidArgument("Consumer client must not be null", Map.of());
    }
    this.log = logger == null ? LoggerFactory.getLogger(KafkaConsumerAdapter.class) : logger;
    this.bootstrapServers = String.join(",", properties.connection().brokerList());
    this.topics = List.copyOf(properties.topics());
    this.group = properties.hasGroup() ? properties.group().trim() : null;
    this.pollInterval = properties.effectivePollInterval();
    this.requestTimeout = properties.connection().effectiveRequestTimeout();
    this.metrics = new ClientMetrics(meterRegistry);
    this.calls = new KafkaCalls(bootstrapServers);
    this.consumer = consumer;
    try {
      if (group != null) {
        consumer.subscribe(topics, new PauseRestoringListener());
      } else {
        assignAll(consumer, properties.resolvedStartOffset());
      }
    } catch (RuntimeException ex) {
      consumer.close(Duration.ZERO);
      throw calls.translate("subscribe", ex, Map.of("topics", topics));
    }
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consumer_open brokers={} topics={} group={}", bootstrapServers, topics, group);
    }
  }

  private static Consumer<byte[], byte[]> createClient(ConsumerProperties properties) {
    validate(properties);
    try {
      return new KafkaConsumer<>(new ClientPropertiesFactory().consumer(properties));
    } catch (RuntimeException ex) {
      String brokers = String.join(",", properties.connection().brokerList());
      throw new KafkaCalls(brokers).translate("createConsumer", ex, Map.of());
    }
  }

  private static void validate(ConsumerProperties properties) {
    if (properties == null) {
      throw Problems.nilConfig();
    }
    properties.validate();
  }

  private void assignAll(Consumer<byte[], byte[]> client, StartOffset startOffset) {
    List<TopicPartition> partitions = new ArrayList<>();
    for (String topic : topics) {
      List<PartitionInfo> infos = client.partitionsFor(topic, requestTimeout);
      if (infos == null || infos.isEmpty()) {
        throw Problems.notFound("Topic has no partitions", Map.of("topic", topic));
      }
      for (PartitionInfo info : infos) {
        partitions.add(new TopicPartition(info.topic(), info.partition()));
      }
    }
    client.assign(partitions);
    if (startOffset == StartOffset.EARLIEST) {
      client.seekToBeginning(partitions);
    } else {
      client.seekToEnd(partitions);
    }
  }

  @Override
  public FetchResult poll(CallContext ctx) {
    requireContext(ctx);
    Consumer<byte[], byte[]> client = client();
    if (ctx.isCancelled()) {
      return FetchResult.ofError(FetchError.global(ctx.cancellationError()));
    }
    try (CallContext.Registration ignored = ctx.onCancel(client::wakeup)) {
      while (true) {
        if (!isConnected()) {
          return FetchResult.ofError(FetchError.global(Problems.clientClosed(CLIENT)));
        }
        if (ctx.isCancelled()) {
          return FetchResult.ofError(FetchError.global(ctx.cancellationError()));
        }
        FetchResult result = pollOnce(ctx, client);
        if (result != null) {
          return result;
        }
      }
    }
  }

  /**
   * One poll slice; {@code null} when nothing arrived and the caller should poll again.
   */
  private FetchResult pollOnce(CallContext ctx, Consumer<byte[], byte[]> client) {
    ConsumerRecords<byte[], byte[]> records;
    accessLock.lock();
    try {
      if (!isConnected()) {
        return FetchResult.ofError(FetchError.global(Problems.clientClosed(CLIENT)));
      }
      records = client.poll(ctx.remaining(pollInterval));
    } catch (WakeupException ex) {
      if (!isConnected()) {
        return FetchResult.ofError(FetchError.global(Problems.clientClosed(CLIENT)));
      }
      if (ctx.isCancelled()) {
        return FetchResult.ofError(FetchError.global(ctx.cancellationError()));
      }
      // left over from an earlier cancelled call
      return null;
    } catch (InterruptException ex) {
      return fetchFailure(List.of(FetchError.global(ex)));
    } catch (KafkaException ex) {
      return fetchFailure(toFetchErrors(ex));
    } catch (IllegalStateException ex) {
      if (!isConnected()) {
        return FetchResult.ofError(FetchError.global(Problems.clientClosed(CLIENT)));
      }
      return fetchFailure(List.of(FetchError.global(ex)));
    } finally {
      accessLock.unlock();
    }
    if (records.isEmpty()) {
      return null;
    }
    FetchResult result = RecordConversions.toFetchResult(records, List.of());
    for (Batch batch : result.batches()) {
      metrics.consumed(batch.topic(), batch.size());
    }
    return result;
  }

  private FetchResult fetchFailure(List<FetchError> errors) {
    for (FetchError error : errors) {
      metrics.fetchFailed(error.topic());
      try (KafkaLogContext ignored = logContext().topic(error.topic())) {
        log.warn(
            "kafka_fetch_error topic={} partition={} error={} message={}",
            error.topic(),
            error.partition(),
            error.error().getClass().getSimpleName(),
            error.error().getMessage()
        );
      }
    }
    return new FetchResult(List.of(), errors);
  }

  static List<FetchError> toFetchErrors(KafkaException error) {
    if (error instanceof RecordDeserializationException deserialization) {
      TopicPartition tp = deserialization.topicPartition();
      return List.of(new FetchError(tp.topic(), tp.partition(), error));
    }
    if (error instanceof OffsetOutOfRangeException outOfRange && !outOfRange.offsetOutOfRangePartitions().isEmpty()) {
      List<FetchError> errors = new ArrayList<>();
      for (TopicPartition tp : outOfRange.offsetOutOfRangePartitions().keySet()) {
        errors.add(new FetchError(tp.topic(), tp.partition(), error));
      }
      return errors;
    }
    if (error instanceof TopicAuthorizationException authorization && !authorization.unauthorizedTopics().isEmpty()) {
      List<FetchError> errors = new ArrayList<>();
      for (String topic : authorization.unauthorizedTopics()) {
        errors.add(new FetchError(topic, -1, error));
      }
      return errors;
    }
    return List.of(FetchError.global(error));
  }

  @Override
  public List<ConsumedRecord> pollRecords(CallContext ctx, int maxRecords) {
    requireContext(ctx);
    if (maxRecords <= 0) {
      throw Problems.invalidArgument("maxRecords must be > 0", Map.of("maxRecords", maxRecords));
    }
    FetchResult result = poll(ctx);
    if (result.hasErrors()) {
      throw asProblem(result.errors().get(0));
    }
    List<ConsumedRecord> records = result.records();
    if (records.size() <= maxRecords) {
      return records;
    }
    rewind(records.subList(maxRecords, records.size()));
    return List.copyOf(records.subList(0, maxRecords));
  }

  /**
   * Seeks every partition back to its first undelivered record so the client position, and
   * with it any commit, only covers what the caller has received.
   */
  private void rewind(List<ConsumedRecord> undelivered) {
    Map<TopicPartition, Long> firstOffsets = new LinkedHashMap<>();
    for (ConsumedRecord record : undelivered) {
      firstOffsets.merge(new TopicPartition(record.topic(), record.partition()), record.offset(), Math::min);
    }
    withClient("seek", client -> firstOffsets.forEach(client::seek));
    log.debug("kafka_consumer_rewound group={} positions={}", group, firstOffsets);
  }

  @Override
  public ConsumedRecord readRecord(CallContext ctx) {
    return pollRecords(ctx, 1).get(0);
  }

  @Override
  public void consume(CallContext ctx, RecordHandler handler) {
    requireContext(ctx);
    if (handler == null) {
      throw Problems.nilHandler();
    }
    while (true) {
      FetchResult result = nextFetch(ctx);
      if (result == null) {
        return;
      }
      for (ConsumedRecord record : result.records()) {
        try {
          handler.handle(ctx, record);
        } catch (Exception ex) {
          throw handlerFailure(ex, record.topic(), record.partition(), record.offset());
        }
      }
    }
  }

  @Override
  public void consumeBatches(CallContext ctx, BatchHandler handler) {
    requireContext(ctx);
    if (handler == null) {
      throw Problems.nilHandler();
    }
    while (true) {
      FetchResult result = nextFetch(ctx);
      if (result == null) {
        return;
      }
      for (Batch batch : result.batches()) {
        try {
          handler.handle(ctx, batch);
        } catch (Exception ex) {
          throw handlerFailure(ex, batch.topic(), batch.partition(), batch.firstOffset());
        }
      }
    }
  }

  @Override
  public void consumeFetches(CallContext ctx, FetchHandler handler) {
    requireContext(ctx);
    if (handler == null) {
      throw Problems.nilHandler();
    }
    while (true) {
      FetchResult result;
      try {
        result = poll(ctx);
      } catch (ProblemException ex) {
        if (ClosedErrors.isClosed(ex)) {
          logStopped(ex);
          return;
        }
        throw ex;
      }
      if (result.hasErrors() && ClosedErrors.isClosed(result.firstError())) {
        logStopped(result.firstError());
        return;
      }
      try {
        handler.handle(ctx, result);
      } catch (Exception ex) {
        FetchError first = result.hasErrors() ? result.errors().get(0) : null;
        Batch batch = result.isEmpty() ? null : result.batches().get(0);
        String topic = batch != null ? batch.topic() : first != null ? first.topic() : "";
        int partition = batch != null ? batch.partition() : first != null ? first.partition() : -1;
        throw handlerFailure(ex, topic, partition, batch != null ? batch.firstOffset() : -1L);
      }
    }
  }

  @Override
  public void consumeChannel(CallContext ctx, BlockingQueue<ConsumedRecord> channel) {
    requireContext(ctx);
    if (channel == null) {
      throw Problems.nilHandler();
    }
    while (true) {
      FetchResult result = nextFetch(ctx);
      if (result == null) {
        return;
      }
      for (ConsumedRecord record : result.records()) {
        if (!offer(ctx, channel, record)) {
          logStopped(ctx.isCancelled() ? ctx.cancellationError() : Problems.clientClosed(CLIENT));
          return;
        }
      }
    }
  }

  private boolean offer(CallContext ctx, BlockingQueue<ConsumedRecord> channel, ConsumedRecord record) {
    try {
      while (!channel.offer(record, ctx.remaining(CHANNEL_SLICE).toNanos(), TimeUnit.NANOSECONDS)) {
        if (ctx.isCancelled() || !isConnected()) {
          return false;
        }
      }
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed(
          "Interrupted while delivering record",
          Map.of("topic", record.topic(), "partition", record.partition(), "offset", record.offset()),
          ex
      );
    }
  }

  /**
   * Next poll for the consume loops; {@code null} means the loop should end quietly.
   */
  private FetchResult nextFetch(CallContext ctx) {
    FetchResult result;
    try {
      result = poll(ctx);
    } catch (ProblemException ex) {
      if (ClosedErrors.isClosed(ex)) {
        logStopped(ex);
        return null;
      }
      throw ex;
    }
    if (!result.hasErrors()) {
      return result;
    }
    FetchError first = result.errors().get(0);
    if (ClosedErrors.isClosed(first.error())) {
      logStopped(first.error());
      return null;
    }
    throw asProblem(first);
  }

  private void logStopped(Throwable reason) {
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consume_stopped topics={} group={} reason={}", topics, group, reason.getMessage());
    }
  }

  private RuntimeException handlerFailure(Exception ex, String topic, int partition, long offset) {
    try (KafkaLogContext ignored = logContext().topic(topic)) {
      log.error(
          "kafka_handler_failed topic={} partition={} offset={} error={}",
          topic,
          partition,
          offset,
          ex.getMessage(),
          ex
      );
    }
    if (ex instanceof RuntimeException runtime) {
      return runtime;
    }
    return Problems.handlerFailed(
        "Record handler failed",
        Map.of("topic", topic, "partition", partition, "offset", offset),
        ex
    );
  }

  private ProblemException asProblem(FetchError error) {
    Map<String, Object> context = Map.of("topic", error.topic(), "partition", error.partition());
    return calls.translate("poll", error.error(), context);
  }

  @Override
  public void commitOffsets(CallContext ctx) {
    requireContext(ctx);
    requireGroup();
    commit(ctx, null);
  }

  @Override
  public void commitRecord(CallContext ctx, ConsumedRecord record) {
    requireContext(ctx);
    if (record == null) {
      throw Problems.invalidArgument("Record must not be null", Map.of());
    }
    requireGroup();
    commit(ctx, Map.of(
        new TopicPartition(record.topic(), record.partition()),
        new OffsetAndMetadata(record.offset() + 1, record.leaderEpochIfKnown(), "")
    ));
  }

  @Override
  public void commitBatch(CallContext ctx, Batch batch) {
    requireContext(ctx);
    if (batch == null) {
      throw Problems.invalidArgument("Batch must not be null", Map.of());
    }
    requireGroup();
    if (batch.isEmpty()) {
      return;
    }
    commitRecord(ctx, batch.lastRecord());
  }

  /**
   * Commits {@code offsets}, or every consumed position when {@code offsets} is null.
   */
  private void commit(CallContext ctx, Map<TopicPartition, OffsetAndMetadata> offsets) {
    ctx.checkActive();
    Consumer<byte[], byte[]> client = client();
    Map<String, Object> context = offsets == null ? Map.of("group", group) : Map.of("group", group, "offsets", offsets.toString());
    accessLock.lock();
    try {
      if (!isConnected()) {
        throw Problems.clientClosed(CLIENT);
      }
      try {
        commitSync(client, offsets, ctx.remaining(requestTimeout));
      } catch (WakeupException ex) {
        if (!isConnected()) {
          throw Problems.clientClosed(CLIENT);
        }
        // a wakeup left by a cancelled poll is consumed by the first blocking call
        ctx.checkActive();
        commitSync(client, offsets, ctx.remaining(requestTimeout));
      }
    } catch (WakeupException ex) {
      if (!isConnected()) {
        throw Problems.clientClosed(CLIENT);
      }
      throw calls.translate("commit", ex, context);
    } catch (ProblemException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw calls.translate("commit", ex, context);
    } finally {
      accessLock.unlock();
    }
  }

  private static void commitSync(Consumer<byte[], byte[]> client,
                                 Map<TopicPartition, OffsetAndMetadata> offsets,
                                 Duration timeout) {
    if (offsets == null) {
      client.commitSync(timeout);
    } else {
      client.commitSync(offsets, timeout);
    }
  }

  @Override
  public void pause(String... topicNames) {
    Set<String> names = names(topicNames);
    pausedTopics.addAll(names);
    withClient("pause", client -> client.pause(assignedFor(client, names, Set.of())));
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consumer_paused topics={}", names);
    }
  }

  @Override
  public void resume(String... topicNames) {
    Set<String> names = names(topicNames);
    pausedTopics.removeAll(names);
    pausedPartitions.removeIf(tp -> names.contains(tp.topic()));
    withClient("resume", client -> client.resume(assignedFor(client, names, Set.of())));
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consumer_resumed topics={}", names);
    }
  }

  @Override
  public void pausePartitions(Map<String, ? extends Collection<Integer>> partitions) {
    Set<TopicPartition> requested = topicPartitions(partitions);
    pausedPartitions.addAll(requested);
    withClient("pausePartitions", client -> client.pause(assignedFor(client, Set.of(), requested)));
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consumer_paused partitions={}", requested);
    }
  }

  @Override
  public void resumePartitions(Map<String, ? extends Collection<Integer>> partitions) {
    Set<TopicPartition> requested = topicPartitions(partitions);
    pausedPartitions.removeAll(requested);
    withClient("resumePartitions", client -> client.resume(assignedFor(client, Set.of(), requested)));
    try (KafkaLogContext ignored = logContext()) {
      log.info("kafka_consumer_resumed partitions={}", requested);
    }
  }

  @Override
  public Set<String> pausedTopics() {
    return Set.copyOf(pausedTopics);
  }

  private void withClient(String operation, java.util.function.Consumer<Consumer<byte[], byte[]>> action) {
    Consumer<byte[], byte[]> client = client();
    accessLock.lock();
    try {
      if (!isConnected()) {
        throw Problems.clientClosed(CLIENT);
      }
      action.accept(client);
    } catch (ProblemException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw calls.translate(operation, ex, Map.of("topics", topics));
    } finally {
      accessLock.unlock();
    }
  }

  /**
   * Currently assigned partitions that belong to {@code topicNames} or appear in
   * {@code partitions}. Unassigned ones are paused when a rebalance hands them over.
   */
  private static Set<TopicPartition> assignedFor(Consumer<byte[], byte[]> client,
                                                 Set<String> topicNames,
                                                 Set<TopicPartition> partitions) {
    Set<TopicPartition> matched = new LinkedHashSet<>();
    for (TopicPartition tp : client.assignment()) {
      if (topicNames.contains(tp.topic()) || partitions.contains(tp)) {
        matched.add(tp);
      }
    }
    return matched;
  }

  private static Set<String> names(String... topicNames) {
    if (topicNames == null) {
      throw Problems.invalidArgument("Topics must not be null", Map.of());
    }
    Set<String> names = new LinkedHashSet<>();
    for (String topic : topicNames) {
      if (topic != null && !topic.isBlank()) {
        names.add(topic.trim());
      }
    }
    return names;
  }

  private static Set<TopicPartition> topicPartitions(Map<String, ? extends Collection<Integer>> partitions) {
    if (partitions == null) {
      throw Problems.invalidArgument("Partitions must not be null", Map.of());
    }
    Set<TopicPartition> result = new LinkedHashSet<>();
    partitions.forEach((topic, ids) -> {
      if (topic == null || ids == null) {
        throw Problems.invalidArgument("Partition map must not contain null entries", Map.of());
      }
      for (Integer id : ids) {
        if (id == null || id < 0) {
          throw Problems.invalidArgument("Partition ids must be >= 0", Map.of("topic", topic));
        }
        result.add(new TopicPartition(topic, id));
      }
    });
    return result;
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
    Consumer<byte[], byte[]> client;
    stateLock.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      client = consumer;
      consumer = null;
    } finally {
      stateLock.writeLock().unlock();
    }
    client.wakeup();
    accessLock.lock();
    try (KafkaLogContext ignored = logContext()) {
      try {
        client.close(requestTimeout);
      } catch (RuntimeException ex) {
        log.warn("kafka_consumer_close_failed brokers={} error={}", bootstrapServers, ex.getMessage(), ex);
        return;
      }
      log.info("kafka_consumer_closed brokers={} group={}", bootstrapServers, group);
    } finally {
      accessLock.unlock();
    }
  }

  private Consumer<byte[], byte[]> client() {
    stateLock.readLock().lock();
    try {
      if (closed) {
        throw Problems.clientClosed(CLIENT);
      }
      return consumer;
    } finally {
      stateLock.readLock().unlock();
    }
  }

  private void requireGroup() {
    if (group == null) {
      throw Problems.missingGroup(Map.of("topics", topics));
    }
  }

  private KafkaLogContext logContext() {
    return KafkaLogContext.of(CLIENT, bootstrapServers).group(group);
  }

  private static void requireContext(CallContext ctx) {
    if (ctx == null) {
      throw Problems.nilContext();
    }
  }

  /**
   * Re-applies pauses to partitions handed over by a rebalance. Runs inside {@code poll}, on
   * the thread that holds the access lock.
   */
  private final class PauseRestoringListener implements ConsumerRebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      log.debug("kafka_partitions_revoked group={} partitions={}", group, partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      Set<TopicPartition> toPause = new LinkedHashSet<>();
      for (TopicPartition tp : partitions) {
        if (pausedTopics.contains(tp.topic()) || pausedPartitions.contains(tp)) {
          toPause.add(tp);
        }
      }
      Consumer<byte[], byte[]> client = consumerForListener();
      if (!toPause.isEmpty() && client != null) {
        client.pause(toPause);
      }
      log.debug("kafka_partitions_assigned group={} partitions={} repaused={}", group, partitions, toPause);
    }
  }

  private Consumer<byte[], byte[]> consumerForListener() {
    stateLock.readLock().lock();
    try {
      return consumer;
    } finally {
      stateLock.readLock().unlock();
    }
  }
}
