package com.github.adamzv.kafkaclient.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaclient.domain.Batch;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.ConsumedRecord;
import com.github.adamzv.kafkaclient.domain.FetchError;
import com.github.adamzv.kafkaclient.domain.FetchResult;
import com.github.adamzv.kafkaclient.domain.ProblemCodes;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.support.ConsumerProperties;
import com.github.adamzv.kafkaclient.support.KafkaProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetOutOfRangeException;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaConsumerAdapterTest {

  private static final String TOPIC = "orders";
  private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);
  private static final TopicPartition P1 = new TopicPartition(TOPIC, 1);

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private MockConsumer<byte[], byte[]> mock;

  @BeforeEach
  void setUp() {
    mock = configure(new MockConsumer<>(OffsetResetStrategy.EARLIEST));
  }

  private static <T extends MockConsumer<byte[], byte[]>> T configure(T consumer) {
    consumer.updatePartitions(TOPIC, List.of(
        new PartitionInfo(TOPIC, 0, null, null, null),
        new PartitionInfo(TOPIC, 1, null, null, null)
    ));
    consumer.updateBeginningOffsets(Map.of(P0, 0L, P1, 0L));
    return consumer;
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void assignsEveryPartitionWithoutGroup() {
    groupless();

    assertEquals(Set.of(P0, P1), mock.assignment());
  }

  @Test
  void topicWithoutPartitionsIsNotFound() {
    ConsumerProperties properties = ConsumerProperties.builder()
        .connection(KafkaProperties.of("localhost:9092"))
        .topics("missing")
        .build();

    ProblemException exception = assertThrows(ProblemException.class,
        () -> new KafkaConsumerAdapter(properties, mock, registry, null));
    assertEquals(ProblemCodes.NOT_FOUND, exception.code());
    assertTrue(mock.closed());
  }

  @Test
  void pollGroupsRecordsPerPartitionInOffsetOrder() {
    KafkaConsumerAdapter adapter = groupless();
    addRecord(P0, 0);
    addRecord(P0, 1);
    addRecord(P1, 0);

    FetchResult result = adapter.poll(withTimeout());

    assertFalse(result.hasErrors());
    assertEquals(3, result.recordCount());
    Batch first = batchFor(result, 0);
    assertEquals(List.of(0L, 1L), first.records().stream().map(ConsumedRecord::offset).toList());
    assertEquals("value-0-1", first.lastRecord().valueAsString());
    assertEquals(1, batchFor(result, 1).size());
    assertEquals(3.0, registry.counter(ClientMetrics.RECORDS_CONSUMED, "topic", TOPIC).count());
  }

  @Test
  void pollEndsWithCancellationWhenNothingArrives() {
    KafkaConsumerAdapter adapter = groupless();

    FetchResult result = adapter.poll(CallContext.background().withTimeout(Duration.ofMillis(50)));

    ProblemException error = assertInstanceOf(ProblemException.class, result.firstError());
    assertEquals(ProblemCodes.CANCELLED, error.code());
  }

  @Test
  void pollRecordsRewindsToTheFirstUndeliveredRecord() {
    KafkaConsumerAdapter adapter = groupless();
    addRecord(P0, 0);
    addRecord(P0, 1);
    addRecord(P0, 2);

    List<ConsumedRecord> first = adapter.pollRecords(withTimeout(), 2);
    assertEquals(List.of(0L, 1L), first.stream().map(ConsumedRecord::offset).toList());
    assertEquals(2L, mock.position(P0));

    // the broker serves the partition again from the rewound position
    addRecord(P0, 0);
    addRecord(P0, 1);
    addRecord(P0, 2);
    List<ConsumedRecord> second = adapter.pollRecords(withTimeout(), 5);

    assertEquals(List.of(2L), second.stream().map(ConsumedRecord::offset).toList());
  }

  @Test
  void commitOffsetsAfterPollRecordsCoversOnlyDeliveredRecords() {
    KafkaConsumerAdapter adapter = grouped();
    mock.rebalance(List.of(P0));
    addRecord(P0, 0);
    addRecord(P0, 1);
    addRecord(P0, 2);

    List<ConsumedRecord> delivered = adapter.pollRecords(withTimeout(), 1);
    adapter.commitOffsets(CallContext.background());

    assertEquals(1, delivered.size());
    assertEquals(1L, mock.committed(Set.of(P0)).get(P0).offset());
  }

  @Test
  void pollWithCancelledContextLeavesNoWakeupBehind() {
    WakeupCountingConsumer counting = configure(new WakeupCountingConsumer());
    mock = counting;
    KafkaConsumerAdapter adapter = new KafkaConsumerAdapter(properties("billing"), counting, registry, null);
    counting.rebalance(List.of(P0));
    CallContext ctx = CallContext.background().withCancel();
    ctx.cancel();

    FetchResult result = adapter.poll(ctx);
    adapter.commitOffsets(CallContext.background());

    assertEquals(ProblemCodes.CANCELLED, assertInstanceOf(ProblemException.class, result.firstError()).code());
    assertEquals(0, counting.wakeups);
  }

  @Test
  void commitRetriesOnceAfterLeftoverWakeup() {
    WakeupOnceConsumer wakeupOnce = configure(new WakeupOnceConsumer());
    mock = wakeupOnce;
    KafkaConsumerAdapter adapter = new KafkaConsumerAdapter(properties("billing"), wakeupOnce, registry, null);
    wakeupOnce.rebalance(List.of(P0));
    addRecord(P0, 0);
    adapter.poll(withTimeout());

    adapter.commitOffsets(CallContext.background());

    assertEquals(2, wakeupOnce.commits);
    assertEquals(1L, wakeupOnce.committed(Set.of(P0)).get(P0).offset());
  }

  @Test
  void readRecordReturnsOneRecord() {
    KafkaConsumerAdapter adapter = groupless();
    addRecord(P1, 0);

    ConsumedRecord record = adapter.readRecord(withTimeout());

    assertEquals(1, record.partition());
    assertEquals("key-1-0", record.keyAsString());
  }

  @Test
  void pollRecordsRejectsNonPositiveLimit() {
    KafkaConsumerAdapter adapter = groupless();

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.pollRecords(withTimeout(), 0));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.code());
  }

  @Test
  void fetchErrorsAreReportedInTheResult() {
    KafkaConsumerAdapter adapter = groupless();
    mock.setPollException(new KafkaException("broker went away"));

    FetchResult result = adapter.poll(withTimeout());

    assertTrue(result.isEmpty());
    assertInstanceOf(KafkaException.class, result.firstError());
    assertEquals(1.0, registry.counter(ClientMetrics.FETCH_ERRORS, "topic", "unknown").count());
  }

  @Test
  void consumeSurfacesFetchErrorsAsProblems() {
    KafkaConsumerAdapter adapter = groupless();
    mock.setPollException(new KafkaException("broker went away"));

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.consume(withTimeout(), (ctx, record) -> { }));
    assertEquals(ProblemCodes.KAFKA_UNAVAILABLE, exception.code());
  }

  @Test
  void outOfRangeErrorsArePerPartition() {
    OffsetOutOfRangeException error = new OffsetOutOfRangeException("out of range", Map.of(P1, 42L));

    List<FetchError> errors = KafkaConsumerAdapter.toFetchErrors(error);

    assertEquals(1, errors.size());
    assertEquals(TOPIC, errors.get(0).topic());
    assertEquals(1, errors.get(0).partition());
  }

  @Test
  void callsOnClosedConsumerFail() {
    KafkaConsumerAdapter adapter = groupless();
    adapter.close();
    adapter.close();

    assertTrue(mock.closed());
    assertFalse(adapter.isConnected());
    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.poll(CallContext.background()));
    assertEquals(ProblemCodes.CLIENT_CLOSED, exception.code());
  }

  @Test
  void nilArgumentsAreRejected() {
    KafkaConsumerAdapter adapter = groupless();

    assertEquals(ProblemCodes.NIL_CONTEXT,
        assertThrows(ProblemException.class, () -> adapter.poll(null)).code());
    assertEquals(ProblemCodes.NIL_HANDLER,
        assertThrows(ProblemException.class, () -> adapter.consume(CallContext.background(), null)).code());
    assertEquals(ProblemCodes.NIL_HANDLER,
        assertThrows(ProblemException.class, () -> adapter.consumeChannel(CallContext.background(), null)).code());
  }

  @Test
  void closeFromAnotherThreadEndsConsumeQuietly() throws Exception {
    KafkaConsumerAdapter adapter = groupless();
    List<ConsumedRecord> seen = new CopyOnWriteArrayList<>();
    addRecord(P0, 0);

    Future<?> loop = executor.submit(() -> adapter.consume(CallContext.background(), (ctx, record) -> seen.add(record)));
    KafkaProducerAdapterTest.waitFor(() -> seen.size() == 1);
    adapter.close();

    loop.get(5, TimeUnit.SECONDS);
    assertTrue(mock.closed());
  }

  @Test
  void cancellationEndsConsumeBatchesQuietly() throws Exception {
    KafkaConsumerAdapter adapter = groupless();
    CallContext ctx = CallContext.background().withCancel();
    List<Batch> seen = new CopyOnWriteArrayList<>();
    addRecord(P0, 0);
    addRecord(P0, 1);

    Future<?> loop = executor.submit(() -> adapter.consumeBatches(ctx, (context, batch) -> seen.add(batch)));
    KafkaProducerAdapterTest.waitFor(() -> !seen.isEmpty());
    ctx.cancel();

    loop.get(5, TimeUnit.SECONDS);
    assertEquals(2, seen.get(0).size());
    assertTrue(adapter.isConnected());
  }

  @Test
  void handlerRuntimeFailureIsRethrownAsIs() {
    KafkaConsumerAdapter adapter = groupless();
    addRecord(P0, 0);
    IllegalArgumentException failure = new IllegalArgumentException("bad payload");

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
        () -> adapter.consume(withTimeout(), (ctx, record) -> {
          throw failure;
        }));
    assertSame(failure, thrown);
  }

  @Test
  void handlerCheckedFailureIsHandlerFailed() {
    KafkaConsumerAdapter adapter = groupless();
    addRecord(P0, 0);

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.consume(withTimeout(), (ctx, record) -> {
          throw new IOException("sink unavailable");
        }));
    assertEquals(ProblemCodes.HANDLER_FAILED, exception.code());
    assertEquals(0L, exception.problem().details().get("offset"));
  }

  @Test
  void consumeFetchesHandsErrorsToTheHandler() {
    KafkaConsumerAdapter adapter = groupless();
    mock.setPollException(new KafkaException("broker went away"));
    List<FetchResult> seen = new CopyOnWriteArrayList<>();

    adapter.consumeFetches(withTimeout(), (ctx, fetch) -> {
      seen.add(fetch);
      adapter.close();
    });

    assertEquals(1, seen.size());
    assertTrue(seen.get(0).hasErrors());
  }

  @Test
  void consumeChannelDeliversInOrder() throws Exception {
    KafkaConsumerAdapter adapter = groupless();
    BlockingQueue<ConsumedRecord> channel = new ArrayBlockingQueue<>(1);
    addRecord(P0, 0);
    addRecord(P0, 1);

    Future<?> loop = executor.submit(() -> adapter.consumeChannel(CallContext.background(), channel));
    ConsumedRecord first = channel.poll(5, TimeUnit.SECONDS);
    ConsumedRecord second = channel.poll(5, TimeUnit.SECONDS);
    adapter.close();

    loop.get(5, TimeUnit.SECONDS);
    assertEquals(0L, first.offset());
    assertEquals(1L, second.offset());
  }

  @Test
  void commitRecordStoresNextOffset() {
    KafkaConsumerAdapter adapter = grouped();
    mock.rebalance(List.of(P0));
    addRecord(P0, 0);
    addRecord(P0, 1);

    FetchResult result = adapter.poll(withTimeout());
    adapter.commitRecord(CallContext.background(), result.records().get(0));
    assertEquals(1L, mock.committed(Set.of(P0)).get(P0).offset());

    adapter.commitBatch(CallContext.background(), result.batches().get(0));
    assertEquals(2L, mock.committed(Set.of(P0)).get(P0).offset());
  }

  @Test
  void commitOffsetsStoresConsumedPositions() {
    KafkaConsumerAdapter adapter = grouped();
    mock.rebalance(List.of(P0));
    addRecord(P0, 0);
    adapter.poll(withTimeout());

    adapter.commitOffsets(CallContext.background());

    assertEquals(1L, mock.committed(Set.of(P0)).get(P0).offset());
  }

  @Test
  void commitWithoutGroupIsMissingGroup() {
    KafkaConsumerAdapter adapter = groupless();
    ConsumedRecord record = new ConsumedRecord(TOPIC, 0, 5L, null, null, List.of(), 0L, -1);

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.commitRecord(CallContext.background(), record));
    assertEquals(ProblemCodes.MISSING_GROUP, exception.code());
    assertEquals(ProblemCodes.MISSING_GROUP,
        assertThrows(ProblemException.class, () -> adapter.commitOffsets(CallContext.background())).code());
  }

  @Test
  void pauseAndResumeTopics() {
    KafkaConsumerAdapter adapter = groupless();

    adapter.pause(TOPIC, " ");

    assertEquals(Set.of(TOPIC), adapter.pausedTopics());
    assertEquals(Set.of(P0, P1), mock.paused());

    adapter.resume(TOPIC);

    assertTrue(adapter.pausedTopics().isEmpty());
    assertTrue(mock.paused().isEmpty());
  }

  @Test
  void pauseSinglePartition() {
    KafkaConsumerAdapter adapter = groupless();

    adapter.pausePartitions(Map.of(TOPIC, List.of(1)));
    assertEquals(Set.of(P1), mock.paused());

    adapter.resumePartitions(Map.of(TOPIC, List.of(1)));
    assertTrue(mock.paused().isEmpty());
  }

  @Test
  void pausedPartitionsAreNotFetched() {
    KafkaConsumerAdapter adapter = groupless();
    adapter.pausePartitions(Map.of(TOPIC, List.of(0)));
    addRecord(P0, 0);
    addRecord(P1, 0);

    FetchResult result = adapter.poll(withTimeout());

    assertEquals(1, result.batches().size());
    assertEquals(1, result.batches().get(0).partition());
  }

  private KafkaConsumerAdapter groupless() {
    return new KafkaConsumerAdapter(properties(null), mock, registry, null);
  }

  private KafkaConsumerAdapter grouped() {
    return new KafkaConsumerAdapter(properties("billing"), mock, registry, null);
  }

  private static ConsumerProperties properties(String group) {
    return ConsumerProperties.builder()
        .connection(KafkaProperties.of("localhost:9092"))
        .topics(TOPIC)
        .group(group)
        .startOffset("earliest")
        .pollInterval(Duration.ofMillis(10))
        .build();
  }

  private static CallContext withTimeout() {
    return CallContext.background().withTimeout(Duration.ofSeconds(5));
  }

  private void addRecord(TopicPartition partition, long offset) {
    String suffix = partition.partition() + "-" + offset;
    mock.addRecord(new ConsumerRecord<>(
        partition.topic(),
        partition.partition(),
        offset,
        ("key-" + suffix).getBytes(StandardCharsets.UTF_8),
        ("value-" + suffix).getBytes(StandardCharsets.UTF_8)
    ));
  }

  private static Batch batchFor(FetchResult result, int partition) {
    return result.batches().stream()
        .filter(batch -> batch.partition() == partition)
        .findFirst()
        .orElseThrow();
  }

  private static final class WakeupCountingConsumer extends MockConsumer<byte[], byte[]> {

    private int wakeups;

    WakeupCountingConsumer() {
      super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void wakeup() {
      wakeups++;
      super.wakeup();
    }
  }

  private static final class WakeupOnceConsumer extends MockConsumer<byte[], byte[]> {

    private int commits;

    WakeupOnceConsumer() {
      super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Duration timeout) {
      commits++;
      if (commits == 1) {
        throw new WakeupException();
      }
      super.commitSync(timeout);
    }
  }
}
