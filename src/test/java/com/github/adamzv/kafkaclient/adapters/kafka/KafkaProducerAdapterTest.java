package com.github.adamzv.kafkaclient.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.ProblemCodes;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.ProduceResult;
import com.github.adamzv.kafkaclient.support.KafkaProperties;
import com.github.adamzv.kafkaclient.support.ProducerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class KafkaProducerAdapterTest {

  private static final ProducerProperties PROPERTIES = ProducerProperties.builder()
      .connection(KafkaProperties.of("localhost:9092"))
      .defaultTopic("orders")
      .build();

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    MDC.clear();
  }

  @Test
  void producesToDefaultTopicInInputOrder() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);

    List<ProduceResult> results = adapter.produce(
        CallContext.background(),
        KafkaRecord.of(null, "k1", "first"),
        KafkaRecord.of("payments", "k2", "second")
    );

    assertEquals(2, results.size());
    assertEquals("orders", results.get(0).topic());
    assertEquals("payments", results.get(1).topic());
    assertTrue(results.get(0).isSuccess());
    assertEquals(0L, results.get(0).offset());
    assertEquals(List.of("orders", "payments"), mock.history().stream().map(ProducerRecord::topic).toList());
    assertEquals(1.0, registry.counter(ClientMetrics.RECORDS_PRODUCED, "topic", "orders").count());
  }

  @Test
  void reportsBrokerRejectionPerRecord() throws Exception {
    MockProducer<byte[], byte[]> mock = mockProducer(false);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);

    Future<List<ProduceResult>> pending = executor.submit(() -> adapter.produce(
        CallContext.background(),
        KafkaRecord.of(null, null, "ok"),
        KafkaRecord.of(null, null, "too big")
    ));
    waitFor(() -> mock.history().size() == 2);
    assertTrue(mock.completeNext());
    assertTrue(mock.errorNext(new RecordTooLargeException("record too large")));

    List<ProduceResult> results = pending.get(5, TimeUnit.SECONDS);
    assertTrue(results.get(0).isSuccess());
    assertFalse(results.get(1).isSuccess());
    assertInstanceOf(RecordTooLargeException.class, results.get(1).error());
    assertEquals(-1L, results.get(1).offset());
    assertEquals(1.0, registry.counter(ClientMetrics.PRODUCE_ERRORS, "topic", "orders").count());
  }

  @Test
  void cancelledContextSendsNothing() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);
    CallContext ctx = CallContext.background().withCancel();
    ctx.cancel();

    List<ProduceResult> results = adapter.produce(ctx, KafkaRecord.of(null, null, "late"));

    assertEquals(1, results.size());
    ProblemException error = assertInstanceOf(ProblemException.class, results.get(0).error());
    assertEquals(ProblemCodes.CANCELLED, error.code());
    assertTrue(mock.history().isEmpty());
  }

  @Test
  void recordWithoutTopicFailsBeforeAnythingIsSent() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    ProducerProperties noDefault = ProducerProperties.builder()
        .connection(KafkaProperties.of("localhost:9092"))
        .build();
    KafkaProducerAdapter adapter = adapter(noDefault, mock);

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.produce(
        CallContext.background(),
        KafkaRecord.of("payments", null, "a"),
        KafkaRecord.of(null, null, "b")
    ));

    assertEquals(ProblemCodes.MISSING_TOPIC, exception.code());
    assertTrue(mock.history().isEmpty());
  }

  @Test
  void asyncCallbackRunsExactlyOnce() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);
    List<ProduceResult> seen = new CopyOnWriteArrayList<>();

    adapter.produceAsync(CallContext.background(), KafkaRecord.of(null, "k", "v"), seen::add);

    assertEquals(1, seen.size());
    assertTrue(seen.get(0).isSuccess());
  }

  @Test
  void asyncOnClosedProducerReportsThroughCallback() {
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mockProducer(true));
    adapter.close();
    List<ProduceResult> seen = new CopyOnWriteArrayList<>();

    adapter.produceAsync(CallContext.background(), KafkaRecord.of(null, "k", "v"), seen::add);

    assertEquals(1, seen.size());
    ProblemException error = assertInstanceOf(ProblemException.class, seen.get(0).error());
    assertEquals(ProblemCodes.CLIENT_CLOSED, error.code());
  }

  @Test
  void asyncRequiresCallback() {
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mockProducer(true));

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.produceAsync(CallContext.background(), KafkaRecord.of(null, null, "v"), null));
    assertEquals(ProblemCodes.NIL_HANDLER, exception.code());
  }

  @Test
  void nullContextIsRejected() {
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mockProducer(true));

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.produce(null, KafkaRecord.of(null, null, "v")));
    assertEquals(ProblemCodes.NIL_CONTEXT, exception.code());
  }

  @Test
  void producesJsonPayloads() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);

    ProduceResult result = adapter.produceJson(CallContext.background(), "", "order-1", Map.of("amount", 42));
    List<ProduceResult> many = adapter.produceJsonMany(CallContext.background(), List.of(1, 2), "text");

    assertTrue(result.isSuccess());
    assertEquals(2, many.size());
    assertEquals("{\"amount\":42}", new String(mock.history().get(0).value(), StandardCharsets.UTF_8));
    assertEquals("[1,2]", new String(mock.history().get(1).value(), StandardCharsets.UTF_8));
    assertEquals("\"text\"", new String(mock.history().get(2).value(), StandardCharsets.UTF_8));
  }

  @Test
  void unserializableJsonIsSerializationFailure() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);

    ProblemException exception = assertThrows(ProblemException.class,
        () -> adapter.produceJson(CallContext.background(), null, null, new Object()));

    assertEquals(ProblemCodes.SERIALIZATION_FAILED, exception.code());
    assertEquals("orders", exception.problem().details().get("topic"));
    assertTrue(mock.history().isEmpty());
  }

  @Test
  void copiesTraceIdentifiersFromMdc() {
    MockProducer<byte[], byte[]> mock = mockProducer(true);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);
    MDC.put(TraceHeaders.TRACE_ID_KEY, "trace-1");
    MDC.put(TraceHeaders.REQUEST_ID_KEY, "request-1");

    adapter.produce(
        CallContext.background(),
        KafkaRecord.of(null, null, "a"),
        KafkaRecord.builder().value("b").header(TraceHeaders.TRACE_ID_HEADER, "explicit").build()
    );

    ProducerRecord<byte[], byte[]> first = mock.history().get(0);
    ProducerRecord<byte[], byte[]> second = mock.history().get(1);
    assertEquals("trace-1", new String(first.headers().lastHeader(TraceHeaders.TRACE_ID_HEADER).value(), StandardCharsets.UTF_8));
    assertEquals("request-1", new String(first.headers().lastHeader(TraceHeaders.REQUEST_ID_HEADER).value(), StandardCharsets.UTF_8));
    assertEquals("explicit", new String(second.headers().lastHeader(TraceHeaders.TRACE_ID_HEADER).value(), StandardCharsets.UTF_8));
  }

  @Test
  void flushCompletesPendingSends() {
    MockProducer<byte[], byte[]> mock = mockProducer(false);
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);
    List<ProduceResult> seen = new CopyOnWriteArrayList<>();
    adapter.produceAsync(CallContext.background(), KafkaRecord.of(null, null, "v"), seen::add);
    assertTrue(seen.isEmpty());

    adapter.flush(CallContext.background().withTimeout(Duration.ofSeconds(5)));

    assertTrue(mock.flushed());
    assertEquals(1, seen.size());
  }

  @Test
  void closeIsIdempotentAndLaterCallsFail() {
    CountingProducer mock = new CountingProducer();
    KafkaProducerAdapter adapter = adapter(PROPERTIES, mock);

    adapter.close();
    adapter.close();

    assertEquals(1, mock.closes);
    assertFalse(adapter.isConnected());
    ProblemException produce = assertThrows(ProblemException.class,
        () -> adapter.produce(CallContext.background(), KafkaRecord.of(null, null, "v")));
    assertEquals(ProblemCodes.CLIENT_CLOSED, produce.code());
    ProblemException flush = assertThrows(ProblemException.class, () -> adapter.flush(CallContext.background()));
    assertEquals(ProblemCodes.CLIENT_CLOSED, flush.code());
  }

  @Test
  void rejectsInvalidConfiguration() {
    ProducerProperties invalid = ProducerProperties.builder()
        .connection(KafkaProperties.of("localhost:9092"))
        .compression("brotli")
        .build();

    ProblemException exception = assertThrows(ProblemException.class, () -> adapter(invalid, mockProducer(true)));
    assertEquals(ProblemCodes.INVALID_COMPRESSION, exception.code());
    ProblemException nil = assertThrows(ProblemException.class, () -> adapter(null, mockProducer(true)));
    assertEquals(ProblemCodes.NIL_CONFIG, nil.code());
  }

  private KafkaProducerAdapter adapter(ProducerProperties properties, MockProducer<byte[], byte[]> mock) {
    return new KafkaProducerAdapter(properties, mock, null, registry, null);
  }

  static MockProducer<byte[], byte[]> mockProducer(boolean autoComplete) {
    return new MockProducer<>(autoComplete, new ByteArraySerializer(), new ByteArraySerializer());
  }

  static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 5s");
      }
      Thread.sleep(10);
    }
  }

  private static final class CountingProducer extends MockProducer<byte[], byte[]> {
    private int closes;

    private CountingProducer() {
      super(true, new ByteArraySerializer(), new ByteArraySerializer());
    }

    @Override
    public void close(Duration timeout) {
      closes++;
      super.close(timeout);
    }
  }
}
