package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.Batch;
import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.ConsumedRecord;
import com.github.adamzv.kafkaclient.domain.FetchResult;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;

/**
 * Long-lived consumer. The consume loops return normally on cancellation or when the consumer
 * is closed, and rethrow the first handler or fetch failure otherwise.
 */
public interface KafkaConsumerPort extends AutoCloseable {

  FetchResult poll(CallContext ctx) throws ProblemException;

  List<ConsumedRecord> pollRecords(CallContext ctx, int maxRecords) throws ProblemException;

  ConsumedRecord readRecord(CallContext ctx) throws ProblemException;

  void consume(CallContext ctx, RecordHandler handler) throws ProblemException;

  void consumeBatches(CallContext ctx, BatchHandler handler) throws ProblemException;

  void consumeFetches(CallContext ctx, FetchHandler handler) throws ProblemException;

  void consumeChannel(CallContext ctx, BlockingQueue<ConsumedRecord> channel) throws ProblemException;

  void commitOffsets(CallContext ctx) throws ProblemException;

  void commitRecord(CallContext ctx, ConsumedRecord record) throws ProblemException;

  void commitBatch(CallContext ctx, Batch batch) throws ProblemException;

  void pause(String... topics) throws ProblemException;

  void resume(String... topics) throws ProblemException;

  void pausePartitions(Map<String, ? extends Collection<Integer>> partitions) throws ProblemException;

  void resumePartitions(Map<String, ? extends Collection<Integer>> partitions) throws ProblemException;

  Set<String> pausedTopics();

  boolean isConnected();

  @Override
  void close();
}
