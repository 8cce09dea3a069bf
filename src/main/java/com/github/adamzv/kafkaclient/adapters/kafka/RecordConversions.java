package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.Batch;
import com.github.adamzv.kafkaclient.domain.ConsumedRecord;
import com.github.adamzv.kafkaclient.domain.FetchError;
import com.github.adamzv.kafkaclient.domain.FetchResult;
import com.github.adamzv.kafkaclient.domain.Header;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.Problems;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.internals.RecordHeader;

/**
 * Mapping between the facade's message model and kafka-clients records.
 */
public final class RecordConversions {

  private RecordConversions() {
  }

  /**
   * Builds the outbound client record. The record's topic wins over {@code defaultTopic}; a
   * negative partition and a zero timestamp are left for the client and broker to assign.
   */
  public static ProducerRecord<byte[], byte[]> toProducerRecord(KafkaRecord record, String defaultTopic) {
    if (record == null) {
      throw Problems.invalidArgument("Record must not be null", Map.of());
    }
    String topic = record.topic().isEmpty() ? defaultTopic : record.topic();
    if (topic == null || topic.isBlank()) {
      throw Problems.missingTopic(Map.of("record", record.toString()));
    }
    List<org.apache.kafka.common.header.Header> headers = new ArrayList<>(record.headers().size());
    for (Header header : record.headers()) {
      headers.add(new RecordHeader(header.key(), copy(header.value())));
    }
    return new ProducerRecord<>(
        topic,
        record.partition() >= 0 ? record.partition() : null,
        record.timestamp() != 0L ? record.timestamp() : null,
        copy(record.key()),
        copy(record.value()),
        headers
    );
  }

  /**
   * Inverse of {@link #toProducerRecord}.
   */
  public static KafkaRecord fromProducerRecord(ProducerRecord<byte[], byte[]> record) {
    KafkaRecord.Builder builder = KafkaRecord.builder()
        .topic(record.topic())
        .key(copy(record.key()))
        .value(copy(record.value()))
        .partition(record.partition() == null ? KafkaRecord.AUTO_PARTITION : record.partition())
        .timestamp(record.timestamp() == null ? 0L : record.timestamp());
    for (org.apache.kafka.common.header.Header header : record.headers()) {
      builder.header(header.key(), copy(header.value()));
    }
    return builder.build();
  }

  public static ConsumedRecord toConsumedRecord(ConsumerRecord<byte[], byte[]> record) {
    List<Header> headers = new ArrayList<>();
    for (org.apache.kafka.common.header.Header header : record.headers()) {
      headers.add(new Header(header.key(), copy(header.value())));
    }
    return new ConsumedRecord(
        record.topic(),
        record.partition(),
        record.offset(),
        copy(record.key()),
        copy(record.value()),
        headers,
        record.timestamp(),
        record.leaderEpoch().orElse(ConsumedRecord.UNKNOWN_LEADER_EPOCH)
    );
  }

  /**
   * Errors first, then one batch per partition that returned records.
   */
  public static FetchResult toFetchResult(ConsumerRecords<byte[], byte[]> records, List<FetchError> errors) {
    List<Batch> batches = new ArrayList<>();
    if (records != null) {
      for (TopicPartition partition : records.partitions()) {
        List<ConsumerRecord<byte[], byte[]>> partitionRecords = records.records(partition);
        if (partitionRecords.isEmpty()) {
          continue;
        }
        List<ConsumedRecord> converted = new ArrayList<>(partitionRecords.size());
        for (ConsumerRecord<byte[], byte[]> record : partitionRecords) {
          converted.add(toConsumedRecord(record));
        }
        batches.add(new Batch(partition.topic(), partition.partition(), converted));
      }
    }
    return new FetchResult(batches, errors);
  }

  private static byte[] copy(byte[] bytes) {
    return bytes == null ? null : bytes.clone();
  }
}
