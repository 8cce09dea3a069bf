package com.github.adamzv.kafkaclient.domain;

import java.util.List;
import java.util.Map;

/**
 * Records fetched for one topic partition in one poll, in ascending offset order.
 */
public record Batch(
    String topic,
    int partition,
    List<ConsumedRecord> records
) {

  public Batch {
    records = records == null ? List.of() : List.copyOf(records);
    long previous = -1L;
    for (ConsumedRecord record : records) {
      if (!record.topic().equals(topic) || record.partition() != partition) {
        throw Problems.invalidArgument(
            "Batch records must share topic and partition",
            Map.of("topic", topic, "partition", partition,
                "recordTopic", record.topic(), "recordPartition", record.partition())
        );
      }
      if (record.offset() <= previous) {
        throw Problems.invalidArgument(
            "Batch offsets must be strictly increasing",
            Map.of("topic", topic, "partition", partition, "offset", record.offset())
        );
      }
      previous = record.offset();
    }
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public ConsumedRecord lastRecord() {
    return records.isEmpty() ? null : records.get(records.size() - 1);
  }

  public long firstOffset() {
    return records.isEmpty() ? -1L : records.get(0).offset();
  }

  public long lastOffset() {
    return records.isEmpty() ? -1L : lastRecord().offset();
  }
}
