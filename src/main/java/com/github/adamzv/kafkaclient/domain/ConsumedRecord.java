package com.github.adamzv.kafkaclient.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inbound message with the broker metadata needed to commit it.
 *
 * @param leaderEpoch leader epoch reported by the fetch, {@code -1} when unknown
 */
public record ConsumedRecord(
    String topic,
    int partition,
    long offset,
    byte[] key,
    byte[] value,
    List<Header> headers,
    long timestamp,
    int leaderEpoch
) {

  public static final int UNKNOWN_LEADER_EPOCH = -1;

  public ConsumedRecord {
    headers = headers == null ? List.of() : List.copyOf(headers);
  }

  public String keyAsString() {
    return key == null ? null : new String(key, StandardCharsets.UTF_8);
  }

  public String valueAsString() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  public Optional<Header> header(String headerKey) {
    return headers.stream().filter(header -> header.key().equals(headerKey)).findFirst();
  }

  public Optional<Integer> leaderEpochIfKnown() {
    return leaderEpoch < 0 ? Optional.empty() : Optional.of(leaderEpoch);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ConsumedRecord that)) {
      return false;
    }
    return partition == that.partition
        && offset == that.offset
        && timestamp == that.timestamp
        && leaderEpoch == that.leaderEpoch
        && Objects.equals(topic, that.topic)
        && Arrays.equals(key, that.key)
        && Arrays.equals(value, that.value)
        && headers.equals(that.headers);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(topic, partition, offset, headers, timestamp, leaderEpoch);
    result = 31 * result + Arrays.hashCode(key);
    return 31 * result + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "ConsumedRecord[topic=" + topic + ", partition=" + partition + ", offset=" + offset
        + ", key=" + keyAsString() + ", headers=" + headers + ", timestamp=" + timestamp
        + ", leaderEpoch=" + leaderEpoch + "]";
  }
}
