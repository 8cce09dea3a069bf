package com.github.adamzv.kafkaclient.domain;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Outbound message. Instances are immutable; build them with {@link #builder()}.
 *
 * <p>An empty topic means "use the producer's default topic". A partition of {@code -1} lets
 * the client's partitioner choose, and a timestamp of {@code 0} lets the broker assign one.
 */
public final class KafkaRecord {

  public static final int AUTO_PARTITION = -1;

  private final String topic;
  private final byte[] key;
  private final byte[] value;
  private final List<Header> headers;
  private final int partition;
  private final long timestamp;

  private KafkaRecord(Builder builder) {
    this.topic = builder.topic == null ? "" : builder.topic;
    this.key = builder.key;
    this.value = builder.value;
    this.headers = List.copyOf(builder.headers);
    this.partition = builder.partition;
    this.timestamp = builder.timestamp;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static KafkaRecord of(String topic, String key, String value) {
    return builder().topic(topic).key(key).value(value).build();
  }

  public String topic() {
    return topic;
  }

  public byte[] key() {
    return key;
  }

  public byte[] value() {
    return value;
  }

  public List<Header> headers() {
    return headers;
  }

  public int partition() {
    return partition;
  }

  public long timestamp() {
    return timestamp;
  }

  public String keyAsString() {
    return key == null ? null : new String(key, StandardCharsets.UTF_8);
  }

  public String valueAsString() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  public boolean hasHeader(String headerKey) {
    return headers.stream().anyMatch(header -> header.key().equals(headerKey));
  }

  public Builder toBuilder() {
    Builder builder = new Builder()
        .topic(topic)
        .key(key)
        .value(value)
        .partition(partition)
        .timestamp(timestamp);
    builder.headers.addAll(headers);
    return builder;
  }

  @Override
  public String toString() {
    return "KafkaRecord[topic=" + topic
        + ", partition=" + partition
        + ", key=" + keyAsString()
        + ", valueBytes=" + (value == null ? 0 : value.length)
        + ", headers=" + headers.size()
        + "]";
  }

  public static final class Builder {

    private String topic;
    private byte[] key;
    private byte[] value;
    private final List<Header> headers = new ArrayList<>();
    private int partition = AUTO_PARTITION;
    private long timestamp;

    private Builder() {
    }

    public Builder topic(String topic) {
      this.topic = topic;
      return this;
    }

    public Builder key(byte[] key) {
      this.key = key == null ? null : key.clone();
      return this;
    }

    public Builder key(String key) {
      this.key = key == null ? null : key.getBytes(StandardCharsets.UTF_8);
      return this;
    }

    public Builder value(byte[] value) {
      this.value = value == null ? null : value.clone();
      return this;
    }

    public Builder value(String value) {
      this.value = value == null ? null : value.getBytes(StandardCharsets.UTF_8);
      return this;
    }

    public Builder header(String key, byte[] value) {
      headers.add(new Header(key, value == null ? null : value.clone()));
      return this;
    }

    public Builder header(String key, String value) {
      headers.add(Header.of(key, value));
      return this;
    }

    public Builder partition(int partition) {
      if (partition < AUTO_PARTITION) {
        throw Problems.invalidArgument(
            "Partition must be -1 (auto) or non-negative",
            java.util.Map.of("partition", partition)
        );
      }
      this.partition = partition;
      return this;
    }

    public Builder timestamp(long timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public KafkaRecord build() {
      return new KafkaRecord(this);
    }
  }
}
