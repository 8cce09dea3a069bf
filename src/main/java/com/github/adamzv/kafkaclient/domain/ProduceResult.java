package com.github.adamzv.kafkaclient.domain;

/**
 * Per-record outcome of a produce call. A broker rejection is carried in {@code error}
 * instead of failing the whole call.
 */
public record ProduceResult(
    String topic,
    int partition,
    long offset,
    long timestamp,
    Throwable error
) {

  public static ProduceResult success(String topic, int partition, long offset, long timestamp) {
    return new ProduceResult(topic, partition, offset, timestamp, null);
  }

  public static ProduceResult failure(String topic, int partition, Throwable error) {
    return new ProduceResult(topic, partition, -1L, -1L, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
