package com.github.adamzv.kafkaclient.domain;

/**
 * Failure reported for a topic partition during a fetch. Errors that are not tied to a
 * partition carry an empty topic and partition {@code -1}.
 */
public record FetchError(
    String topic,
    int partition,
    Throwable error
) {

  public FetchError {
    topic = topic == null ? "" : topic;
  }

  public static FetchError global(Throwable error) {
    return new FetchError("", -1, error);
  }
}
