package com.github.adamzv.kafkaclient.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one poll: per-partition batches plus the fetch errors reported alongside them.
 * A partition appears in at most one batch.
 */
public record FetchResult(
    List<Batch> batches,
    List<FetchError> errors
) {

  private static final FetchResult EMPTY = new FetchResult(List.of(), List.of());

  public FetchResult {
    batches = batches == null ? List.of() : List.copyOf(batches);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static FetchResult empty() {
    return EMPTY;
  }

  public static FetchResult ofError(FetchError error) {
    return new FetchResult(List.of(), List.of(error));
  }

  public int recordCount() {
    int count = 0;
    for (Batch batch : batches) {
      count += batch.size();
    }
    return count;
  }

  /**
   * All records flattened in batch order.
   */
  public List<ConsumedRecord> records() {
    List<ConsumedRecord> records = new ArrayList<>(recordCount());
    for (Batch batch : batches) {
      records.addAll(batch.records());
    }
    return List.copyOf(records);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public Throwable firstError() {
    return errors.isEmpty() ? null : errors.get(0).error();
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }
}
