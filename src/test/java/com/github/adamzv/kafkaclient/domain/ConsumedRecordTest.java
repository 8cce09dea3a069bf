package com.github.adamzv.kafkaclient.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConsumedRecordTest {

  @Test
  void equalityComparesPayloadContent() {
    ConsumedRecord first = record("k", "v");
    ConsumedRecord second = record("k", "v");

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, record("k", "other"));
    assertEquals(record(null, null), record(null, null));
  }

  @Test
  void leaderEpochIsOptional() {
    assertEquals(Optional.empty(), record("k", "v").leaderEpochIfKnown());
  }

  private static ConsumedRecord record(String key, String value) {
    return new ConsumedRecord(
        "orders",
        0,
        7L,
        key == null ? null : key.getBytes(StandardCharsets.UTF_8),
        value == null ? null : value.getBytes(StandardCharsets.UTF_8),
        List.of(new Header("h", "x".getBytes(StandardCharsets.UTF_8))),
        1L,
        ConsumedRecord.UNKNOWN_LEADER_EPOCH
    );
  }
}
