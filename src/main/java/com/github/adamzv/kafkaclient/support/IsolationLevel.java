package com.github.adamzv.kafkaclient.support;

import java.util.Locale;
import java.util.Optional;

public enum IsolationLevel {
  READ_UNCOMMITTED("read-uncommitted", "uncommitted", "read_uncommitted"),
  READ_COMMITTED("read-committed", "committed", "read_committed");

  private final String value;
  private final String alias;
  private final String kafkaValue;

  IsolationLevel(String value, String alias, String kafkaValue) {
    this.value = value;
    this.alias = alias;
    this.kafkaValue = kafkaValue;
  }

  public String value() {
    return value;
  }

  public String kafkaValue() {
    return kafkaValue;
  }

  /**
   * Blank input resolves to {@link #READ_COMMITTED}.
   */
  public static Optional<IsolationLevel> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(READ_COMMITTED);
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (IsolationLevel level : values()) {
      if (level.value.equals(normalized) || level.alias.equals(normalized)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }
}
