package com.github.adamzv.kafkaclient.support;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Durability level demanded from the broker on produce.
 */
public enum Acks {
  NONE("none", "0", "0"),
  LEADER("leader", "1", "1", "one"),
  ALL("all", "all", "-1");

  private final String value;
  private final String kafkaValue;
  private final Set<String> aliases;

  Acks(String value, String kafkaValue, String... aliases) {
    this.value = value;
    this.kafkaValue = kafkaValue;
    this.aliases = Set.of(aliases);
  }

  public String value() {
    return value;
  }

  public String kafkaValue() {
    return kafkaValue;
  }

  public static Optional<Acks> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(LEADER);
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (Acks acks : values()) {
      if (acks.value.equals(normalized) || acks.aliases.contains(normalized)) {
        return Optional.of(acks);
      }
    }
    return Optional.empty();
  }
}
