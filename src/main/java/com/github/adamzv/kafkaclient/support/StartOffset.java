package com.github.adamzv.kafkaclient.support;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a consumer starts when it has no committed offset.
 */
public enum StartOffset {
  EARLIEST("earliest", "first"),
  LATEST("latest", "last");

  private final String value;
  private final String alias;

  StartOffset(String value, String alias) {
    this.value = value;
    this.alias = alias;
  }

  public String value() {
    return value;
  }

  public static Optional<StartOffset> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(LATEST);
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (StartOffset offset : values()) {
      if (offset.value.equals(normalized) || offset.alias.equals(normalized)) {
        return Optional.of(offset);
      }
    }
    return Optional.empty();
  }
}
