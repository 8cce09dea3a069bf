package com.github.adamzv.kafkaclient.support;

import java.util.Locale;
import java.util.Optional;

public enum Compression {
  NONE,
  GZIP,
  SNAPPY,
  LZ4,
  ZSTD;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Compression> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(NONE);
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (Compression compression : values()) {
      if (compression.value().equals(normalized)) {
        return Optional.of(compression);
      }
    }
    return Optional.empty();
  }
}
