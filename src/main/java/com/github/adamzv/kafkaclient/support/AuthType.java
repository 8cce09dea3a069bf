package com.github.adamzv.kafkaclient.support;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum AuthType {
  NONE("none"),
  PLAIN("plain"),
  SCRAM_256("scram-256", "scram256"),
  SCRAM_512("scram-512", "scram512"),
  AWS_MSK_IAM("aws-msk-iam"),
  OAUTH("oauth");

  private final String value;
  private final Set<String> aliases;

  AuthType(String value, String... aliases) {
    this.value = value;
    this.aliases = Set.of(aliases);
  }

  public String value() {
    return value;
  }

  public boolean usesSasl() {
    return this != NONE;
  }

  /**
   * Blank input resolves to {@link #NONE}; unknown values resolve to empty.
   */
  public static Optional<AuthType> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.of(NONE);
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (AuthType type : values()) {
      if (type.value.equals(normalized) || type.aliases.contains(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
