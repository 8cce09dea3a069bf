package com.github.adamzv.kafkaclient.domain;

import java.util.Map;

/**
 * Topic creation request.
 *
 * @param partitions partition count, {@code -1} for the broker default
 * @param replicationFactor replication factor, {@code -1} for the broker default
 * @param configs topic level overrides such as {@code cleanup.policy}
 */
public record TopicConfig(
    String name,
    int partitions,
    short replicationFactor,
    Map<String, String> configs
) {

  public TopicConfig {
    configs = configs == null ? Map.of() : Map.copyOf(configs);
  }

  public static TopicConfig of(String name, int partitions, int replicationFactor) {
    if (replicationFactor < -1 || replicationFactor > Short.MAX_VALUE) {
      throw Problems.invalidArgument(
          "replicationFactor must be -1 or between 0 and " + Short.MAX_VALUE,
          Map.of("topic", String.valueOf(name), "replicationFactor", replicationFactor)
      );
    }
    return new TopicConfig(name, partitions, (short) replicationFactor, Map.of());
  }
}
