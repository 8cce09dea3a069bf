package com.github.adamzv.kafkaclient.support;

import com.github.adamzv.kafkaclient.domain.Problems;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consumer settings. Without a group the consumer is assigned every partition of its topics
 * and positions itself by {@code startOffset}; offsets cannot be committed in that mode.
 *
 * @param pollInterval length of one blocking poll slice; cancellation and close are observed
 *     between slices
 */
public record ConsumerProperties(
    @Valid @NotNull(message = "connection must be set")
    KafkaProperties connection,
    List<String> topics,
    String group,
    String startOffset,
    String isolationLevel,
    Duration sessionTimeout,
    Duration rebalanceTimeout,
    Duration heartbeatInterval,
    boolean autoCommit,
    Duration autoCommitInterval,
    int fetchMinBytes,
    int fetchMaxBytes,
    Duration fetchMaxWait,
    int maxPollRecords,
    Duration pollInterval
) {

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

  public ConsumerProperties {
    topics = topics == null
        ? List.of()
        : topics.stream().filter(Objects::nonNull).map(String::trim).filter(topic -> !topic.isEmpty()).toList();
  }

  public static Builder builder() {
    return new Builder();
  }

  public void validate() {
    if (connection == null) {
      throw Problems.nilConfig();
    }
    connection.validate();
    if (topics.isEmpty()) {
      throw Problems.missingTopic(Map.of());
    }
    StartOffset.parse(startOffset).orElseThrow(() -> Problems.invalidOffset(startOffset));
    IsolationLevel.parse(isolationLevel).orElseThrow(() -> Problems.invalidIsolation(isolationLevel));
    if (autoCommit && !hasGroup()) {
      throw Problems.missingGroup(Map.of("autoCommit", true));
    }
  }

  public boolean hasGroup() {
    return !KafkaProperties.isBlank(group);
  }

  public StartOffset resolvedStartOffset() {
    return StartOffset.parse(startOffset).orElseThrow(() -> Problems.invalidOffset(startOffset));
  }

  public IsolationLevel resolvedIsolationLevel() {
    return IsolationLevel.parse(isolationLevel).orElseThrow(() -> Problems.invalidIsolation(isolationLevel));
  }

  public Duration effectivePollInterval() {
    return KafkaProperties.positiveOr(pollInterval, DEFAULT_POLL_INTERVAL);
  }

  public static final class Builder {
    private KafkaProperties connection;
    private List<String> topics;
    private String group;
    private String startOffset;
    private String isolationLevel;
    private Duration sessionTimeout;
    private Duration rebalanceTimeout;
    private Duration heartbeatInterval;
    private boolean autoCommit;
    private Duration autoCommitInterval;
    private int fetchMinBytes;
    private int fetchMaxBytes;
    private Duration fetchMaxWait;
    private int maxPollRecords;
    private Duration pollInterval;

    private Builder() {
    }

    public Builder connection(KafkaProperties connection) {
      this.connection = connection;
      return this;
    }

    public Builder topics(String... topics) {
      this.topics = List.of(topics);
      return this;
    }

    public Builder topics(List<String> topics) {
      this.topics = topics;
      return this;
    }

    public Builder group(String group) {
      this.group = group;
      return this;
    }

    public Builder startOffset(String startOffset) {
      this.startOffset = startOffset;
      return this;
    }

    public Builder isolationLevel(String isolationLevel) {
      this.isolationLevel = isolationLevel;
      return this;
    }

    public Builder sessionTimeout(Duration sessionTimeout) {
      this.sessionTimeout = sessionTimeout;
      return this;
    }

    public Builder rebalanceTimeout(Duration rebalanceTimeout) {
      this.rebalanceTimeout = rebalanceTimeout;
      return this;
    }

    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    public Builder autoCommit(boolean autoCommit) {
      this.autoCommit = autoCommit;
      return this;
    }

    public Builder autoCommitInterval(Duration autoCommitInterval) {
      this.autoCommitInterval = autoCommitInterval;
      return this;
    }

    public Builder fetchMinBytes(int fetchMinBytes) {
      this.fetchMinBytes = fetchMinBytes;
      return this;
    }

    public Builder fetchMaxBytes(int fetchMaxBytes) {
      this.fetchMaxBytes = fetchMaxBytes;
      return this;
    }

    public Builder fetchMaxWait(Duration fetchMaxWait) {
      this.fetchMaxWait = fetchMaxWait;
      return this;
    }

    public Builder maxPollRecords(int maxPollRecords) {
      this.maxPollRecords = maxPollRecords;
      return this;
    }

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public ConsumerProperties build() {
      return new ConsumerProperties(connection, topics, group, startOffset, isolationLevel,
          sessionTimeout, rebalanceTimeout, heartbeatInterval, autoCommit, autoCommitInterval,
          fetchMinBytes, fetchMaxBytes, fetchMaxWait, maxPollRecords, pollInterval);
    }
  }
}
