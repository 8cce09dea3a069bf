package com.github.adamzv.kafkaclient.support;

import com.github.adamzv.kafkaclient.domain.Problems;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Producer settings.
 *
 * @param batchMaxRecords maximum number of records a single produce call keeps in flight,
 *     {@code 0} for no limit
 * @param batchMaxBytes per-partition batch size in bytes, {@code 0} for the client default
 * @param linger time a partition batch waits for more records before it is sent
 */
public record ProducerProperties(
    @Valid @NotNull(message = "connection must be set")
    KafkaProperties connection,
    String defaultTopic,
    String transactionalId,
    String acks,
    String compression,
    int batchMaxRecords,
    int batchMaxBytes,
    Duration linger,
    boolean idempotent
) {

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Connection first, then acks, then compression. Transactional and idempotent producers need
   * acks from all replicas, so an explicit weaker level is rejected.
   */
  public void validate() {
    if (connection == null) {
      throw Problems.nilConfig();
    }
    connection.validate();
    Acks resolvedAcks = Acks.parse(acks).orElseThrow(() -> Problems.invalidAcks(acks));
    Compression.parse(compression).orElseThrow(() -> Problems.invalidCompression(compression));
    if ((isTransactional() || idempotent) && !KafkaProperties.isBlank(acks) && resolvedAcks != Acks.ALL) {
      throw Problems.invalidAcks(acks);
    }
  }

  public boolean isTransactional() {
    return !KafkaProperties.isBlank(transactionalId);
  }

  /**
   * Transactional and idempotent producers default to {@link Acks#ALL}.
   */
  public Acks resolvedAcks() {
    if (KafkaProperties.isBlank(acks) && (isTransactional() || idempotent)) {
      return Acks.ALL;
    }
    return Acks.parse(acks).orElseThrow(() -> Problems.invalidAcks(acks));
  }

  public Compression resolvedCompression() {
    return Compression.parse(compression).orElseThrow(() -> Problems.invalidCompression(compression));
  }

  public String defaultTopicOrEmpty() {
    return defaultTopic == null ? "" : defaultTopic.trim();
  }

  public static final class Builder {
    private KafkaProperties connection;
    private String defaultTopic;
    private String transactionalId;
    private String acks;
    private String compression;
    private int batchMaxRecords;
    private int batchMaxBytes;
    private Duration linger;
    private boolean idempotent;

    private Builder() {
    }

    public Builder connection(KafkaProperties connection) {
      this.connection = connection;
      return this;
    }

    public Builder defaultTopic(String defaultTopic) {
      this.defaultTopic = defaultTopic;
      return this;
    }

    public Builder transactionalId(String transactionalId) {
      this.transactionalId = transactionalId;
      return this;
    }

    public Builder acks(String acks) {
      this.acks = acks;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder batchMaxRecords(int batchMaxRecords) {
      this.batchMaxRecords = batchMaxRecords;
      return this;
    }

    public Builder batchMaxBytes(int batchMaxBytes) {
      this.batchMaxBytes = batchMaxBytes;
      return this;
    }

    public Builder linger(Duration linger) {
      this.linger = linger;
      return this;
    }

    public Builder idempotent(boolean idempotent) {
      this.idempotent = idempotent;
      return this;
    }

    public ProducerProperties build() {
      return new ProducerProperties(connection, defaultTopic, transactionalId, acks, compression,
          batchMaxRecords, batchMaxBytes, linger, idempotent);
    }
  }
}
