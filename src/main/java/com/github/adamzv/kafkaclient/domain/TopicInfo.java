package com.github.adamzv.kafkaclient.domain;

import java.util.List;

public record TopicInfo(
    String name,
    boolean internal,
    List<PartitionDetail> partitions
) {

  public int partitionCount() {
    return partitions.size();
  }

  public short replicationFactor() {
    return partitions.isEmpty() ? 0 : (short) partitions.get(0).replicas().size();
  }
}
