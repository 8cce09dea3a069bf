package com.github.adamzv.kafkaclient.domain;

public record PartitionAssignment(
    String topic,
    int partition
) {
}
