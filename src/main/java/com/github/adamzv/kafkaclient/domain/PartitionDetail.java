package com.github.adamzv.kafkaclient.domain;

import java.util.List;

/**
 * Broker placement of one partition. {@code leader} is {@code -1} while the partition has no
 * elected leader.
 */
public record PartitionDetail(
    int partition,
    int leader,
    List<Integer> replicas,
    List<Integer> isr
) {}
