package com.github.adamzv.kafkaclient.domain;

import java.util.List;

public record GroupMember(
    String memberId,
    String clientId,
    String host,
    List<PartitionAssignment> assignments
) {
}
