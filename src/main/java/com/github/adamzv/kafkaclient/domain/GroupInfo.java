package com.github.adamzv.kafkaclient.domain;

import java.util.List;

public record GroupInfo(
    String groupId,
    String state,
    String protocolType,
    String protocol,
    List<GroupMember> members
) {
}
