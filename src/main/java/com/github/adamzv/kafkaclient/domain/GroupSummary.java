package com.github.adamzv.kafkaclient.domain;

public record GroupSummary(
    String groupId,
    String state,
    String protocolType
) {}
