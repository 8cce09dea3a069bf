package com.github.adamzv.kafkaclient.domain;

public record BrokerInfo(
    int id,
    String host,
    int port,
    String rack
) {}
