package com.github.adamzv.kafkaclient.support;

import jakarta.validation.Valid;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Spring binding root. Each section is optional; a client bean is created only for the
 * sections that name brokers.
 */
@Validated
@ConfigurationProperties(prefix = "kafka-client")
public record KafkaClientsProperties(
    @Valid ProducerProperties producer,
    @Valid ConsumerProperties consumer,
    @Valid KafkaProperties admin
) {}
