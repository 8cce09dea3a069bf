package com.github.adamzv.kafkaclient.domain;

import java.util.Map;

/**
 * Machine readable failure raised by the client facades.
 *
 * @param code one of {@link ProblemCodes}
 * @param message human readable summary
 * @param details operation context (topic, partition, offset, bootstrap servers, ...)
 */
public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {

  public Problem {
    details = details == null ? Map.of() : details;
  }
}
