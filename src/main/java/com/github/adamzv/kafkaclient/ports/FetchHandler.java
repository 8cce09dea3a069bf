package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.FetchResult;

/**
 * Receives whole poll results, fetch errors included; the handler decides how to react.
 */
@FunctionalInterface
public interface FetchHandler {

  void handle(CallContext ctx, FetchResult fetches) throws Exception;
}
