package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.Batch;
import com.github.adamzv.kafkaclient.domain.CallContext;

@FunctionalInterface
public interface BatchHandler {

  void handle(CallContext ctx, Batch batch) throws Exception;
}
