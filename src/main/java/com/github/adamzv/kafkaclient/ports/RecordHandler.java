package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.ConsumedRecord;

@FunctionalInterface
public interface RecordHandler {

  void handle(CallContext ctx, ConsumedRecord record) throws Exception;
}
