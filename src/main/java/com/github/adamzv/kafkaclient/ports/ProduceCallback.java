package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.ProduceResult;

@FunctionalInterface
public interface ProduceCallback {

  void onCompletion(ProduceResult result);
}
