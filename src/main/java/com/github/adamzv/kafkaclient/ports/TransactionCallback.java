package com.github.adamzv.kafkaclient.ports;

@FunctionalInterface
public interface TransactionCallback {

  void execute(Transaction transaction) throws Exception;
}
