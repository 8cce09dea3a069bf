package com.github.adamzv.kafkaclient.ports;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.KafkaRecord;
import com.github.adamzv.kafkaclient.domain.ProblemException;

/**
 * Transactional session owned by one producer. Records are buffered until {@link #commit}
 * publishes them atomically; exactly one of commit or abort completes the session.
 */
public interface Transaction {

  void produce(KafkaRecord record) throws ProblemException;

  void produceMany(KafkaRecord... records) throws ProblemException;

  void commit(CallContext ctx) throws ProblemException;

  /**
   * Drops the buffered records and aborts. A no-op once the transaction has finished.
   */
  void abort(CallContext ctx) throws ProblemException;

  boolean isFinished();

  boolean isAborted();

  int bufferedCount();
}
