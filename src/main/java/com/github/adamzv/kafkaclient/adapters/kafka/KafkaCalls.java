package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.CallContext;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import com.github.adamzv.kafkaclient.domain.Problems;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.GroupIdNotFoundException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;

/**
 * Waits on client futures within a {@link CallContext} and translates failures into problems.
 */
final class KafkaCalls {

  private static final Duration WAIT_SLICE = Duration.ofMillis(50);

  private final String bootstrapServers;

  KafkaCalls(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  /**
   * Blocks until the future completes or the context ends. The future is left running when the
   * context ends first.
   */
  <T> T await(Future<T> future, CallContext ctx, String operation, Map<String, Object> context) {
    try {
      return awaitRaw(future, ctx);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing " + operation, details(context, ex), ex);
    } catch (ExecutionException ex) {
      throw translate(operation, ex.getCause(), context);
    }
  }

  /**
   * Like {@link #await} but leaves execution failures untranslated, for callers that report
   * them per item.
   */
  <T> T awaitRaw(Future<T> future, CallContext ctx) throws InterruptedException, ExecutionException {
    while (!future.isDone()) {
      ctx.checkActive();
      if (completesWithin(future, ctx.remaining(WAIT_SLICE))) {
        break;
      }
    }
    return future.get();
  }

  private static boolean completesWithin(Future<?> future, Duration wait) throws InterruptedException {
    try {
      future.get(wait.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (TimeoutException ex) {
      return false;
    } catch (ExecutionException ex) {
      return true;
    }
  }

  ProblemException translate(String operation, Throwable cause, Map<String, Object> context) {
    if (cause instanceof ProblemException problem) {
      return problem;
    }
    Map<String, Object> details = details(context, cause);
    if (cause instanceof UnknownTopicOrPartitionException) {
      return Problems.notFound("Kafka topic not found during " + operation, details);
    }
    if (cause instanceof GroupIdNotFoundException) {
      return Problems.notFound("Consumer group not found during " + operation, details);
    }
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable("Kafka operation failed: " + operation, details, cause);
    }
    return Problems.operationFailed("Unexpected failure during " + operation, details, cause);
  }

  Map<String, Object> details(Map<String, Object> context, Throwable cause) {
    Map<String, Object> merged = new HashMap<>(context);
    merged.put("bootstrapServers", bootstrapServers);
    if (cause != null) {
      merged.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        merged.put("message", cause.getMessage());
      }
    }
    return Map.copyOf(merged);
  }
}
