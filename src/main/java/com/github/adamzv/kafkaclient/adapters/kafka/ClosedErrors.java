package com.github.adamzv.kafkaclient.adapters.kafka;

import com.github.adamzv.kafkaclient.domain.ProblemCodes;
import com.github.adamzv.kafkaclient.domain.ProblemException;
import java.io.EOFException;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.ClosedChannelException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;

/**
 * Recognizes failures that mean "the client or its connection went away" rather than a
 * broker-side error. Consume loops end quietly on these.
 */
public final class ClosedErrors {

  private static final List<String> CLOSED_MESSAGES = List.of(
      "use of closed network connection",
      "broken pipe",
      "connection reset by peer",
      "client closed"
  );

  private ClosedErrors() {
  }

  public static boolean isClosed(Throwable error) {
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
      if (isClosedType(current) || hasClosedMessage(current)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isClosedType(Throwable error) {
    if (error instanceof ProblemException problem) {
      return problem.hasCode(ProblemCodes.CLIENT_CLOSED) || problem.hasCode(ProblemCodes.CANCELLED);
    }
    return error instanceof EOFException
        || error instanceof ClosedChannelException
        || error instanceof AsynchronousCloseException
        || error instanceof WakeupException
        || error instanceof InterruptException
        || error instanceof CancellationException;
  }

  private static boolean hasClosedMessage(Throwable error) {
    String message = error.getMessage();
    if (message == null) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return CLOSED_MESSAGES.stream().anyMatch(normalized::contains);
  }
}
