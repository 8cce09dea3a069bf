package com.github.adamzv.kafkaclient.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation and deadline carrier passed to every blocking facade call.
 *
 * <p>Contexts form a tree: cancelling a context cancels all of its children, and a child's
 * deadline never outlives its parent's. The root returned by {@link #background()} is never
 * cancelled and has no deadline.
 *
 * <p>Listeners registered through {@link #onCancel(Runnable)} fire on explicit cancellation
 * only. Deadline expiry is observed by callers through {@link #isCancelled()} and
 * {@link #remaining(Duration)}.
 */
public final class CallContext {

  private static final CallContext BACKGROUND = new CallContext(false, 0L, false);

  private final boolean hasDeadline;
  private final long deadlineNanos;
  private final boolean cancellable;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private volatile Registration parentRegistration;

  private CallContext(boolean hasDeadline, long deadlineNanos, boolean cancellable) {
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
    this.cancellable = cancellable;
  }

  public static CallContext background() {
    return BACKGROUND;
  }

  public CallContext withCancel() {
    return child(hasDeadline, deadlineNanos);
  }

  public CallContext withTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative()) {
      throw Problems.invalidArgument("Timeout must be a non-negative duration", Map.of());
    }
    long candidate = System.nanoTime() + timeout.toNanos();
    if (hasDeadline && deadlineNanos - candidate < 0) {
      candidate = deadlineNanos;
    }
    return child(true, candidate);
  }

  private CallContext child(boolean childHasDeadline, long childDeadline) {
    CallContext child = new CallContext(childHasDeadline, childDeadline, true);
    if (this != BACKGROUND) {
      child.parentRegistration = onCancel(child::cancel);
    }
    return child;
  }

  /**
   * Cancels this context and its children. Calling it on {@link #background()} or on an already
   * cancelled context does nothing.
   */
  public void cancel() {
    if (!cancellable || !cancelled.compareAndSet(false, true)) {
      return;
    }
    Registration registration = parentRegistration;
    if (registration != null) {
      registration.close();
    }
    RuntimeException failure = null;
    for (Runnable listener : listeners) {
      // whoever removes the listener runs it; onCancel races with this loop
      if (!listeners.remove(listener)) {
        continue;
      }
      try {
        listener.run();
      } catch (RuntimeException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  public boolean isCancelled() {
    return cancelled.get() || isDeadlineExceeded();
  }

  public boolean isDeadlineExceeded() {
    return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
  }

  public boolean hasDeadline() {
    return hasDeadline;
  }

  /**
   * Time left before the deadline, capped at {@code cap}. Without a deadline the cap itself is
   * returned; past the deadline the result is {@link Duration#ZERO}.
   */
  public Duration remaining(Duration cap) {
    if (!hasDeadline) {
      return cap;
    }
    long left = Math.max(0L, deadlineNanos - System.nanoTime());
    Duration remaining = Duration.ofNanos(left);
    return cap == null || remaining.compareTo(cap) < 0 ? remaining : cap;
  }

  /**
   * Registers a listener fired once on cancellation. If the context is already cancelled the
   * listener runs immediately on the calling thread.
   */
  public Registration onCancel(Runnable listener) {
    if (!cancellable) {
      return Registration.NOOP;
    }
    if (cancelled.get()) {
      listener.run();
      return Registration.NOOP;
    }
    listeners.add(listener);
    if (cancelled.get() && listeners.remove(listener)) {
      listener.run();
      return Registration.NOOP;
    }
    return () -> listeners.remove(listener);
  }

  /**
   * Throws {@link ProblemCodes#CANCELLED} when the context is cancelled or past its deadline.
   */
  public void checkActive() {
    if (isCancelled()) {
      throw cancellationError();
    }
  }

  public ProblemException cancellationError() {
    if (cancelled.get()) {
      return Problems.cancelled("context cancelled");
    }
    return Problems.cancelled("context deadline exceeded");
  }

  @FunctionalInterface
  public interface Registration extends AutoCloseable {

    Registration NOOP = () -> { };

    @Override
    void close();
  }
}
