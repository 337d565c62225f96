package io.github.panghy.flowsim.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A value that becomes available at some point of simulated time.
 *
 * <p>SimFuture is the suspension primitive of the simulation. Host logic never blocks;
 * it registers continuations with {@link #map}, {@link #flatMap}, {@link #handle},
 * {@link #whenComplete} or {@link #exceptionally}. Each continuation is bound to the task
 * that registered it and, when this future completes, is queued on the cooperative
 * scheduler rather than run inline. A task whose continuations are all waiting on
 * incomplete futures is suspended.</p>
 *
 * <p>Listeners are kept in registration order, so completing a future wakes its waiters
 * in a deterministic order. Instances are not thread-safe: a simulation is driven by a
 * single thread.</p>
 *
 * @param <T> The type of value this future holds
 */
public class SimFuture<T> {

  private enum State {
    PENDING,
    SUCCEEDED,
    FAILED,
    CANCELLED
  }

  private final Dispatcher dispatcher;
  private final SimPromise<T> promise;
  private final List<Runnable> callbacks = new ArrayList<>();
  private State state = State.PENDING;
  private T value;
  private Throwable exception;
  private Runnable cancelHook;

  /**
   * Creates a new pending future whose continuations go through the given dispatcher.
   *
   * @param dispatcher The dispatcher for continuations
   */
  public SimFuture(Dispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
    this.promise = new SimPromise<>(this);
  }

  /**
   * Creates a future that is already completed with the given value.
   *
   * @param dispatcher The dispatcher for continuations
   * @param value      The value
   * @param <U>        The type of the value
   * @return A completed future
   */
  public static <U> SimFuture<U> completed(Dispatcher dispatcher, U value) {
    SimFuture<U> future = new SimFuture<>(dispatcher);
    future.complete(value);
    return future;
  }

  /**
   * Creates a future that is already completed exceptionally.
   *
   * @param dispatcher The dispatcher for continuations
   * @param exception  The failure
   * @param <U>        The type of the future
   * @return A failed future
   */
  public static <U> SimFuture<U> failed(Dispatcher dispatcher, Throwable exception) {
    SimFuture<U> future = new SimFuture<>(dispatcher);
    future.completeExceptionally(exception);
    return future;
  }

  /**
   * Returns a future that completes with all values, in input order, once every given
   * future has succeeded. The first failure fails the result.
   *
   * @param dispatcher The dispatcher for continuations of the result
   * @param futures    The futures to combine
   * @param <U>        The value type
   * @return The combined future
   */
  public static <U> SimFuture<List<U>> allOf(Dispatcher dispatcher, Collection<SimFuture<U>> futures) {
    SimFuture<List<U>> result = new SimFuture<>(dispatcher);
    if (futures.isEmpty()) {
      result.complete(new ArrayList<>());
      return result;
    }
    List<U> values = new ArrayList<>(futures.size());
    int[] remaining = {futures.size()};
    int index = 0;
    for (SimFuture<U> future : futures) {
      int slot = index++;
      values.add(null);
      future.addCallback(() -> {
        if (result.isDone()) {
          return;
        }
        if (future.state == State.SUCCEEDED) {
          values.set(slot, future.value);
          if (--remaining[0] == 0) {
            result.complete(values);
          }
        } else {
          result.completeExceptionally(future.exception);
        }
      });
    }
    return result;
  }

  boolean complete(T newValue) {
    if (state != State.PENDING) {
      return false;
    }
    value = newValue;
    state = State.SUCCEEDED;
    fireCallbacks();
    return true;
  }

  boolean completeExceptionally(Throwable failure) {
    Objects.requireNonNull(failure, "Exception cannot be null");
    if (state != State.PENDING) {
      return false;
    }
    exception = failure;
    state = failure instanceof CancellationException ? State.CANCELLED : State.FAILED;
    fireCallbacks();
    return true;
  }

  private void fireCallbacks() {
    cancelHook = null;
    List<Runnable> toRun = new ArrayList<>(callbacks);
    callbacks.clear();
    for (Runnable callback : toRun) {
      callback.run();
    }
  }

  /**
   * Returns the promise that completes this future.
   *
   * @return The promise
   */
  public SimPromise<T> getPromise() {
    return promise;
  }

  /**
   * Gets the dispatcher continuations of this future go through.
   *
   * @return The dispatcher
   */
  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  /**
   * Installs the hook that releases the wake registration behind this future (a timer,
   * a receive waiter) and registers the future with the current task, so that cancelling
   * the future or terminating the task removes the registration.
   *
   * @param hook The hook to run on cancellation
   * @return This future
   */
  public SimFuture<T> onCancel(Runnable hook) {
    if (state == State.PENDING) {
      this.cancelHook = hook;
      dispatcher.register(this);
    }
    return this;
  }

  /**
   * Cancels this future if it is still pending. Waiters observe a
   * {@link CancellationException}, then the cancellation hook runs synchronously. For a
   * future derived with {@link #map}, {@link #flatMap}, {@link #handle} or
   * {@link #exceptionally}, the hook cancels the future it is waiting on, so cancelling the
   * end of a chain releases the primitive at its head.
   *
   * @return true if this call cancelled the future
   */
  public boolean cancel() {
    if (state != State.PENDING) {
      return false;
    }
    Runnable hook = cancelHook;
    completeExceptionally(new CancellationException("Future was cancelled"));
    if (hook != null) {
      hook.run();
    }
    return true;
  }

  private <R> SimFuture<R> derived() {
    SimFuture<R> result = new SimFuture<>(dispatcher);
    result.cancelHook = this::cancel;
    return result;
  }

  /**
   * Adds a runtime callback that runs inline as soon as this future completes (or
   * immediately if it already has). Intended for runtime plumbing; host logic should
   * use the dispatched combinators.
   *
   * @param callback The callback
   */
  public void addCallback(Runnable callback) {
    if (state == State.PENDING) {
      callbacks.add(callback);
    } else {
      callback.run();
    }
  }

  /**
   * Attaches a continuation invoked with the value or the failure.
   *
   * @param action The action to invoke
   * @return This future
   */
  public SimFuture<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
    Runnable bound = dispatcher.bind(() -> action.accept(value, exception));
    addCallback(bound);
    return this;
  }

  /**
   * Maps the value of this future once it completes.
   *
   * @param mapper The function to apply to the value
   * @param <R>    The type of the result
   * @return A future of the mapped value
   */
  public <R> SimFuture<R> map(Function<? super T, ? extends R> mapper) {
    SimFuture<R> result = derived();
    Runnable bound = dispatcher.bind(() -> {
      if (state != State.SUCCEEDED) {
        result.completeExceptionally(exception);
        return;
      }
      try {
        result.complete(mapper.apply(value));
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    addCallback(bound);
    return result;
  }

  /**
   * Chains another asynchronous step after this future.
   *
   * @param mapper A function producing the next future
   * @param <R>    The type of the result
   * @return A future completing with the next step's result
   */
  public <R> SimFuture<R> flatMap(Function<? super T, ? extends SimFuture<R>> mapper) {
    SimFuture<R> result = new SimFuture<>(dispatcher);
    List<SimFuture<R>> inner = new ArrayList<>(1);
    result.cancelHook = () -> {
      if (inner.isEmpty()) {
        cancel();
      } else {
        inner.get(0).cancel();
      }
    };
    Runnable bound = dispatcher.bind(() -> {
      if (state != State.SUCCEEDED) {
        result.completeExceptionally(exception);
        return;
      }
      try {
        SimFuture<R> next = Objects.requireNonNull(mapper.apply(value), "flatMap returned null");
        inner.add(next);
        next.addCallback(() -> result.completeFrom(next));
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    addCallback(bound);
    return result;
  }

  /**
   * Handles both outcomes of this future, producing a new value.
   *
   * @param handler Receives the value (or null) and the failure (or null)
   * @param <R>     The type of the result
   * @return A future of the handler's result
   */
  public <R> SimFuture<R> handle(BiFunction<? super T, Throwable, ? extends R> handler) {
    SimFuture<R> result = derived();
    Runnable bound = dispatcher.bind(() -> {
      try {
        result.complete(handler.apply(value, exception));
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    addCallback(bound);
    return result;
  }

  /**
   * Recovers from a failure of this future.
   *
   * @param recovery Maps the failure to a replacement value
   * @return A future of the value or the recovered value
   */
  public SimFuture<T> exceptionally(Function<Throwable, ? extends T> recovery) {
    SimFuture<T> result = derived();
    Runnable bound = dispatcher.bind(() -> {
      if (state == State.SUCCEEDED) {
        result.complete(value);
        return;
      }
      try {
        result.complete(recovery.apply(exception));
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    addCallback(bound);
    return result;
  }

  /**
   * Completes this future with the outcome of another, already completed, future.
   *
   * @param other The completed future to copy
   * @return true if this future changed state
   */
  public boolean completeFrom(SimFuture<? extends T> other) {
    if (!other.isDone()) {
      throw new IllegalStateException("Source future is not complete");
    }
    if (other.state == State.SUCCEEDED) {
      return complete(other.value);
    }
    return completeExceptionally(other.exception);
  }

  /**
   * Checks if this future is completed (either successfully or with an exception).
   *
   * @return true if completed
   */
  public boolean isDone() {
    return state != State.PENDING;
  }

  /**
   * Checks if this future completed with a failure or was cancelled.
   *
   * @return true if completed exceptionally
   */
  public boolean isCompletedExceptionally() {
    return state == State.FAILED || state == State.CANCELLED;
  }

  /**
   * Checks if this future was cancelled.
   *
   * @return true if cancelled
   */
  public boolean isCancelled() {
    return state == State.CANCELLED;
  }

  /**
   * Returns the failure of this future.
   *
   * @return The exception
   * @throws IllegalStateException if the future did not complete exceptionally
   */
  public Throwable getException() {
    if (!isCompletedExceptionally()) {
      throw new IllegalStateException("Future did not complete exceptionally");
    }
    return exception;
  }

  /**
   * Returns the value of this completed future.
   *
   * @return The value
   * @throws ExecutionException    if the future completed exceptionally
   * @throws IllegalStateException if the future is not done
   */
  public T getNow() throws ExecutionException {
    switch (state) {
      case SUCCEEDED:
        return value;
      case PENDING:
        throw new IllegalStateException("Future is not complete");
      default:
        throw new ExecutionException(exception);
    }
  }

  @Override
  public String toString() {
    return "SimFuture{" + state + "}";
  }
}
