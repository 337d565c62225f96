package io.github.panghy.flowsim.scheduler;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.simulation.HostId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * A suspendable unit of host logic.
 *
 * <p>A task is started by running its entry callable, which returns the task's root
 * future. The task completes or fails with that future. In between it is either queued
 * ({@link TaskState#READY}), executing a continuation ({@link TaskState#RUNNING}) or
 * waiting for a wake signal ({@link TaskState#SUSPENDED}).</p>
 */
public class Task {

  /**
   * Task state enum.
   */
  public enum TaskState {
    READY,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
      return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
  }

  private final long id;
  private final String name;
  private final HostId host;
  private final Callable<? extends SimFuture<?>> entry;
  private TaskState state = TaskState.READY;
  private int queuedContinuations;
  private Throwable failure;

  // Primitive futures holding a wake registration; cancelled when the task terminates
  private final Set<SimFuture<?>> registrations = new LinkedHashSet<>();
  private final Set<TimerHandle> timers = new LinkedHashSet<>();

  /**
   * Creates a new task.
   *
   * @param id    The task id, unique within a simulation
   * @param name  A descriptive name used in traces
   * @param host  The host owning the task
   * @param entry Produces the root future when the task starts
   */
  public Task(long id, String name, HostId host, Callable<? extends SimFuture<?>> entry) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "Name cannot be null");
    this.host = Objects.requireNonNull(host, "Host cannot be null");
    this.entry = Objects.requireNonNull(entry, "Entry cannot be null");
  }

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public HostId getHost() {
    return host;
  }

  Callable<? extends SimFuture<?>> getEntry() {
    return entry;
  }

  public TaskState getState() {
    return state;
  }

  void setState(TaskState state) {
    this.state = state;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }

  /**
   * Gets the error that failed this task.
   *
   * @return The failure, or null if the task has not failed
   */
  public Throwable getFailure() {
    return failure;
  }

  void setFailure(Throwable failure) {
    this.failure = failure;
  }

  int getQueuedContinuations() {
    return queuedContinuations;
  }

  void continuationQueued() {
    queuedContinuations++;
  }

  void continuationDequeued() {
    queuedContinuations--;
  }

  /**
   * Registers a primitive future holding a wake registration. The registration is
   * dropped as soon as the future completes.
   *
   * @param future The future to track
   */
  void register(SimFuture<?> future) {
    if (registrations.add(future)) {
      future.addCallback(() -> registrations.remove(future));
    }
  }

  /**
   * Cancels every outstanding registration of this task, in registration order.
   */
  void releaseRegistrations() {
    List<SimFuture<?>> pending = new ArrayList<>(registrations);
    registrations.clear();
    for (SimFuture<?> future : pending) {
      future.cancel();
    }
  }

  public int getRegistrationCount() {
    return registrations.size();
  }

  void registerTimer(TimerHandle handle) {
    timers.add(handle);
  }

  void unregisterTimer(TimerHandle handle) {
    timers.remove(handle);
  }

  /**
   * Gets the timers currently owned by this task.
   *
   * @return An unmodifiable view of the pending timer handles
   */
  public Set<TimerHandle> getTimerHandles() {
    return Collections.unmodifiableSet(timers);
  }

  @Override
  public String toString() {
    return "Task{" +
        "id=" + id +
        ", name='" + name + '\'' +
        ", host=" + host +
        ", state=" + state +
        '}';
  }
}
