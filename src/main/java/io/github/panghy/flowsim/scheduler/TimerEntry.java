package io.github.panghy.flowsim.scheduler;

import io.github.panghy.flowsim.core.SimPromise;

import java.util.Objects;

/**
 * A pending wake request held by the {@link VirtualClock}.
 * Entries order by deadline and then by handle, so equal deadlines fire in the order
 * the timers were scheduled.
 */
public class TimerEntry implements Comparable<TimerEntry> {

  private final TimerHandle handle;
  private final SimInstant deadline;
  private final Task owner;
  private final SimPromise<Void> promise;

  /**
   * Creates a new timer entry.
   *
   * @param handle   The handle identifying the timer
   * @param deadline The instant at which the timer fires
   * @param owner    The task the timer wakes
   * @param promise  Promise completed when the timer fires
   */
  public TimerEntry(TimerHandle handle, SimInstant deadline, Task owner, SimPromise<Void> promise) {
    this.handle = Objects.requireNonNull(handle, "Handle cannot be null");
    this.deadline = Objects.requireNonNull(deadline, "Deadline cannot be null");
    this.owner = Objects.requireNonNull(owner, "Every timer needs an owning task");
    this.promise = Objects.requireNonNull(promise, "Promise cannot be null");
  }

  public TimerHandle getHandle() {
    return handle;
  }

  public SimInstant getDeadline() {
    return deadline;
  }

  public Task getOwner() {
    return owner;
  }

  public SimPromise<Void> getPromise() {
    return promise;
  }

  /**
   * Fires this timer, waking the owning task.
   *
   * @return false if the timer's future was already completed or cancelled
   */
  public boolean fire() {
    return promise.complete(null);
  }

  @Override
  public int compareTo(TimerEntry other) {
    int result = deadline.compareTo(other.deadline);
    if (result != 0) {
      return result;
    }
    return Long.compare(handle.id(), other.handle.id());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return handle.equals(((TimerEntry) o).handle);
  }

  @Override
  public int hashCode() {
    return handle.hashCode();
  }

  @Override
  public String toString() {
    return "TimerEntry{" +
        "handle=" + handle +
        ", deadline=" + deadline +
        ", owner=" + owner.getId() +
        '}';
  }
}
