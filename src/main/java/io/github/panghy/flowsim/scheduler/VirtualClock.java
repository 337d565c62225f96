package io.github.panghy.flowsim.scheduler;

import io.github.panghy.flowsim.core.SimPromise;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Monotonic simulated clock with its timer queue.
 *
 * <p>Time only moves through {@link #advanceTo(SimInstant)}, which the orchestrator calls
 * once the ready queue has drained. Timers are kept sorted by deadline and then by
 * handle, which is the order in which {@code advanceTo} hands them back.</p>
 */
public class VirtualClock {

  private SimInstant now = SimInstant.ZERO;
  private long nextHandle = 1;
  private final TreeSet<TimerEntry> timers = new TreeSet<>();
  private final Map<TimerHandle, TimerEntry> byHandle = new HashMap<>();

  /**
   * Gets the current simulated instant.
   *
   * @return The current instant
   */
  public SimInstant now() {
    return now;
  }

  /**
   * Schedules a timer {@code delay} after the current instant. A zero or negative delay
   * schedules the timer at the current instant; it fires on the next advance.
   *
   * @param delay   The delay
   * @param owner   The task to wake
   * @param promise Completed when the timer fires
   * @return The handle of the new timer
   */
  public TimerHandle schedule(Duration delay, Task owner, SimPromise<Void> promise) {
    SimInstant deadline = delay.isNegative() ? now : now.plus(delay);
    TimerHandle handle = new TimerHandle(nextHandle++);
    TimerEntry entry = new TimerEntry(handle, deadline, owner, promise);
    timers.add(entry);
    byHandle.put(handle, entry);
    owner.registerTimer(handle);
    return handle;
  }

  /**
   * Cancels a timer. Cancelling a fired or unknown timer does nothing.
   *
   * @param handle The timer to cancel
   * @return true if a pending timer was removed
   */
  public boolean cancel(TimerHandle handle) {
    TimerEntry entry = byHandle.remove(handle);
    if (entry == null) {
      return false;
    }
    timers.remove(entry);
    entry.getOwner().unregisterTimer(handle);
    return true;
  }

  /**
   * Returns the earliest pending deadline.
   *
   * @return The next deadline, or empty when no timer is pending
   */
  public Optional<SimInstant> nextDeadline() {
    return timers.isEmpty() ? Optional.empty() : Optional.of(timers.first().getDeadline());
  }

  /**
   * Moves the clock to {@code instant} and removes every timer whose deadline has been
   * reached. The caller fires the returned entries once it has applied the other events
   * due at this instant.
   *
   * @param instant The target instant
   * @return The due timers, in deadline order and then creation order
   * @throws IllegalArgumentException if {@code instant} lies in the past
   */
  public List<TimerEntry> advanceTo(SimInstant instant) {
    if (instant.isBefore(now)) {
      throw new IllegalArgumentException("Cannot move time backwards (current: " +
          now + ", target: " + instant + ")");
    }
    now = instant;
    List<TimerEntry> due = new ArrayList<>();
    while (!timers.isEmpty() && !timers.first().getDeadline().isAfter(instant)) {
      TimerEntry entry = timers.pollFirst();
      byHandle.remove(entry.getHandle());
      entry.getOwner().unregisterTimer(entry.getHandle());
      due.add(entry);
    }
    return due;
  }

  /**
   * Gets the number of pending timers.
   *
   * @return The pending timer count
   */
  public int pendingTimers() {
    return timers.size();
  }
}
