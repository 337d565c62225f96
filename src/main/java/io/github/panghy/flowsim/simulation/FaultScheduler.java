package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.SimInstant;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * A time-ordered queue of faults waiting to be applied.
 *
 * <p>Faults come out of {@link #due(SimInstant)} ordered by scheduled instant, then by
 * the order they were scheduled in.</p>
 */
public class FaultScheduler {

  private final TreeSet<ScheduledFault> queue = new TreeSet<>();
  private long nextSeq = 1;

  /**
   * Schedules a fault at an absolute instant.
   *
   * @param instant The instant
   * @param fault   The fault
   * @return The queued entry
   */
  public ScheduledFault scheduleAt(SimInstant instant, Fault fault) {
    ScheduledFault entry = new ScheduledFault(
        Objects.requireNonNull(instant, "Instant cannot be null"),
        nextSeq++,
        Objects.requireNonNull(fault, "Fault cannot be null"));
    queue.add(entry);
    return entry;
  }

  /**
   * Schedules a fault relative to an instant. A negative delay schedules it at
   * {@code current}.
   *
   * @param current The reference instant, usually now
   * @param delay   The delay
   * @param fault   The fault
   * @return The queued entry
   */
  public ScheduledFault scheduleAfter(SimInstant current, Duration delay, Fault fault) {
    return scheduleAt(delay.isNegative() ? current : current.plus(delay), fault);
  }

  /**
   * Removes and returns every fault scheduled at or before the instant.
   *
   * @param instant The instant
   * @return The due faults, in order
   */
  public List<Fault> due(SimInstant instant) {
    List<Fault> due = new ArrayList<>();
    while (!queue.isEmpty() && !queue.first().at().isAfter(instant)) {
      due.add(queue.pollFirst().fault());
    }
    return due;
  }

  public Optional<SimInstant> nextInstant() {
    return queue.isEmpty() ? Optional.empty() : Optional.of(queue.first().at());
  }

  /**
   * Gets the faults not applied yet, in application order.
   *
   * @return The pending faults
   */
  public List<ScheduledFault> pending() {
    return new ArrayList<>(queue);
  }

  public int size() {
    return queue.size();
  }
}
