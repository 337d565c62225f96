package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.SimInstant;

/**
 * A fault queued for a given instant. The sequence number records insertion order and
 * breaks ties between faults scheduled for the same instant.
 */
public record ScheduledFault(SimInstant at, long seq, Fault fault) implements Comparable<ScheduledFault> {

  @Override
  public int compareTo(ScheduledFault o) {
    int cmp = at.compareTo(o.at);
    return cmp != 0 ? cmp : Long.compare(seq, o.seq);
  }
}
