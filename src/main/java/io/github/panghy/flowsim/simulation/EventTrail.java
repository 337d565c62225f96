package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.VirtualClock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.flowsim.util.LoggingUtil.debug;

/**
 * Ordered record of everything observable that happened during a run: task lifecycle,
 * timer fires, message sends, deliveries and drops, and fault applications.
 *
 * <p>Two runs with the same seed, host logic and fault schedule produce equal trails.</p>
 */
public class EventTrail {
  private static final Logger LOGGER = Logger.getLogger(EventTrail.class.getName());

  private final VirtualClock clock;
  private final boolean recording;
  private final List<TraceEvent> events = new ArrayList<>();

  /**
   * Creates a trail stamped by the given clock.
   *
   * @param clock     The clock supplying event instants
   * @param recording Whether events are retained (they are always logged at FINE)
   */
  public EventTrail(VirtualClock clock, boolean recording) {
    this.clock = clock;
    this.recording = recording;
  }

  /**
   * Records an event at the current instant.
   *
   * @param kind   The event kind
   * @param detail The description
   */
  public void record(TraceEvent.Kind kind, String detail) {
    TraceEvent event = new TraceEvent(clock.now(), kind, detail);
    if (recording) {
      events.add(event);
    }
    debug(LOGGER, event.toString());
  }

  public List<TraceEvent> getEvents() {
    return Collections.unmodifiableList(events);
  }

  public List<TraceEvent> getEvents(TraceEvent.Kind kind) {
    List<TraceEvent> result = new ArrayList<>();
    for (TraceEvent event : events) {
      if (event.kind() == kind) {
        result.add(event);
      }
    }
    return result;
  }

  public int size() {
    return events.size();
  }

  /**
   * Compares this trail with another, event by event.
   *
   * @param other The trail to compare with
   * @return A description of the first differing position, or empty if the trails match
   */
  public Optional<String> firstDivergence(EventTrail other) {
    List<TraceEvent> theirs = other.events;
    int common = Math.min(events.size(), theirs.size());
    for (int i = 0; i < common; i++) {
      if (!events.get(i).equals(theirs.get(i))) {
        return Optional.of("event " + i + ": " + events.get(i) + " vs " + theirs.get(i));
      }
    }
    if (events.size() != theirs.size()) {
      return Optional.of("length " + events.size() + " vs " + theirs.size());
    }
    return Optional.empty();
  }
}
