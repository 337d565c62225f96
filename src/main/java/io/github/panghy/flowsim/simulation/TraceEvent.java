package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.SimInstant;

/**
 * One entry of the {@link EventTrail}.
 *
 * @param at     The simulated instant of the event
 * @param kind   What happened
 * @param detail Deterministic description of the event
 */
public record TraceEvent(SimInstant at, Kind kind, String detail) {

  /**
   * Event kinds recorded by the runtime.
   */
  public enum Kind {
    TASK_SPAWN,
    TASK_COMPLETE,
    TASK_FAIL,
    TASK_CANCEL,
    TIMER_FIRE,
    CONNECT,
    ACCEPT,
    CLOSE,
    SEND,
    DELIVER,
    DROP,
    FAULT
  }

  @Override
  public String toString() {
    return "[" + at + "] " + kind + " " + detail;
  }
}
