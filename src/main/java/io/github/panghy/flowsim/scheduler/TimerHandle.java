package io.github.panghy.flowsim.scheduler;

/**
 * Opaque handle of a pending timer. Handles are issued in creation order, which is the
 * tie-break between timers sharing a deadline.
 *
 * @param id The sequence number of the timer within its clock
 */
public record TimerHandle(long id) {

  @Override
  public String toString() {
    return "timer#" + id;
  }
}
