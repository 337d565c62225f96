package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.SimInstant;

import java.util.Objects;

/**
 * A fault, the instant it was applied at and the point of the run loop it was applied
 * in. Replaying a report applies each fault at the same point again.
 *
 * @param at      The instant
 * @param fault   The fault
 * @param stage   Where in the run loop the fault was applied
 * @param advance For {@link Stage#DIRECT} faults, the number of clock advances completed
 *                when the fault was applied; 0 otherwise
 */
public record AppliedFault(SimInstant at, Fault fault, Stage stage, long advance) {

  /**
   * Where a fault was applied.
   */
  public enum Stage {
    /**
     * Applied before the hosts were started.
     */
    BEFORE_START,

    /**
     * Taken from the fault schedule while advancing the clock.
     */
    SCHEDULED,

    /**
     * Applied directly while the run was in progress, between steps or from task code.
     */
    DIRECT
  }

  public AppliedFault {
    Objects.requireNonNull(at, "Instant cannot be null");
    Objects.requireNonNull(fault, "Fault cannot be null");
    Objects.requireNonNull(stage, "Stage cannot be null");
    if (advance < 0) {
      throw new IllegalArgumentException("Advance count cannot be negative: " + advance);
    }
  }

  /**
   * Creates a scheduled fault.
   *
   * @param at    The instant
   * @param fault The fault
   */
  public AppliedFault(SimInstant at, Fault fault) {
    this(at, fault, Stage.SCHEDULED, 0);
  }

  @Override
  public String toString() {
    return switch (stage) {
      case SCHEDULED -> at + " " + fault;
      case BEFORE_START -> at + " " + fault + " (before start)";
      case DIRECT -> at + " " + fault + " (after advance " + advance + ")";
    };
  }
}
