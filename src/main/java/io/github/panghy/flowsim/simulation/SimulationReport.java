package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.scheduler.TaskFailure;

import java.util.List;

/**
 * The outcome of a run, with everything needed to reproduce it: the seed, the faults
 * applied and the instant the run ended at.
 *
 * @param seed          The master seed
 * @param outcome       How the run ended
 * @param endInstant    The simulated instant the run ended at
 * @param appliedFaults Every fault applied, in application order
 * @param failures      Every task failure, in the order they happened
 * @param liveTasks     The tasks still alive when the run ended
 * @param trail         The event trail of the run
 */
public record SimulationReport(long seed,
                               Outcome outcome,
                               SimInstant endInstant,
                               List<AppliedFault> appliedFaults,
                               List<TaskFailure> failures,
                               List<String> liveTasks,
                               EventTrail trail) {

  /**
   * How a run ended.
   */
  public enum Outcome {
    COMPLETED,
    DEADLOCK,
    TIMEOUT,
    TASK_FAILED
  }

  public SimulationReport {
    appliedFaults = List.copyOf(appliedFaults);
    failures = List.copyOf(failures);
    liveTasks = List.copyOf(liveTasks);
  }

  /**
   * Checks whether the run completed without any task failure.
   *
   * @return true if the run was clean
   */
  public boolean isSuccess() {
    return outcome == Outcome.COMPLETED && failures.isEmpty();
  }

  /**
   * Describes how to reproduce this run.
   *
   * @return A one-line description naming the seed
   */
  public String reproduction() {
    return "seed=" + seed + " outcome=" + outcome + " at=" + endInstant + " faults=" + appliedFaults.size()
        + " failures=" + failures.size() + "; rerun with -D" + SimulationConfiguration.SEED_PROPERTY + "=" + seed
        + " or " + SimulationConfiguration.SEED_ENV + "=" + seed;
  }

  @Override
  public String toString() {
    return "SimulationReport{" + reproduction() + ", appliedFaults=" + appliedFaults + "}";
  }
}
