package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.scheduler.TaskFailure;

/**
 * Thrown by a fail-fast run at the first task failure. The failure's error is the cause.
 */
public class TaskFailedException extends SimulationException {

  public TaskFailedException(SimulationReport report, TaskFailure failure) {
    super("Task " + failure.taskName() + " on " + failure.host() + " failed at " + failure.at(),
        report, failure.error());
  }
}
