package io.github.panghy.flowsim.scheduler;

import io.github.panghy.flowsim.simulation.HostId;

/**
 * An unhandled error captured from a task.
 *
 * @param taskId   The failed task
 * @param taskName The name of the failed task
 * @param host     The host the task belonged to
 * @param at       The simulated instant of the failure
 * @param error    The error that escaped the task
 */
public record TaskFailure(long taskId, String taskName, HostId host, SimInstant at, Throwable error) {

  @Override
  public String toString() {
    return "task " + taskId + " (" + taskName + ") on " + host + " failed at " + at + ": " + error;
  }
}
