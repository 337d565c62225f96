package io.github.panghy.flowsim.simulation;

/**
 * Thrown when tasks remain but no timer, message or fault is pending, so nothing can
 * ever wake them.
 */
public class DeadlockException extends SimulationException {

  public DeadlockException(SimulationReport report) {
    super("Deadlock at " + report.endInstant() + ": " + report.liveTasks().size() + " task(s) cannot make progress",
        report);
  }
}
