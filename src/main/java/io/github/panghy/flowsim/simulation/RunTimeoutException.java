package io.github.panghy.flowsim.simulation;

/**
 * Thrown when the next event of a run lies beyond the configured run ceiling.
 */
public class RunTimeoutException extends SimulationException {

  public RunTimeoutException(SimulationReport report) {
    super("Run ceiling reached at " + report.endInstant(), report);
  }
}
