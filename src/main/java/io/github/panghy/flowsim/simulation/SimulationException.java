package io.github.panghy.flowsim.simulation;

/**
 * Thrown when a run ends without completing. Carries the report, which names the seed
 * and the faults needed to reproduce the run.
 */
public class SimulationException extends RuntimeException {

  private final SimulationReport report;

  public SimulationException(String message, SimulationReport report) {
    super(message + " (" + report.reproduction() + ")");
    this.report = report;
  }

  public SimulationException(String message, SimulationReport report, Throwable cause) {
    super(message + " (" + report.reproduction() + ")", cause);
    this.report = report;
  }

  public SimulationReport getReport() {
    return report;
  }
}
