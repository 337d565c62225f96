package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.NetworkSimulationParameters;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unified configuration for a simulation run: seed, run ceiling, failure policy, trace
 * recording, network conditions, generated chaos and the bug registry consulted by
 * {@link HostContext#buggify(String)}.
 *
 * <p>SimulationConfiguration has two presets:</p>
 * <ul>
 *   <li>{@link #deterministic()}: a fast, lossless network and no generated faults, for
 *   regression testing</li>
 *   <li>{@link #chaos()}: wider latency, some loss and a generated fault schedule, for
 *   finding bugs</li>
 * </ul>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * SimulationConfiguration config = SimulationConfiguration.chaos()
 *     .setSeed(SimulationConfiguration.seedFromEnvironment(42))
 *     .setRunCeiling(Duration.ofMinutes(5))
 *     .enableBug("slow_commit", 0.1);
 * }</pre>
 */
public class SimulationConfiguration {

  /**
   * System property holding the seed to use.
   */
  public static final String SEED_PROPERTY = "flowsim.seed";

  /**
   * Environment variable holding the seed to use when the property is not set.
   */
  public static final String SEED_ENV = "TEST_SEED";

  private long seed = 0L;
  private Duration runCeiling = null;          // null means unbounded
  private boolean failFast = false;
  private boolean traceRecording = true;
  private NetworkSimulationParameters networkParameters = new NetworkSimulationParameters();

  // Generated chaos
  private int chaosFaultCount = 0;
  private Duration chaosDuration = Duration.ofSeconds(10);

  private final Map<String, Double> bugProbabilities = new LinkedHashMap<>();

  /**
   * Creates a default configuration with deterministic behavior.
   */
  public SimulationConfiguration() {
  }

  /**
   * Creates a configuration for deterministic testing.
   *
   * @return A deterministic configuration
   */
  public static SimulationConfiguration deterministic() {
    return new SimulationConfiguration();
  }

  /**
   * Creates a configuration for chaos testing: latency between 1ms and 50ms, 1% loss
   * and ten generated disruptions within the first ten seconds.
   *
   * @return A chaos configuration
   */
  public static SimulationConfiguration chaos() {
    return new SimulationConfiguration()
        .setNetworkParameters(new NetworkSimulationParameters()
            .setMinLatency(Duration.ofMillis(1))
            .setMaxLatency(Duration.ofMillis(50))
            .setLossRate(0.01))
        .setChaosFaultCount(10)
        .setChaosDuration(Duration.ofSeconds(10));
  }

  /**
   * Reads the seed from the {@value #SEED_PROPERTY} system property, then the
   * {@value #SEED_ENV} environment variable.
   *
   * @param defaultSeed The seed to use when neither is set
   * @return The seed
   * @throws IllegalArgumentException if the value is not a number
   */
  public static long seedFromEnvironment(long defaultSeed) {
    String value = System.getProperty(SEED_PROPERTY);
    if (value == null || value.isBlank()) {
      value = System.getenv(SEED_ENV);
    }
    if (value == null || value.isBlank()) {
      return defaultSeed;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid seed '" + value + "'", e);
    }
  }

  public long getSeed() {
    return seed;
  }

  /**
   * Sets the master seed from which every entropy stream is derived.
   *
   * @param seed The seed
   * @return This instance for chaining
   */
  public SimulationConfiguration setSeed(long seed) {
    this.seed = seed;
    return this;
  }

  public Duration getRunCeiling() {
    return runCeiling;
  }

  /**
   * Sets the maximum simulated duration of a run. A run whose next event lies beyond
   * the ceiling ends with a timeout.
   *
   * @param runCeiling The ceiling, or null for no limit
   * @return This instance for chaining
   */
  public SimulationConfiguration setRunCeiling(Duration runCeiling) {
    if (runCeiling != null && runCeiling.isNegative()) {
      throw new IllegalArgumentException("Run ceiling cannot be negative: " + runCeiling);
    }
    this.runCeiling = runCeiling;
    return this;
  }

  public boolean isFailFast() {
    return failFast;
  }

  /**
   * Sets whether the first task failure ends the run.
   *
   * @param failFast true to stop at the first failure
   * @return This instance for chaining
   */
  public SimulationConfiguration setFailFast(boolean failFast) {
    this.failFast = failFast;
    return this;
  }

  public boolean isTraceRecording() {
    return traceRecording;
  }

  public SimulationConfiguration setTraceRecording(boolean traceRecording) {
    this.traceRecording = traceRecording;
    return this;
  }

  public NetworkSimulationParameters getNetworkParameters() {
    return networkParameters;
  }

  public SimulationConfiguration setNetworkParameters(NetworkSimulationParameters networkParameters) {
    this.networkParameters = Objects.requireNonNull(networkParameters, "Parameters cannot be null");
    return this;
  }

  public int getChaosFaultCount() {
    return chaosFaultCount;
  }

  /**
   * Sets how many disruptions the chaos generator schedules at the start of the run.
   *
   * @param chaosFaultCount The number of disruptions, 0 to disable generation
   * @return This instance for chaining
   */
  public SimulationConfiguration setChaosFaultCount(int chaosFaultCount) {
    if (chaosFaultCount < 0) {
      throw new IllegalArgumentException("Fault count cannot be negative: " + chaosFaultCount);
    }
    this.chaosFaultCount = chaosFaultCount;
    return this;
  }

  public Duration getChaosDuration() {
    return chaosDuration;
  }

  public SimulationConfiguration setChaosDuration(Duration chaosDuration) {
    if (chaosDuration.isNegative() || chaosDuration.isZero()) {
      throw new IllegalArgumentException("Chaos window must be positive: " + chaosDuration);
    }
    this.chaosDuration = chaosDuration;
    return this;
  }

  /**
   * Registers a bug ID with its probability of activation.
   *
   * @param bugId       The unique identifier for the bug
   * @param probability The probability of activation (0.0 to 1.0)
   * @return This instance for chaining
   * @throws IllegalArgumentException if probability is not in range [0.0, 1.0]
   */
  public SimulationConfiguration enableBug(String bugId, double probability) {
    if (probability < 0.0 || probability > 1.0) {
      throw new IllegalArgumentException("Probability must be between 0.0 and 1.0");
    }
    bugProbabilities.put(Objects.requireNonNull(bugId, "Bug id cannot be null"), probability);
    return this;
  }

  /**
   * Gets the registered probability for a bug ID.
   *
   * @param bugId The bug ID to query
   * @return The registered probability, or null if not registered
   */
  public Double getBugProbability(String bugId) {
    return bugProbabilities.get(bugId);
  }

  /**
   * Creates an independent copy of this configuration.
   *
   * @return The copy
   */
  public SimulationConfiguration copy() {
    SimulationConfiguration copy = new SimulationConfiguration()
        .setSeed(seed)
        .setRunCeiling(runCeiling)
        .setFailFast(failFast)
        .setTraceRecording(traceRecording)
        .setNetworkParameters(new NetworkSimulationParameters(networkParameters))
        .setChaosFaultCount(chaosFaultCount)
        .setChaosDuration(chaosDuration);
    copy.bugProbabilities.putAll(bugProbabilities);
    return copy;
  }

  @Override
  public String toString() {
    return "SimulationConfiguration{" +
        "seed=" + seed +
        ", runCeiling=" + runCeiling +
        ", failFast=" + failFast +
        ", chaosFaultCount=" + chaosFaultCount +
        ", bugs=" + bugProbabilities.keySet() +
        '}';
  }
}
