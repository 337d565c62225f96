package io.github.panghy.flowsim.io.network;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameters for simulating message delivery between hosts.
 *
 * <p>Every link starts with the default conditions below. Individual links can be given
 * their own latency range and loss rate, either up front or at run time through latency
 * and loss faults.</p>
 *
 * <pre>{@code
 * NetworkSimulationParameters params = new NetworkSimulationParameters()
 *     .setMinLatency(Duration.ofMillis(1))
 *     .setMaxLatency(Duration.ofMillis(50))
 *     .setLossRate(0.01);
 * }</pre>
 *
 * <p>Default values simulate a fast local network that never loses messages.</p>
 */
public class NetworkSimulationParameters {

  private Duration minLatency = Duration.ofMillis(1);
  private Duration maxLatency = Duration.ofMillis(10);
  private double lossRate = 0.0;

  private final Map<Link, LinkConditions> linkOverrides = new LinkedHashMap<>();

  /**
   * Creates simulation parameters with default values.
   */
  public NetworkSimulationParameters() {
  }

  /**
   * Creates a copy of the given parameters, including link overrides.
   *
   * @param other The parameters to copy
   */
  public NetworkSimulationParameters(NetworkSimulationParameters other) {
    this.minLatency = other.minLatency;
    this.maxLatency = other.maxLatency;
    this.lossRate = other.lossRate;
    this.linkOverrides.putAll(other.linkOverrides);
  }

  public Duration getMinLatency() {
    return minLatency;
  }

  /**
   * Sets the default minimum one-way latency.
   *
   * @param minLatency The latency
   * @return This instance for chaining
   */
  public NetworkSimulationParameters setMinLatency(Duration minLatency) {
    this.minLatency = Objects.requireNonNull(minLatency, "Latency cannot be null");
    return this;
  }

  public Duration getMaxLatency() {
    return maxLatency;
  }

  /**
   * Sets the default maximum one-way latency.
   *
   * @param maxLatency The latency
   * @return This instance for chaining
   */
  public NetworkSimulationParameters setMaxLatency(Duration maxLatency) {
    this.maxLatency = Objects.requireNonNull(maxLatency, "Latency cannot be null");
    return this;
  }

  /**
   * Sets a fixed default latency.
   *
   * @param latency The latency of every message
   * @return This instance for chaining
   */
  public NetworkSimulationParameters setLatency(Duration latency) {
    return setMinLatency(latency).setMaxLatency(latency);
  }

  public double getLossRate() {
    return lossRate;
  }

  /**
   * Sets the default probability that a message is lost.
   *
   * @param lossRate The loss probability (0.0-1.0)
   * @return This instance for chaining
   */
  public NetworkSimulationParameters setLossRate(double lossRate) {
    this.lossRate = lossRate;
    return this;
  }

  /**
   * Gets the default conditions applied to links without an override.
   *
   * @return The default link conditions
   * @throws IllegalArgumentException if the defaults are inconsistent
   */
  public LinkConditions getDefaultConditions() {
    return new LinkConditions(minLatency, maxLatency, lossRate);
  }

  /**
   * Overrides the conditions of one link.
   *
   * @param link       The link
   * @param conditions The conditions to use for it
   * @return This instance for chaining
   */
  public NetworkSimulationParameters setLinkConditions(Link link, LinkConditions conditions) {
    linkOverrides.put(Objects.requireNonNull(link, "Link cannot be null"),
        Objects.requireNonNull(conditions, "Conditions cannot be null"));
    return this;
  }

  /**
   * Gets the conditions in force for a link.
   *
   * @param link The link
   * @return The override for the link, or the defaults
   */
  public LinkConditions conditionsFor(Link link) {
    LinkConditions conditions = linkOverrides.get(link);
    return conditions != null ? conditions : getDefaultConditions();
  }
}
