package io.github.panghy.flowsim.io.network;

import java.time.Duration;
import java.util.Objects;

/**
 * Latency range and loss rate of a link. Latency is drawn uniformly from
 * {@code [minLatency, maxLatency]}; each message is lost with probability {@code lossRate}.
 *
 * @param minLatency The smallest one-way latency
 * @param maxLatency The largest one-way latency
 * @param lossRate   Probability in {@code [0, 1]} that a message is dropped
 */
public record LinkConditions(Duration minLatency, Duration maxLatency, double lossRate) {

  public LinkConditions {
    Objects.requireNonNull(minLatency, "Minimum latency cannot be null");
    Objects.requireNonNull(maxLatency, "Maximum latency cannot be null");
    if (minLatency.isNegative()) {
      throw new IllegalArgumentException("Latency cannot be negative: " + minLatency);
    }
    if (maxLatency.compareTo(minLatency) < 0) {
      throw new IllegalArgumentException("Maximum latency " + maxLatency + " is below minimum " + minLatency);
    }
    if (!(lossRate >= 0.0 && lossRate <= 1.0)) {
      throw new IllegalArgumentException("Loss rate must be between 0.0 and 1.0: " + lossRate);
    }
  }

  public static LinkConditions fixed(Duration latency) {
    return new LinkConditions(latency, latency, 0.0);
  }

  public LinkConditions withLatency(Duration min, Duration max) {
    return new LinkConditions(min, max, lossRate);
  }

  public LinkConditions withLossRate(double rate) {
    return new LinkConditions(minLatency, maxLatency, rate);
  }
}
