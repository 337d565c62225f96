package io.github.panghy.flowsim.simulation;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * A reproducible random sequence owned by one {@code (host, purpose)} pair.
 *
 * <p>Every decision a host makes that would otherwise use ambient randomness goes
 * through a stream: request jitter, tie-breaking, generated identifiers. Streams are
 * obtained from {@link EntropyManager#streamFor(HostId, String)}; two runs with the same
 * master seed observe the same values at the same draw counts.</p>
 */
public class EntropyStream {

  private final HostId host;
  private final String purpose;
  private final long seed;
  private final Random random;
  private long draws;

  EntropyStream(HostId host, String purpose, long seed) {
    this.host = host;
    this.purpose = purpose;
    this.seed = seed;
    this.random = new Random(seed);
  }

  public HostId getHost() {
    return host;
  }

  public String getPurpose() {
    return purpose;
  }

  /**
   * Gets the seed derived for this stream.
   *
   * @return The derived seed
   */
  public long getSeed() {
    return seed;
  }

  /**
   * Gets the number of values drawn so far.
   *
   * @return The draw count
   */
  public long getDrawCount() {
    return draws;
  }

  /**
   * Draws 64 random bits. This is the primitive every other generator builds on.
   *
   * @return The next 64-bit value
   */
  public long nextLong() {
    draws++;
    return random.nextLong();
  }

  /**
   * Draws a value uniformly from {@code [origin, bound)}.
   *
   * @param origin The inclusive lower bound
   * @param bound  The exclusive upper bound
   * @return The value
   * @throws IllegalArgumentException if {@code origin >= bound}
   */
  public long nextLong(long origin, long bound) {
    if (origin >= bound) {
      throw new IllegalArgumentException("Bound must be greater than origin: [" + origin + ", " + bound + ")");
    }
    draws++;
    return random.nextLong(origin, bound);
  }

  public int nextInt(int bound) {
    return (int) nextLong(0, bound);
  }

  public double nextDouble() {
    draws++;
    return random.nextDouble();
  }

  public boolean nextBoolean() {
    draws++;
    return random.nextBoolean();
  }

  /**
   * Returns true with the given probability. Always draws, so the stream advances the
   * same way whatever the probability.
   *
   * @param probability The probability (0.0-1.0)
   * @return true with the given probability
   */
  public boolean chance(double probability) {
    return nextDouble() < probability;
  }

  /**
   * Picks one element uniformly.
   *
   * @param choices The candidates, in a deterministic order
   * @param <T>     The element type
   * @return The chosen element
   * @throws IllegalArgumentException if {@code choices} is empty
   */
  public <T> T choose(List<T> choices) {
    if (choices.isEmpty()) {
      throw new IllegalArgumentException("Cannot choose from an empty list");
    }
    return choices.get(nextInt(choices.size()));
  }

  /**
   * Draws a duration uniformly from {@code [min, max]}, at nanosecond resolution.
   *
   * @param min The inclusive lower bound
   * @param max The inclusive upper bound
   * @return The duration
   */
  public Duration nextDuration(Duration min, Duration max) {
    long low = min.toNanos();
    long high = max.toNanos();
    if (high < low) {
      throw new IllegalArgumentException("Maximum " + max + " is below minimum " + min);
    }
    if (high == Long.MAX_VALUE) {
      return Duration.ofNanos(nextLong(low, high));
    }
    return Duration.ofNanos(nextLong(low, high + 1));
  }

  @Override
  public String toString() {
    return "EntropyStream{host=" + host + ", purpose='" + purpose + "', seed=" + seed + ", draws=" + draws + "}";
  }
}
