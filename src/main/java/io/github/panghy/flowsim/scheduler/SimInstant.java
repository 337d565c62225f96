package io.github.panghy.flowsim.scheduler;

import java.time.Duration;

/**
 * A point in simulated time, in nanoseconds since the start of the run.
 *
 * @param nanos Offset from the start of the run
 */
public record SimInstant(long nanos) implements Comparable<SimInstant> {

  /**
   * The start of every run.
   */
  public static final SimInstant ZERO = new SimInstant(0);

  public SimInstant {
    if (nanos < 0) {
      throw new IllegalArgumentException("Simulated time cannot be negative: " + nanos);
    }
  }

  public static SimInstant ofNanos(long nanos) {
    return new SimInstant(nanos);
  }

  public static SimInstant ofMillis(long millis) {
    return new SimInstant(Math.multiplyExact(millis, 1_000_000L));
  }

  /**
   * Returns this instant shifted by the given duration. Negative results clamp to
   * {@link #ZERO}; overflow saturates.
   *
   * @param duration The offset, may be negative
   * @return The shifted instant
   */
  public SimInstant plus(Duration duration) {
    long delta = saturatedNanos(duration);
    long sum = nanos + delta;
    if (delta > 0 && sum < nanos) {
      return new SimInstant(Long.MAX_VALUE);
    }
    return new SimInstant(Math.max(0, sum));
  }

  public Duration durationSince(SimInstant earlier) {
    return Duration.ofNanos(nanos - earlier.nanos);
  }

  public boolean isAfter(SimInstant other) {
    return nanos > other.nanos;
  }

  public boolean isBefore(SimInstant other) {
    return nanos < other.nanos;
  }

  public long toMillis() {
    return nanos / 1_000_000L;
  }

  public static SimInstant max(SimInstant a, SimInstant b) {
    return a.nanos >= b.nanos ? a : b;
  }

  static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  @Override
  public int compareTo(SimInstant other) {
    return Long.compare(nanos, other.nanos);
  }

  @Override
  public String toString() {
    return String.format("%d.%06dms", nanos / 1_000_000L, nanos % 1_000_000L);
  }
}
