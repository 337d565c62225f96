package io.github.panghy.flowsim.simulation;

import java.util.Objects;

/**
 * Handle of a simulated host. Values are assigned in registration order and never
 * reused within a run; the name is carried for diagnostics.
 *
 * @param value The integer handle
 * @param name  The registered host name
 */
public record HostId(int value, String name) implements Comparable<HostId> {

  /**
   * The simulator itself, owner of run-level entropy such as the chaos stream.
   */
  public static final HostId SIMULATOR = new HostId(0, "simulator");

  public HostId {
    Objects.requireNonNull(name, "Host name cannot be null");
    if (value < 0) {
      throw new IllegalArgumentException("Host id cannot be negative: " + value);
    }
  }

  @Override
  public int compareTo(HostId other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return name + "#" + value;
  }
}
