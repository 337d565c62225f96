package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.simulation.HostId;

import java.util.Objects;

/**
 * An unordered pair of hosts. {@code Link.between(a, b)} equals {@code Link.between(b, a)},
 * which makes partitions and per-link conditions symmetric.
 *
 * @param first  The host with the lower id
 * @param second The host with the higher id
 */
public record Link(HostId first, HostId second) {

  public Link {
    Objects.requireNonNull(first, "First host cannot be null");
    Objects.requireNonNull(second, "Second host cannot be null");
    if (first.compareTo(second) > 0) {
      throw new IllegalArgumentException("Use Link.between to build a normalized link");
    }
  }

  public static Link between(HostId a, HostId b) {
    return a.compareTo(b) <= 0 ? new Link(a, b) : new Link(b, a);
  }

  @Override
  public String toString() {
    return first + "<->" + second;
  }
}
