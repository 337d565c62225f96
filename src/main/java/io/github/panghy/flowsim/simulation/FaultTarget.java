package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;

import java.time.Duration;

/**
 * The state a {@link Fault} can mutate. {@link Simulation} applies faults through it.
 */
public interface FaultTarget {

  void partition(HostId a, HostId b);

  void repair(HostId a, HostId b);

  void setLinkLatency(Link link, Duration min, Duration max);

  void setLinkLoss(Link link, double rate);

  /**
   * Terminates every task of the host and resets its connections. No-op if the host is
   * already down.
   *
   * @param host The host
   */
  void crash(HostId host);

  /**
   * Starts a fresh top-level task for a crashed host. No-op if the host is up.
   *
   * @param host The host
   */
  void restart(HostId host);

  /**
   * Offsets the host's view of the current time. The global clock is unaffected.
   *
   * @param host   The host
   * @param offset The offset, may be negative
   */
  void setClockSkew(HostId host, Duration offset);
}
