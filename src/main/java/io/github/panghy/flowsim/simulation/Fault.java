package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;

import java.time.Duration;
import java.util.Objects;

/**
 * An adversarial event applied to the simulation at a scheduled instant.
 *
 * <p>Faults are plain values; applying one mutates the network or host state through a
 * {@link FaultTarget}. Scheduling the same faults at the same instants against the same
 * seed reproduces a run.</p>
 *
 * <pre>{@code
 * sim.scheduleFault(Duration.ofMillis(100), new Fault.Partition(server, client));
 * sim.scheduleFault(Duration.ofMillis(500), new Fault.Heal(server, client));
 * }</pre>
 */
public interface Fault {

  /**
   * Applies this fault.
   *
   * @param target The simulation state to mutate
   */
  void applyTo(FaultTarget target);

  /**
   * Splits two hosts in both directions.
   */
  record Partition(HostId a, HostId b) implements Fault {
    public Partition {
      Objects.requireNonNull(a, "Host cannot be null");
      Objects.requireNonNull(b, "Host cannot be null");
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.partition(a, b);
    }
  }

  /**
   * Removes a partition between two hosts.
   */
  record Heal(HostId a, HostId b) implements Fault {
    public Heal {
      Objects.requireNonNull(a, "Host cannot be null");
      Objects.requireNonNull(b, "Host cannot be null");
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.repair(a, b);
    }
  }

  /**
   * Changes the latency range of a link.
   */
  record LatencyChange(Link link, Duration min, Duration max) implements Fault {
    public LatencyChange {
      Objects.requireNonNull(link, "Link cannot be null");
      if (min.isNegative() || max.compareTo(min) < 0) {
        throw new IllegalArgumentException("Invalid latency range [" + min + ", " + max + "]");
      }
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.setLinkLatency(link, min, max);
    }
  }

  /**
   * Changes the loss rate of a link.
   */
  record LossChange(Link link, double rate) implements Fault {
    public LossChange {
      Objects.requireNonNull(link, "Link cannot be null");
      if (!(rate >= 0.0 && rate <= 1.0)) {
        throw new IllegalArgumentException("Loss rate must be between 0.0 and 1.0: " + rate);
      }
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.setLinkLoss(link, rate);
    }
  }

  record Crash(HostId host) implements Fault {
    public Crash {
      Objects.requireNonNull(host, "Host cannot be null");
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.crash(host);
    }
  }

  record Restart(HostId host) implements Fault {
    public Restart {
      Objects.requireNonNull(host, "Host cannot be null");
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.restart(host);
    }
  }

  /**
   * Skews one host's clock. A zero offset removes the skew.
   */
  record ClockSkew(HostId host, Duration offset) implements Fault {
    public ClockSkew {
      Objects.requireNonNull(host, "Host cannot be null");
      Objects.requireNonNull(offset, "Offset cannot be null");
    }

    @Override
    public void applyTo(FaultTarget target) {
      target.setClockSkew(host, offset);
    }
  }
}
