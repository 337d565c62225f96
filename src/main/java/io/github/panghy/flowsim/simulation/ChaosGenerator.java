package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;
import io.github.panghy.flowsim.io.network.LinkConditions;
import io.github.panghy.flowsim.io.network.NetworkSimulationParameters;
import io.github.panghy.flowsim.scheduler.SimInstant;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates randomized fault schedules.
 *
 * <p>Every draw comes from one entropy stream, so the seed, the host list, the fault
 * count and the duration fully determine the schedule. Each generated disruption is
 * paired with its recovery inside the window:</p>
 * <ul>
 *   <li>partition followed by heal</li>
 *   <li>crash followed by restart</li>
 *   <li>latency spike followed by a return to the link's configured range</li>
 *   <li>loss burst followed by a return to the link's configured loss rate</li>
 *   <li>clock skew followed by its removal</li>
 * </ul>
 *
 * <pre>{@code
 * ChaosGenerator chaos = new ChaosGenerator(entropy.streamFor(HostId.SIMULATOR, "chaos"), params);
 * chaos.generate(faultScheduler, SimInstant.ZERO, hosts, servers, 10, Duration.ofSeconds(5));
 * }</pre>
 */
public class ChaosGenerator {

  /**
   * Kinds of disruption the generator picks from.
   */
  enum Disruption {
    PARTITION,
    CRASH,
    LATENCY_SPIKE,
    LOSS_BURST,
    CLOCK_SKEW
  }

  static final Duration MAX_SPIKE_LATENCY = Duration.ofMillis(500);
  static final Duration MAX_SKEW = Duration.ofMillis(500);

  private final EntropyStream stream;
  private final NetworkSimulationParameters baseline;

  /**
   * Creates a generator.
   *
   * @param stream   The only source of randomness used
   * @param baseline The network parameters whose per-link conditions are restored after
   *                 latency and loss disruptions
   */
  public ChaosGenerator(EntropyStream stream, NetworkSimulationParameters baseline) {
    this.stream = Objects.requireNonNull(stream, "Stream cannot be null");
    this.baseline = Objects.requireNonNull(baseline, "Baseline cannot be null");
  }

  /**
   * Generates {@code faultCount} disruptions, each with its recovery, starting no earlier
   * than {@code start} and ending no later than {@code start + duration}.
   *
   * @param target        The scheduler receiving the faults
   * @param start         The beginning of the chaos window
   * @param hosts         Hosts eligible for partitions, link faults and skew
   * @param crashable     Hosts eligible for crashes
   * @param faultCount    The number of disruptions
   * @param duration      The length of the chaos window
   * @return The faults scheduled, in scheduling order
   */
  public List<ScheduledFault> generate(FaultScheduler target, SimInstant start, List<HostId> hosts,
                                       List<HostId> crashable, int faultCount, Duration duration) {
    if (faultCount < 0) {
      throw new IllegalArgumentException("Fault count cannot be negative: " + faultCount);
    }
    if (duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException("Chaos window must be positive: " + duration);
    }
    List<Disruption> kinds = new ArrayList<>();
    if (hosts.size() >= 2) {
      kinds.add(Disruption.PARTITION);
      kinds.add(Disruption.LATENCY_SPIKE);
      kinds.add(Disruption.LOSS_BURST);
    }
    if (!crashable.isEmpty()) {
      kinds.add(Disruption.CRASH);
    }
    if (!hosts.isEmpty()) {
      kinds.add(Disruption.CLOCK_SKEW);
    }
    List<ScheduledFault> scheduled = new ArrayList<>();
    if (kinds.isEmpty()) {
      return scheduled;
    }
    long window = duration.toNanos();
    for (int i = 0; i < faultCount; i++) {
      long begin = stream.nextLong(0, window);
      long end = stream.nextLong(begin + 1, window + 1);
      SimInstant from = start.plus(Duration.ofNanos(begin));
      SimInstant until = start.plus(Duration.ofNanos(end));
      Disruption kind = stream.choose(kinds);
      switch (kind) {
        case PARTITION -> {
          Link link = pickLink(hosts);
          scheduled.add(target.scheduleAt(from, new Fault.Partition(link.first(), link.second())));
          scheduled.add(target.scheduleAt(until, new Fault.Heal(link.first(), link.second())));
        }
        case CRASH -> {
          HostId host = stream.choose(crashable);
          scheduled.add(target.scheduleAt(from, new Fault.Crash(host)));
          scheduled.add(target.scheduleAt(until, new Fault.Restart(host)));
        }
        case LATENCY_SPIKE -> {
          Link link = pickLink(hosts);
          LinkConditions configured = baseline.conditionsFor(link);
          Duration min = configured.maxLatency();
          Duration max = stream.nextDuration(min, min.plus(MAX_SPIKE_LATENCY));
          scheduled.add(target.scheduleAt(from, new Fault.LatencyChange(link, min, max)));
          scheduled.add(target.scheduleAt(until,
              new Fault.LatencyChange(link, configured.minLatency(), configured.maxLatency())));
        }
        case LOSS_BURST -> {
          Link link = pickLink(hosts);
          double rate = 0.1 + stream.nextDouble() * 0.4;
          scheduled.add(target.scheduleAt(from, new Fault.LossChange(link, rate)));
          scheduled.add(target.scheduleAt(until,
              new Fault.LossChange(link, baseline.conditionsFor(link).lossRate())));
        }
        case CLOCK_SKEW -> {
          HostId host = stream.choose(hosts);
          long bound = MAX_SKEW.toNanos();
          Duration offset = Duration.ofNanos(stream.nextLong(-bound, bound + 1));
          scheduled.add(target.scheduleAt(from, new Fault.ClockSkew(host, offset)));
          scheduled.add(target.scheduleAt(until, new Fault.ClockSkew(host, Duration.ZERO)));
        }
        default -> throw new IllegalStateException("Unexpected disruption: " + kind);
      }
    }
    return scheduled;
  }

  private Link pickLink(List<HostId> hosts) {
    int first = stream.nextInt(hosts.size());
    int second = stream.nextInt(hosts.size() - 1);
    if (second >= first) {
      second++;
    }
    return Link.between(hosts.get(first), hosts.get(second));
  }
}
