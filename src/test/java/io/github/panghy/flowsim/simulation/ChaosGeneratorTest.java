package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;
import io.github.panghy.flowsim.io.network.LinkConditions;
import io.github.panghy.flowsim.io.network.NetworkSimulationParameters;
import io.github.panghy.flowsim.scheduler.SimInstant;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChaosGeneratorTest {

  private static final HostId A = new HostId(1, "a");
  private static final HostId B = new HostId(2, "b");
  private static final HostId C = new HostId(3, "c");
  private static final NetworkSimulationParameters BASELINE = new NetworkSimulationParameters()
      .setMinLatency(Duration.ofMillis(1))
      .setMaxLatency(Duration.ofMillis(10))
      .setLossRate(0.0);

  private static List<ScheduledFault> generate(long seed, List<HostId> hosts, List<HostId> crashable, int count) {
    EntropyManager entropy = new EntropyManager(seed);
    ChaosGenerator generator = new ChaosGenerator(entropy.streamFor(HostId.SIMULATOR, "chaos"), BASELINE);
    return generator.generate(new FaultScheduler(), SimInstant.ofMillis(100), hosts, crashable, count,
        Duration.ofSeconds(1));
  }

  @Test
  void testSameSeedSameSchedule() {
    List<HostId> hosts = List.of(A, B, C);
    assertEquals(generate(42, hosts, List.of(B, C), 25), generate(42, hosts, List.of(B, C), 25));
    assertThat(generate(43, hosts, List.of(B, C), 25)).isNotEqualTo(generate(42, hosts, List.of(B, C), 25));
  }

  @Test
  void testEveryDisruptionHasARecoveryInsideTheWindow() {
    List<ScheduledFault> faults = generate(7, List.of(A, B, C), List.of(C), 30);

    assertEquals(60, faults.size());
    for (int i = 0; i < faults.size(); i += 2) {
      ScheduledFault disruption = faults.get(i);
      ScheduledFault recovery = faults.get(i + 1);
      assertThat(disruption.at()).isGreaterThanOrEqualTo(SimInstant.ofMillis(100));
      assertThat(recovery.at()).isGreaterThan(disruption.at());
      assertThat(recovery.at()).isLessThanOrEqualTo(SimInstant.ofMillis(1100));
    }
    assertThat(faults).extracting(ScheduledFault::fault)
        .filteredOn(fault -> fault instanceof Fault.Crash)
        .allMatch(fault -> ((Fault.Crash) fault).host().equals(C));
  }

  @Test
  void testNoCrashesWithoutCrashableHosts() {
    List<ScheduledFault> faults = generate(3, List.of(A, B), List.of(), 40);
    assertThat(faults).extracting(ScheduledFault::fault)
        .noneMatch(fault -> fault instanceof Fault.Crash || fault instanceof Fault.Restart);
  }

  @Test
  void testSingleHostOnlySkewsItsClock() {
    List<ScheduledFault> faults = generate(5, List.of(A), List.of(), 10);
    assertEquals(20, faults.size());
    assertThat(faults).extracting(ScheduledFault::fault).allMatch(fault -> fault instanceof Fault.ClockSkew);
  }

  @Test
  void testRecoveryRestoresEachLinksConfiguredConditions() {
    Link slow = Link.between(A, B);
    LinkConditions slowConditions = new LinkConditions(Duration.ofMillis(40), Duration.ofMillis(80), 0.05);
    NetworkSimulationParameters params = new NetworkSimulationParameters(BASELINE)
        .setLinkConditions(slow, slowConditions);
    ChaosGenerator generator = new ChaosGenerator(new EntropyManager(11).streamFor(HostId.SIMULATOR, "chaos"),
        params);
    List<ScheduledFault> faults = generator.generate(new FaultScheduler(), SimInstant.ZERO, List.of(A, B, C),
        List.of(), 200, Duration.ofSeconds(1));

    int slowRecoveries = 0;
    for (int i = 0; i < faults.size(); i += 2) {
      Fault disruption = faults.get(i).fault();
      Fault recovery = faults.get(i + 1).fault();
      if (disruption instanceof Fault.LatencyChange spike) {
        LinkConditions configured = params.conditionsFor(spike.link());
        assertThat(spike.min()).isEqualTo(configured.maxLatency());
        assertEquals(new Fault.LatencyChange(spike.link(), configured.minLatency(), configured.maxLatency()),
            recovery);
        slowRecoveries += spike.link().equals(slow) ? 1 : 0;
      } else if (disruption instanceof Fault.LossChange burst) {
        assertEquals(new Fault.LossChange(burst.link(), params.conditionsFor(burst.link()).lossRate()), recovery);
        slowRecoveries += burst.link().equals(slow) ? 1 : 0;
      }
    }
    assertThat(slowRecoveries).isPositive();
  }

  @Test
  void testRejectsInvalidArguments() {
    EntropyManager entropy = new EntropyManager(1);
    ChaosGenerator generator = new ChaosGenerator(entropy.streamFor(HostId.SIMULATOR, "chaos"), BASELINE);
    assertThrows(IllegalArgumentException.class,
        () -> generator.generate(new FaultScheduler(), SimInstant.ZERO, List.of(A), List.of(), -1, Duration.ofSeconds(1)));
    assertThrows(IllegalArgumentException.class,
        () -> generator.generate(new FaultScheduler(), SimInstant.ZERO, List.of(A), List.of(), 1, Duration.ZERO));
  }
}
