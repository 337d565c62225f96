package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;
import io.github.panghy.flowsim.scheduler.SimInstant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class FaultSchedulerTest {

  private static final HostId A = new HostId(1, "a");
  private static final HostId B = new HostId(2, "b");

  @Mock
  private FaultTarget target;

  @Test
  void testDueOrdersByInstantThenInsertion() {
    FaultScheduler scheduler = new FaultScheduler();
    Fault crash = new Fault.Crash(A);
    Fault partition = new Fault.Partition(A, B);
    Fault heal = new Fault.Heal(A, B);
    Fault restart = new Fault.Restart(A);
    scheduler.scheduleAt(SimInstant.ofMillis(20), restart);
    scheduler.scheduleAt(SimInstant.ofMillis(10), crash);
    scheduler.scheduleAt(SimInstant.ofMillis(10), partition);
    scheduler.scheduleAt(SimInstant.ofMillis(15), heal);

    assertEquals(Optional.of(SimInstant.ofMillis(10)), scheduler.nextInstant());
    assertTrue(scheduler.due(SimInstant.ofMillis(9)).isEmpty());
    assertEquals(List.of(crash, partition, heal), scheduler.due(SimInstant.ofMillis(15)));
    assertEquals(1, scheduler.size());
    assertEquals(List.of(restart), scheduler.due(SimInstant.ofMillis(100)));
    assertEquals(Optional.empty(), scheduler.nextInstant());
  }

  @Test
  void testScheduleAfter() {
    FaultScheduler scheduler = new FaultScheduler();
    ScheduledFault later = scheduler.scheduleAfter(SimInstant.ofMillis(5), Duration.ofMillis(10), new Fault.Crash(A));
    ScheduledFault now = scheduler.scheduleAfter(SimInstant.ofMillis(5), Duration.ofMillis(-3), new Fault.Restart(A));

    assertEquals(SimInstant.ofMillis(15), later.at());
    assertEquals(SimInstant.ofMillis(5), now.at());
    assertEquals(List.of(now, later), scheduler.pending());
  }

  @Test
  void testFaultsDispatchToTarget() {
    Link link = Link.between(B, A);
    List<Fault> faults = List.of(
        new Fault.Partition(A, B),
        new Fault.Heal(A, B),
        new Fault.LatencyChange(link, Duration.ofMillis(5), Duration.ofMillis(50)),
        new Fault.LossChange(link, 0.25),
        new Fault.Crash(B),
        new Fault.Restart(B),
        new Fault.ClockSkew(A, Duration.ofMillis(-20)));

    faults.forEach(fault -> fault.applyTo(target));

    InOrder order = inOrder(target);
    order.verify(target).partition(A, B);
    order.verify(target).repair(A, B);
    order.verify(target).setLinkLatency(link, Duration.ofMillis(5), Duration.ofMillis(50));
    order.verify(target).setLinkLoss(link, 0.25);
    order.verify(target).crash(B);
    order.verify(target).restart(B);
    order.verify(target).setClockSkew(A, Duration.ofMillis(-20));
    verifyNoMoreInteractions(target);
  }

  @Test
  void testInvalidFaultsAreRejected() {
    Link link = Link.between(A, B);
    assertThrows(IllegalArgumentException.class,
        () -> new Fault.LatencyChange(link, Duration.ofMillis(10), Duration.ofMillis(5)));
    assertThrows(IllegalArgumentException.class, () -> new Fault.LossChange(link, 1.5));
    assertThrows(NullPointerException.class, () -> new Fault.Crash(null));
  }
}
