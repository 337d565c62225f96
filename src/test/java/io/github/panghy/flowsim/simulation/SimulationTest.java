package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.io.network.NetworkException;
import io.github.panghy.flowsim.io.network.NetworkSimulationParameters;
import io.github.panghy.flowsim.io.network.SimConnection;
import io.github.panghy.flowsim.io.network.SimListener;
import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.test.AbstractSimulationTest;
import io.github.panghy.flowsim.test.FixedSeed;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of {@link Simulation}: hosts, faults and the run loop together.
 */
class SimulationTest extends AbstractSimulationTest {

  private static final int CHAOS_ROUNDS = 20;

  private static NetworkSimulationParameters fixedLatency(long millis) {
    return new NetworkSimulationParameters().setLatency(Duration.ofMillis(millis));
  }

  private static ByteBuffer bytes(String text) {
    return ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
  }

  private static String text(ByteBuffer buffer) {
    byte[] data = new byte[buffer.remaining()];
    buffer.duplicate().get(data);
    return new String(data, StandardCharsets.UTF_8);
  }

  @Test
  void testMessageArrivesAfterLinkLatency() {
    getConfiguration().setNetworkParameters(fixedLatency(10));
    Simulation sim = newSimulation();
    List<String> received = new ArrayList<>();
    SimInstant[] receivedAt = new SimInstant[1];

    sim.client("b", ctx -> {
      SimListener listener = ctx.network().bind(8080);
      return listener.accept().flatMap(conn -> conn.recv()).map(buf -> {
        received.add(text(buf));
        receivedAt[0] = ctx.now();
        return buf;
      });
    });
    sim.host("a", ctx -> ctx.network().connect("b:8080").flatMap(conn -> conn.send(bytes("ping"))));

    SimulationReport report = sim.run();

    assertEquals(SimulationReport.Outcome.COMPLETED, report.outcome());
    assertTrue(report.isSuccess());
    assertEquals(List.of("ping"), received);
    assertEquals(SimInstant.ofMillis(10), receivedAt[0]);
    assertEquals(SimInstant.ofMillis(10), report.endInstant());
    assertThat(report.trail().getEvents(TraceEvent.Kind.DELIVER)).hasSize(1);
  }

  @Test
  void testPartitionDropsTrafficAndFailsSends() {
    getConfiguration().setNetworkParameters(fixedLatency(10));
    Simulation sim = newSimulation();
    Throwable[] clientError = new Throwable[1];
    Throwable[] hostError = new Throwable[1];

    HostId b = sim.client("b", ctx -> {
      SimListener listener = ctx.network().bind(8080);
      return listener.accept()
          .flatMap(conn -> ctx.withTimeout(conn.recv(), Duration.ofMillis(100)))
          .handle((buf, error) -> clientError[0] = error);
    });
    HostId a = sim.host("a", ctx -> ctx.network().connect("b:8080")
        .flatMap(conn -> conn.send(bytes("ping"))
            .flatMap(v -> ctx.sleep(Duration.ofMillis(20)))
            .flatMap(v -> conn.send(bytes("again"))))
        .handle((v, error) -> hostError[0] = error));
    sim.scheduleFaultAt(SimInstant.ofMillis(5), new Fault.Partition(a, b));

    SimulationReport report = sim.run();

    assertInstanceOf(TimeoutException.class, clientError[0]);
    NetworkException sendError = assertInstanceOf(NetworkException.class, hostError[0]);
    assertEquals(NetworkException.ErrorCode.NETWORK_UNREACHABLE, sendError.getErrorCode());
    assertThat(report.trail().getEvents(TraceEvent.Kind.DROP)).hasSize(1);
    assertEquals(List.of(new AppliedFault(SimInstant.ofMillis(5), new Fault.Partition(a, b))),
        report.appliedFaults());
    assertEquals(SimInstant.ofMillis(100), report.endInstant());
    assertTrue(sim.getNetwork().isPartitioned(b, a));
  }

  @Test
  void testLostMessagesAreSilent() {
    getConfiguration().setNetworkParameters(fixedLatency(10).setLossRate(1.0));
    Simulation sim = newSimulation();
    Throwable[] clientError = new Throwable[1];
    boolean[] sent = new boolean[1];

    sim.client("b", ctx -> ctx.network().bind(8080).accept()
        .flatMap(conn -> ctx.withTimeout(conn.recv(), Duration.ofMillis(50)))
        .handle((buf, error) -> clientError[0] = error));
    sim.host("a", ctx -> ctx.network().connect("b:8080")
        .flatMap(conn -> conn.send(bytes("ping")))
        .map(v -> sent[0] = true));

    SimulationReport report = sim.run();

    assertTrue(sent[0]);
    assertInstanceOf(TimeoutException.class, clientError[0]);
    assertThat(report.trail().getEvents(TraceEvent.Kind.DROP)).hasSize(1);
    assertThat(report.trail().getEvents(TraceEvent.Kind.DELIVER)).isEmpty();
    assertEquals(SimInstant.ofMillis(50), report.endInstant());
  }

  @Test
  void testDeadlockIsReported() {
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.network().bind(8080).accept().flatMap(conn -> conn.recv()));
    sim.host("b", ctx -> ctx.network().connect("a:8080").flatMap(conn -> conn.recv()));

    DeadlockException e = assertThrows(DeadlockException.class, sim::run);

    SimulationReport report = e.getReport();
    assertEquals(SimulationReport.Outcome.DEADLOCK, report.outcome());
    assertThat(report.liveTasks()).hasSize(2);
    assertEquals(getCurrentSeed(), report.seed());
    assertThat(e.getMessage()).contains("seed=" + getCurrentSeed());
    assertTrue(sim.isFinished());
  }

  @Test
  void testTimersFireInDeadlineThenCreationOrder() {
    Simulation sim = newSimulation();
    List<String> order = new ArrayList<>();

    sim.host("a", ctx -> {
      List<SimFuture<String>> sleepers = new ArrayList<>();
      for (String name : List.of("t30", "t10", "t20", "t10b")) {
        long millis = Long.parseLong(name.replaceAll("\\D", ""));
        sleepers.add(ctx.spawn(name, c -> c.sleep(Duration.ofMillis(millis)).map(v -> {
          order.add(name);
          return name;
        })));
      }
      return ctx.allOf(sleepers);
    });

    SimulationReport report = sim.run();

    assertEquals(List.of("t10", "t10b", "t20", "t30"), order);
    assertEquals(SimInstant.ofMillis(30), report.endInstant());
    assertThat(report.trail().getEvents(TraceEvent.Kind.TIMER_FIRE)).hasSize(4);
  }

  @Test
  @FixedSeed(1234)
  void testSameSeedSameTrail() {
    List<String> firstReplies = new ArrayList<>();
    List<String> secondReplies = new ArrayList<>();
    Simulation first = newSimulation();
    registerEchoWorkload(first, firstReplies);
    Simulation second = newSimulation();
    registerEchoWorkload(second, secondReplies);

    SimulationReport firstReport = first.run();
    SimulationReport secondReport = second.run();

    assertEquals(Optional.empty(), firstReport.trail().firstDivergence(secondReport.trail()));
    assertEquals(firstReport.trail().getEvents(), secondReport.trail().getEvents());
    assertEquals(firstReport.endInstant(), secondReport.endInstant());
    assertEquals(List.of("msg-0", "msg-1", "msg-2", "msg-3", "msg-4"), firstReplies);
    assertEquals(firstReplies, secondReplies);

    Simulation other = Simulation.builder().configuration(getConfiguration()).seed(getCurrentSeed() + 1).build();
    registerEchoWorkload(other, new ArrayList<>());
    SimulationReport otherReport = other.run();
    assertTrue(firstReport.trail().firstDivergence(otherReport.trail()).isPresent());
  }

  private static void registerEchoWorkload(Simulation sim, List<String> replies) {
    sim.host("server", ctx -> acceptLoop(ctx, ctx.network().bind(7000)));
    sim.client("client", ctx -> ctx.network().connect("server:7000")
        .flatMap(conn -> echoRounds(ctx, conn, 0, 5, replies)));
  }

  private static SimFuture<Void> acceptLoop(HostContext ctx, SimListener listener) {
    return listener.accept().flatMap(conn -> {
      ctx.spawn("echo-" + conn.getId(), c -> echo(conn).exceptionally(e -> null));
      return acceptLoop(ctx, listener);
    });
  }

  private static SimFuture<Void> echo(SimConnection conn) {
    return conn.recv().flatMap(buf -> conn.send(buf)).flatMap(v -> echo(conn));
  }

  private static SimFuture<Void> echoRounds(HostContext ctx, SimConnection conn, int round, int rounds,
                                            List<String> replies) {
    if (round == rounds) {
      conn.close();
      return ctx.completed(null);
    }
    return conn.send(bytes("msg-" + round))
        .flatMap(v -> ctx.withTimeout(conn.recv(), Duration.ofSeconds(1)))
        .flatMap(buf -> {
          replies.add(text(buf));
          return ctx.sleep(Duration.ofMillis(ctx.random().nextLong(0, 5)));
        })
        .flatMap(v -> echoRounds(ctx, conn, round + 1, rounds, replies));
  }

  @Test
  void testReplayReproducesChaosRun() {
    SimulationConfiguration config = SimulationConfiguration.chaos()
        .setSeed(getCurrentSeed())
        .setChaosDuration(Duration.ofSeconds(2));
    List<String> firstOutcomes = new ArrayList<>();
    Simulation first = Simulation.builder().configuration(config).build();
    registerChaosWorkload(first, firstOutcomes);
    SimulationReport report = first.run();

    assertThat(report.appliedFaults()).isNotEmpty();
    assertThat(firstOutcomes).hasSize(CHAOS_ROUNDS);

    List<String> replayOutcomes = new ArrayList<>();
    Simulation replay = Simulation.builder().configuration(config).replay(report).build();
    registerChaosWorkload(replay, replayOutcomes);
    SimulationReport again = replay.run();

    assertEquals(report.seed(), again.seed());
    assertEquals(report.appliedFaults(), again.appliedFaults());
    assertEquals(Optional.empty(), report.trail().firstDivergence(again.trail()));
    assertEquals(report.endInstant(), again.endInstant());
    assertEquals(firstOutcomes, replayOutcomes);
  }

  private static void registerChaosWorkload(Simulation sim, List<String> outcomes) {
    sim.host("server", ctx -> acceptLoop(ctx, ctx.network().bind(7000)));
    sim.host("relay", ctx -> ctx.sleep(Duration.ofSeconds(5)));
    sim.client("client", ctx -> chaosRounds(ctx, 0, outcomes));
  }

  private static SimFuture<Void> chaosRounds(HostContext ctx, int round, List<String> outcomes) {
    if (round == CHAOS_ROUNDS) {
      return ctx.completed(null);
    }
    SimConnection[] conn = new SimConnection[1];
    SimFuture<String> exchange = ctx.network().connect("server:7000")
        .flatMap(c -> {
          conn[0] = c;
          return c.send(bytes("round-" + round));
        })
        .flatMap(v -> conn[0].recv())
        .map(SimulationTest::text);
    return ctx.withTimeout(exchange, Duration.ofMillis(500))
        .handle((reply, error) -> {
          if (conn[0] != null) {
            conn[0].close();
          }
          outcomes.add(error == null ? reply : error.getClass().getSimpleName());
          return null;
        })
        .flatMap(v -> ctx.sleep(Duration.ofMillis(100)))
        .flatMap(v -> chaosRounds(ctx, round + 1, outcomes));
  }

  @Test
  void testReplayAppliesFaultsMadeBeforeStartFirst() {
    getConfiguration().setNetworkParameters(fixedLatency(10));
    List<String> firstResults = new ArrayList<>();
    Simulation first = newSimulation();
    registerTwoConnects(first, firstResults);
    first.partition("a", "b");
    SimulationReport report = first.run();

    assertEquals(List.of("NETWORK_UNREACHABLE", "NETWORK_UNREACHABLE"), firstResults);
    assertEquals(AppliedFault.Stage.BEFORE_START, report.appliedFaults().get(0).stage());
    assertEquals(TraceEvent.Kind.FAULT, report.trail().getEvents().get(0).kind());

    List<String> replayResults = new ArrayList<>();
    Simulation replay = Simulation.builder().configuration(getConfiguration()).replay(report).build();
    registerTwoConnects(replay, replayResults);
    SimulationReport again = replay.run();

    assertEquals(Optional.empty(), report.trail().firstDivergence(again.trail()));
    assertEquals(report.appliedFaults(), again.appliedFaults());
    assertEquals(firstResults, replayResults);
  }

  @Test
  void testReplayAppliesFaultsMadeBetweenStepsAfterTheSameAdvance() {
    getConfiguration().setNetworkParameters(fixedLatency(10));
    List<String> firstResults = new ArrayList<>();
    Simulation first = newSimulation();
    registerTwoConnects(first, firstResults);

    assertTrue(first.step());
    assertEquals(SimInstant.ofMillis(10), first.now());
    first.partition("a", "b");
    assertTrue(first.step());
    assertEquals(SimInstant.ofMillis(20), first.now());
    first.repair("a", "b");
    SimulationReport report = first.run();

    assertEquals(List.of("NETWORK_UNREACHABLE", "connected"), firstResults);
    assertThat(report.appliedFaults()).extracting(AppliedFault::stage)
        .containsExactly(AppliedFault.Stage.DIRECT, AppliedFault.Stage.DIRECT);
    assertThat(report.appliedFaults()).extracting(AppliedFault::advance).containsExactly(1L, 2L);

    List<String> replayResults = new ArrayList<>();
    Simulation replay = Simulation.builder().configuration(getConfiguration()).replay(report).build();
    registerTwoConnects(replay, replayResults);
    SimulationReport again = replay.run();

    assertEquals(Optional.empty(), report.trail().firstDivergence(again.trail()));
    assertEquals(report.appliedFaults(), again.appliedFaults());
    assertEquals(firstResults, replayResults);
  }

  /**
   * Host "b" accepts connections; client "a" connects at 10ms and, if that fails, once
   * more at 20ms.
   */
  private static void registerTwoConnects(Simulation sim, List<String> results) {
    sim.host("b", ctx -> acceptLoop(ctx, ctx.network().bind(8080)));
    sim.client("a", ctx -> ctx.sleep(Duration.ofMillis(10))
        .flatMap(v -> ctx.network().connect("b:8080"))
        .handle((conn, error) -> describe(error))
        .<Void>flatMap(outcome -> {
          results.add(outcome);
          if (isFailure(outcome)) {
            return ctx.sleep(Duration.ofMillis(10))
                .flatMap(v -> ctx.network().connect("b:8080"))
                .handle((conn, error) -> {
                  results.add(describe(error));
                  return null;
                });
          }
          return ctx.completed(null);
        }));
  }

  private static boolean isFailure(String outcome) {
    return !outcome.equals("connected");
  }

  @Test
  void testCrashBeforeStartKeepsTheHostDown() {
    Simulation sim = newSimulation();
    int[] starts = new int[1];
    HostId server = sim.host("server", ctx -> {
      starts[0]++;
      return ctx.sleep(Duration.ofMillis(1));
    });
    sim.client("client", ctx -> ctx.sleep(Duration.ofMillis(5)).flatMap(v -> ctx.sleep(Duration.ofMillis(15))));
    sim.crash(server);
    sim.scheduleFaultAt(SimInstant.ofMillis(10), new Fault.Restart(server));

    assertTrue(sim.step());
    assertEquals(SimInstant.ofMillis(5), sim.now());
    assertEquals(0, starts[0]);
    assertFalse(sim.isUp(server));

    sim.run();
    assertEquals(1, starts[0]);
    assertTrue(sim.isUp(server));
  }

  @Test
  void testReceiveAfterTimeoutGetsTheNextMessage() {
    getConfiguration().setNetworkParameters(fixedLatency(10));
    Simulation sim = newSimulation();
    List<String> results = new ArrayList<>();

    sim.client("b", ctx -> ctx.network().bind(8080).accept()
        .flatMap(conn -> ctx.withTimeout(conn.recv().map(SimulationTest::text), Duration.ofMillis(10))
            .handle((reply, error) -> results.add(error == null ? reply : error.getClass().getSimpleName()))
            .flatMap(v -> ctx.withTimeout(conn.recv().map(SimulationTest::text), Duration.ofMillis(100))))
        .map(results::add));
    sim.host("a", ctx -> ctx.network().connect("b:8080")
        .flatMap(conn -> ctx.sleep(Duration.ofMillis(20)).flatMap(v -> conn.send(bytes("x")))));

    SimulationReport report = sim.run();

    assertEquals(List.of("TimeoutException", "x"), results);
    assertEquals(SimInstant.ofMillis(30), report.endInstant());
  }

  @Test
  void testCrashAndRestart() {
    Simulation sim = newSimulation();
    int[] starts = new int[1];
    int[] cancels = new int[1];
    List<String> results = new ArrayList<>();

    HostId server = sim.host("server", new HostProcess() {
      @Override
      public SimFuture<?> start(HostContext ctx) throws Exception {
        starts[0]++;
        return ctx.network().bind(9000).accept();
      }

      @Override
      public void cancelled(HostContext ctx) {
        cancels[0]++;
      }
    });
    sim.client("client", ctx -> ctx.sleep(Duration.ofMillis(15))
        .flatMap(v -> ctx.network().connect("server:9000"))
        .handle((conn, error) -> results.add(describe(error)))
        .flatMap(v -> ctx.sleep(Duration.ofMillis(15)))
        .flatMap(v -> ctx.network().connect("server:9000"))
        .handle((conn, error) -> results.add(describe(error))));
    sim.scheduleFaultAt(SimInstant.ofMillis(10), new Fault.Crash(server));
    sim.scheduleFaultAt(SimInstant.ofMillis(20), new Fault.Restart(server));

    SimulationReport report = sim.run();

    assertEquals(2, starts[0]);
    assertEquals(1, cancels[0]);
    assertEquals(List.of("CONNECTION_REFUSED", "connected"), results);
    assertTrue(sim.isUp(server));
    assertThat(report.trail().getEvents(TraceEvent.Kind.TASK_CANCEL))
        .anyMatch(event -> event.detail().endsWith("crash"));
    assertThat(report.appliedFaults()).extracting(AppliedFault::fault)
        .containsExactly(new Fault.Crash(server), new Fault.Restart(server));
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "connected";
    }
    return ((NetworkException) error).getErrorCode().name();
  }

  @Test
  void testClockSkewOnlyChangesTheHostsView() {
    Simulation sim = newSimulation();
    SimInstant[] seen = new SimInstant[1];

    HostId a = sim.client("a", ctx -> ctx.sleep(Duration.ofMillis(10)).map(v -> seen[0] = ctx.now()));
    sim.scheduleFaultAt(SimInstant.ZERO, new Fault.ClockSkew(a, Duration.ofSeconds(5)));

    sim.run();

    assertEquals(SimInstant.ofMillis(5010), seen[0]);
    assertEquals(SimInstant.ofMillis(10), sim.now());
  }

  @Test
  void testRunCeilingStopsTheRun() {
    getConfiguration().setRunCeiling(Duration.ofSeconds(1));
    Simulation sim = newSimulation();
    int[] ticks = new int[1];
    sim.host("a", ctx -> tick(ctx, ticks));

    RunTimeoutException e = assertThrows(RunTimeoutException.class, sim::run);

    assertEquals(SimulationReport.Outcome.TIMEOUT, e.getReport().outcome());
    assertEquals(SimInstant.ofMillis(1000), e.getReport().endInstant());
    assertEquals(10, ticks[0]);
    assertThat(e.getReport().liveTasks()).hasSize(1);
  }

  private static SimFuture<Void> tick(HostContext ctx, int[] ticks) {
    return ctx.sleep(Duration.ofMillis(100)).flatMap(v -> {
      ticks[0]++;
      return tick(ctx, ticks);
    });
  }

  @Test
  void testFailFastStopsAtFirstFailure() {
    getConfiguration().setFailFast(true);
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.sleep(Duration.ofMillis(5)).map(v -> {
      throw new IllegalStateException("boom");
    }));
    sim.host("b", ctx -> ctx.sleep(Duration.ofMillis(50)));

    TaskFailedException e = assertThrows(TaskFailedException.class, sim::run);

    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals("boom", e.getCause().getMessage());
    assertEquals(SimulationReport.Outcome.TASK_FAILED, e.getReport().outcome());
    assertEquals(SimInstant.ofMillis(5), e.getReport().endInstant());
    assertThat(e.getReport().failures()).hasSize(1);
  }

  @Test
  void testFailuresAreRecordedWithoutFailFast() {
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.sleep(Duration.ofMillis(5)).map(v -> {
      throw new IllegalStateException("boom");
    }));
    sim.host("b", ctx -> ctx.sleep(Duration.ofMillis(50)));

    SimulationReport report = sim.run();

    assertEquals(SimulationReport.Outcome.COMPLETED, report.outcome());
    assertFalse(report.isSuccess());
    assertEquals(SimInstant.ofMillis(50), report.endInstant());
    assertEquals(1, report.failures().size());
    assertEquals("a", report.failures().get(0).host().name());
    assertEquals(SimInstant.ofMillis(5), report.failures().get(0).at());
  }

  @Test
  void testWithTimeoutCancelsTheUnusedTimer() {
    Simulation sim = newSimulation();
    Object[] outcome = new Object[1];
    sim.host("a", ctx -> ctx.withTimeout(ctx.sleep(Duration.ofMillis(10)), Duration.ofMillis(50))
        .handle((v, error) -> outcome[0] = error == null ? "done" : error));

    SimulationReport report = sim.run();

    assertEquals("done", outcome[0]);
    assertEquals(SimInstant.ofMillis(10), report.endInstant());
    assertEquals(0, sim.getClock().pendingTimers());
  }

  @Test
  void testSimulationRunsOnce() {
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.yieldNow());
    sim.run();

    assertThrows(IllegalStateException.class, sim::run);
    assertThrows(IllegalStateException.class, () -> sim.host("b", ctx -> ctx.yieldNow()));
    assertFalse(sim.step());
  }

  @Test
  void testHostNamesAreValidated() {
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.yieldNow());

    assertThrows(IllegalArgumentException.class, () -> sim.host("a", ctx -> ctx.yieldNow()));
    assertThrows(IllegalArgumentException.class, () -> sim.client("a:1", ctx -> ctx.yieldNow()));
    assertThrows(IllegalArgumentException.class, () -> sim.host("", ctx -> ctx.yieldNow()));
    assertThrows(IllegalArgumentException.class, () -> sim.hostId("missing"));
    assertEquals("a", sim.hostId("a").name());
  }

  @Test
  void testStepAdvancesOneEventAtATime() {
    Simulation sim = newSimulation();
    sim.host("a", ctx -> ctx.sleep(Duration.ofMillis(10)).flatMap(v -> ctx.sleep(Duration.ofMillis(10))));

    List<SimInstant> instants = new ArrayList<>();
    while (sim.step()) {
      instants.add(sim.now());
    }

    assertEquals(List.of(SimInstant.ofMillis(10), SimInstant.ofMillis(20)), instants);
    assertTrue(sim.isFinished());
    assertNotNull(sim.getReport());
    assertEquals(SimulationReport.Outcome.COMPLETED, sim.getReport().outcome());
  }

  @Test
  void testBuggifyOnlyFiresForRegisteredBugs() {
    getConfiguration().enableBug("always", 1.0).enableBug("never", 0.0);
    Simulation sim = newSimulation();
    List<Boolean> decisions = new ArrayList<>();
    sim.host("a", ctx -> {
      decisions.add(ctx.buggify("always"));
      decisions.add(ctx.buggify("never"));
      decisions.add(ctx.buggify("unregistered"));
      return ctx.yieldNow();
    });

    sim.run();

    assertEquals(List.of(true, false, false), decisions);
  }

  @Test
  void testSleepOutsideOfATaskFails() {
    Simulation sim = newSimulation();
    HostContext[] captured = new HostContext[1];
    sim.host("a", ctx -> {
      captured[0] = ctx;
      return ctx.yieldNow();
    });
    sim.run();

    assertThrows(IllegalStateException.class, () -> captured[0].sleep(Duration.ofMillis(1)));
  }

  @Test
  void testReportBeforeRunIsNull() {
    Simulation sim = newSimulation();
    assertNull(sim.getReport());
    assertEquals(getCurrentSeed(), sim.getSeed());
    assertEquals(SimInstant.ZERO, sim.now());
  }
}
