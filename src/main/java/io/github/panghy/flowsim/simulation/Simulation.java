package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.io.network.Link;
import io.github.panghy.flowsim.io.network.NetworkSimulationParameters;
import io.github.panghy.flowsim.io.network.SimNetwork;
import io.github.panghy.flowsim.scheduler.CooperativeScheduler;
import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.scheduler.Task;
import io.github.panghy.flowsim.scheduler.TaskFailure;
import io.github.panghy.flowsim.scheduler.TimerEntry;
import io.github.panghy.flowsim.scheduler.VirtualClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import static io.github.panghy.flowsim.util.LoggingUtil.debug;
import static io.github.panghy.flowsim.util.LoggingUtil.error;
import static io.github.panghy.flowsim.util.LoggingUtil.info;
import static io.github.panghy.flowsim.util.LoggingUtil.warn;

/**
 * A deterministic simulation of a set of hosts: one virtual clock, one simulated
 * network, entropy derived from one seed and a single cooperative scheduler.
 *
 * <p>The run loop repeats:</p>
 * <ol>
 *   <li>drain the scheduler until no task is ready;</li>
 *   <li>stop if the run is complete;</li>
 *   <li>find the earliest pending timer, message delivery or fault, and report a
 *   deadlock if there is none;</li>
 *   <li>advance the clock to that instant, then apply due faults, deliver due messages
 *   and fire due timers.</li>
 * </ol>
 *
 * <p>With clients registered the run is complete once every client's top-level task
 * has terminated; otherwise it is complete once no task is left. For a given seed and
 * identical host logic two runs produce the same event trail.</p>
 *
 * <pre>{@code
 * Simulation sim = Simulation.builder().seed(42).build();
 * sim.host("server", ctx -> {
 *   SimListener listener = ctx.network().bind(8080);
 *   return listener.accept().flatMap(conn -> conn.recv().flatMap(conn::send));
 * });
 * sim.client("client", ctx -> ctx.network().connect("server:8080")
 *     .flatMap(conn -> conn.send(PING).flatMap(v -> conn.recv())));
 * SimulationReport report = sim.run();
 * }</pre>
 *
 * <p>Instances are not thread-safe; each simulation is driven by one thread.</p>
 */
public class Simulation {
  private static final Logger LOGGER = Logger.getLogger(Simulation.class.getName());

  static final String CHAOS_PURPOSE = "chaos";

  private enum Phase {
    NEW,
    RUNNING,
    FINISHED
  }

  private final SimulationConfiguration config;
  private final long seed;
  private final VirtualClock clock;
  private final EventTrail trail;
  private final CooperativeScheduler scheduler;
  private final EntropyManager entropy;
  private final SimNetwork network;
  private final FaultScheduler faults = new FaultScheduler();
  private final FaultTarget target = new Target();
  private final boolean generateChaos;

  private final Map<HostId, Host> hosts = new LinkedHashMap<>();
  private final Map<String, Host> hostsByName = new LinkedHashMap<>();
  private final List<AppliedFault> appliedFaults = new ArrayList<>();
  private final List<Fault> replayBeforeStart = new ArrayList<>();
  private final Map<Long, List<Fault>> replayDirect = new HashMap<>();
  private int nextHostId = 1;
  private long advances;
  private Phase phase = Phase.NEW;
  private SimulationReport report;

  private Simulation(SimulationConfiguration config, List<AppliedFault> explicitFaults, boolean generateChaos) {
    this.config = config;
    this.seed = config.getSeed();
    this.generateChaos = generateChaos;
    this.clock = new VirtualClock();
    this.trail = new EventTrail(clock, config.isTraceRecording());
    this.scheduler = new CooperativeScheduler(clock, trail);
    this.entropy = new EntropyManager(seed);
    this.network = new SimNetwork(scheduler, clock, entropy, trail, config.getNetworkParameters());
    for (AppliedFault fault : explicitFaults) {
      switch (fault.stage()) {
        case BEFORE_START -> replayBeforeStart.add(fault.fault());
        case SCHEDULED -> faults.scheduleAt(fault.at(), fault.fault());
        case DIRECT -> replayDirect.computeIfAbsent(fault.advance(), k -> new ArrayList<>()).add(fault.fault());
        default -> throw new IllegalStateException("Unexpected stage: " + fault.stage());
      }
    }
  }

  /**
   * Creates a builder for a simulation.
   *
   * @return A new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  // ---- host registration ----

  /**
   * Registers a long-lived host.
   *
   * @param name    The host name, unique within the simulation
   * @param process The host's entry point
   * @return The host's id
   */
  public HostId host(String name, HostProcess process) {
    return register(name, process, false);
  }

  /**
   * Registers a client host. Once any client is registered the run completes when every
   * client's top-level task has terminated, whatever the other hosts are doing.
   *
   * @param name    The host name, unique within the simulation
   * @param process The client's entry point
   * @return The host's id
   */
  public HostId client(String name, HostProcess process) {
    return register(name, process, true);
  }

  private HostId register(String name, HostProcess process, boolean client) {
    Objects.requireNonNull(name, "Host name cannot be null");
    Objects.requireNonNull(process, "Host process cannot be null");
    if (phase != Phase.NEW) {
      throw new IllegalStateException("Hosts must be registered before the simulation starts");
    }
    if (name.isEmpty() || name.indexOf(':') >= 0) {
      throw new IllegalArgumentException("Invalid host name: '" + name + "'");
    }
    if (hostsByName.containsKey(name)) {
      throw new IllegalArgumentException("Host name already registered: " + name);
    }
    HostId id = new HostId(nextHostId++, name);
    Host host = new Host(id, process, client);
    hosts.put(id, host);
    hostsByName.put(name, host);
    network.registerHost(id);
    host.setContext(new HostContext(this, host));
    debug(LOGGER, "registered " + (client ? "client " : "host ") + id);
    return id;
  }

  /**
   * Looks up a host by name.
   *
   * @param name The host name
   * @return The host's id
   * @throws IllegalArgumentException if no host has that name
   */
  public HostId hostId(String name) {
    Host host = hostsByName.get(name);
    if (host == null) {
      throw new IllegalArgumentException("Unknown host: " + name);
    }
    return host.getId();
  }

  public List<HostId> getHosts() {
    return new ArrayList<>(hosts.keySet());
  }

  // ---- fault control ----

  /**
   * Schedules a fault at an absolute instant.
   *
   * @param instant The instant
   * @param fault   The fault
   */
  public void scheduleFaultAt(SimInstant instant, Fault fault) {
    if (instant.isBefore(clock.now())) {
      throw new IllegalArgumentException("Cannot schedule a fault in the past: " + instant);
    }
    faults.scheduleAt(instant, fault);
  }

  /**
   * Schedules a fault after a delay from now.
   *
   * @param delay The delay
   * @param fault The fault
   */
  public void scheduleFault(Duration delay, Fault fault) {
    faults.scheduleAfter(clock.now(), delay, fault);
  }

  /**
   * Applies a fault immediately. Before the run starts the fault takes effect ahead of
   * the hosts' entry points; once running it is recorded with the number of clock
   * advances made so far, so a replay applies it right after the same advance.
   *
   * @param fault The fault
   */
  public void applyFault(Fault fault) {
    Objects.requireNonNull(fault, "Fault cannot be null");
    apply(fault, phase == Phase.NEW ? AppliedFault.Stage.BEFORE_START : AppliedFault.Stage.DIRECT);
  }

  private void apply(Fault fault, AppliedFault.Stage stage) {
    long advance = stage == AppliedFault.Stage.DIRECT ? advances : 0;
    appliedFaults.add(new AppliedFault(clock.now(), fault, stage, advance));
    trail.record(TraceEvent.Kind.FAULT, fault.toString());
    info(LOGGER, "applying " + fault + " at " + clock.now());
    fault.applyTo(target);
  }

  public void partition(HostId a, HostId b) {
    applyFault(new Fault.Partition(a, b));
  }

  public void partition(String a, String b) {
    partition(hostId(a), hostId(b));
  }

  public void repair(HostId a, HostId b) {
    applyFault(new Fault.Heal(a, b));
  }

  public void repair(String a, String b) {
    repair(hostId(a), hostId(b));
  }

  public void crash(HostId host) {
    applyFault(new Fault.Crash(host));
  }

  public void restart(HostId host) {
    applyFault(new Fault.Restart(host));
  }

  // ---- run control ----

  /**
   * Drives the simulation until it completes.
   *
   * @return The report of a completed run; task failures are listed in it
   * @throws DeadlockException     if tasks remain but nothing can wake them
   * @throws RunTimeoutException   if the run ceiling is reached
   * @throws TaskFailedException   if fail-fast is configured and a task fails
   * @throws IllegalStateException if the simulation has already finished
   */
  public SimulationReport run() {
    if (phase == Phase.FINISHED) {
      throw new IllegalStateException("Simulation has already run");
    }
    boolean running = true;
    while (running) {
      running = step();
    }
    return report;
  }

  /**
   * Runs one iteration of the loop: drains ready work, then advances to the next event
   * and applies it.
   *
   * @return false once the run has finished
   * @throws DeadlockException   if tasks remain but nothing can wake them
   * @throws RunTimeoutException if the run ceiling is reached
   * @throws TaskFailedException if fail-fast is configured and a task fails
   */
  public boolean step() {
    if (phase == Phase.FINISHED) {
      return false;
    }
    if (phase == Phase.NEW) {
      begin();
    }
    scheduler.drain();

    List<TaskFailure> failures = scheduler.getFailures();
    if (config.isFailFast() && !failures.isEmpty()) {
      throw new TaskFailedException(finish(SimulationReport.Outcome.TASK_FAILED), failures.get(0));
    }
    if (isComplete()) {
      finish(SimulationReport.Outcome.COMPLETED);
      return false;
    }
    Optional<SimInstant> next = nextEventInstant();
    if (next.isEmpty()) {
      throw new DeadlockException(finish(SimulationReport.Outcome.DEADLOCK));
    }
    Duration ceiling = config.getRunCeiling();
    if (ceiling != null) {
      SimInstant limit = SimInstant.ZERO.plus(ceiling);
      if (next.get().isAfter(limit)) {
        if (limit.isAfter(clock.now())) {
          clock.advanceTo(limit);
        }
        throw new RunTimeoutException(finish(SimulationReport.Outcome.TIMEOUT));
      }
    }
    advance(next.get());
    return true;
  }

  private void begin() {
    for (Fault fault : replayBeforeStart) {
      apply(fault, AppliedFault.Stage.BEFORE_START);
    }
    phase = Phase.RUNNING;
    info(LOGGER, "starting simulation with seed " + seed + ", " + hosts.size() + " host(s), " + config);
    if (generateChaos && config.getChaosFaultCount() > 0) {
      List<HostId> crashable = new ArrayList<>();
      for (Host host : hosts.values()) {
        if (!host.isClient()) {
          crashable.add(host.getId());
        }
      }
      ChaosGenerator generator = new ChaosGenerator(entropy.streamFor(HostId.SIMULATOR, CHAOS_PURPOSE),
          config.getNetworkParameters());
      List<ScheduledFault> generated = generator.generate(faults, clock.now(), getHosts(), crashable,
          config.getChaosFaultCount(), config.getChaosDuration());
      info(LOGGER, "generated " + generated.size() + " chaos fault(s)");
    }
    for (Host host : hosts.values()) {
      if (host.isUp()) {
        startHost(host);
      }
    }
    applyReplayedDirectFaults();
  }

  private void applyReplayedDirectFaults() {
    List<Fault> replayed = replayDirect.remove(advances);
    if (replayed != null) {
      for (Fault fault : replayed) {
        apply(fault, AppliedFault.Stage.DIRECT);
      }
    }
  }

  private void startHost(Host host) {
    HostContext ctx = host.getContext();
    Task task = scheduler.spawn(host.getId(), host.getId().name(), () -> host.getProcess().start(ctx));
    host.started(task);
  }

  private boolean isComplete() {
    boolean anyClient = false;
    for (Host host : hosts.values()) {
      if (host.isClient()) {
        anyClient = true;
        Task main = host.getMainTask();
        if (main != null && !main.isTerminal()) {
          return false;
        }
      }
    }
    return anyClient || !scheduler.hasLiveTasks();
  }

  private Optional<SimInstant> nextEventInstant() {
    SimInstant next = null;
    for (Optional<SimInstant> candidate : List.of(clock.nextDeadline(), network.nextDeliveryInstant(),
        faults.nextInstant())) {
      if (candidate.isPresent() && (next == null || candidate.get().isBefore(next))) {
        next = candidate.get();
      }
    }
    return Optional.ofNullable(next);
  }

  private void advance(SimInstant instant) {
    advances++;
    List<TimerEntry> due = clock.advanceTo(instant);
    for (Fault fault : faults.due(instant)) {
      apply(fault, AppliedFault.Stage.SCHEDULED);
    }
    network.deliverDue(instant);
    for (TimerEntry timer : due) {
      if (timer.fire()) {
        trail.record(TraceEvent.Kind.TIMER_FIRE, timer.getHandle() + " task " + timer.getOwner().getId());
      }
    }
    applyReplayedDirectFaults();
  }

  private SimulationReport finish(SimulationReport.Outcome outcome) {
    List<String> live = new ArrayList<>();
    for (Task task : scheduler.getLiveTasks()) {
      live.add("task " + task.getId() + " (" + task.getName() + ") on " + task.getHost() + " " + task.getState());
    }
    report = new SimulationReport(seed, outcome, clock.now(), appliedFaults, scheduler.getFailures(), live, trail);
    phase = Phase.FINISHED;
    for (Task task : new ArrayList<>(scheduler.getLiveTasks())) {
      scheduler.cancel(task, "teardown");
    }
    if (outcome == SimulationReport.Outcome.COMPLETED) {
      info(LOGGER, "simulation completed at " + clock.now() + ": " + report.reproduction());
    } else {
      error(LOGGER, "simulation ended with " + outcome + ": " + report.reproduction());
    }
    return report;
  }

  // ---- accessors ----

  public long getSeed() {
    return seed;
  }

  public SimInstant now() {
    return clock.now();
  }

  public boolean isFinished() {
    return phase == Phase.FINISHED;
  }

  /**
   * Gets the report of a finished run.
   *
   * @return The report, or null while the run is in progress
   */
  public SimulationReport getReport() {
    return report;
  }

  public EventTrail getTrail() {
    return trail;
  }

  public SimNetwork getNetwork() {
    return network;
  }

  public SimulationConfiguration getConfiguration() {
    return config;
  }

  /**
   * Gets the faults applied so far, in application order.
   *
   * @return The applied faults
   */
  public List<AppliedFault> getAppliedFaults() {
    return Collections.unmodifiableList(appliedFaults);
  }

  public List<ScheduledFault> getPendingFaults() {
    return faults.pending();
  }

  /**
   * Checks whether a host is up.
   *
   * @param id The host
   * @return false between a crash and the following restart
   */
  public boolean isUp(HostId id) {
    return requireHost(id).isUp();
  }

  VirtualClock getClock() {
    return clock;
  }

  CooperativeScheduler getScheduler() {
    return scheduler;
  }

  EntropyManager getEntropy() {
    return entropy;
  }

  private Host requireHost(HostId id) {
    Host host = hosts.get(id);
    if (host == null) {
      throw new IllegalArgumentException("Unknown host: " + id);
    }
    return host;
  }

  /**
   * Applies fault effects to the network and the hosts.
   */
  private final class Target implements FaultTarget {

    @Override
    public void partition(HostId a, HostId b) {
      network.partition(requireHost(a).getId(), requireHost(b).getId());
    }

    @Override
    public void repair(HostId a, HostId b) {
      network.repair(requireHost(a).getId(), requireHost(b).getId());
    }

    @Override
    public void setLinkLatency(Link link, Duration min, Duration max) {
      network.setLinkLatency(link, min, max);
    }

    @Override
    public void setLinkLoss(Link link, double rate) {
      network.setLinkLoss(link, rate);
    }

    @Override
    public void crash(HostId id) {
      Host host = requireHost(id);
      if (!host.isUp()) {
        debug(LOGGER, id + " is already down");
        return;
      }
      host.setUp(false);
      Task main = host.getMainTask();
      boolean mainWasLive = main != null && !main.isTerminal();
      int cancelled = scheduler.cancelHost(id, "crash");
      network.crashHost(id);
      warn(LOGGER, id + " crashed at " + clock.now() + ", " + cancelled + " task(s) cancelled");
      if (mainWasLive) {
        host.getProcess().cancelled(host.getContext());
      }
    }

    @Override
    public void restart(HostId id) {
      Host host = requireHost(id);
      if (host.isUp()) {
        warn(LOGGER, "ignoring restart of " + id + ": host is up");
        return;
      }
      host.setUp(true);
      network.restartHost(id);
      startHost(host);
      info(LOGGER, id + " restarted at " + clock.now());
    }

    @Override
    public void setClockSkew(HostId id, Duration offset) {
      requireHost(id).setClockSkew(offset);
    }
  }

  /**
   * Builds a {@link Simulation}.
   *
   * <pre>{@code
   * Simulation sim = Simulation.builder()
   *     .seed(SimulationConfiguration.seedFromEnvironment(42))
   *     .runCeiling(Duration.ofMinutes(1))
   *     .build();
   *
   * // Later, reproduce a failed run exactly
   * Simulation again = Simulation.builder().replay(report).build();
   * }</pre>
   */
  public static final class Builder {

    private SimulationConfiguration config = new SimulationConfiguration();
    private final List<AppliedFault> explicitFaults = new ArrayList<>();
    private boolean replay;

    private Builder() {
    }

    /**
     * Uses a copy of the given configuration. Settings made on the builder afterwards
     * apply to the copy.
     *
     * @param configuration The configuration
     * @return This builder
     */
    public Builder configuration(SimulationConfiguration configuration) {
      this.config = configuration.copy();
      return this;
    }

    public Builder seed(long seed) {
      config.setSeed(seed);
      return this;
    }

    public Builder runCeiling(Duration ceiling) {
      config.setRunCeiling(ceiling);
      return this;
    }

    public Builder failFast(boolean failFast) {
      config.setFailFast(failFast);
      return this;
    }

    public Builder networkParameters(NetworkSimulationParameters params) {
      config.setNetworkParameters(params);
      return this;
    }

    /**
     * Generates a chaos schedule when the run starts.
     *
     * @param faultCount The number of disruptions
     * @param window     The window the disruptions fall in
     * @return This builder
     */
    public Builder chaos(int faultCount, Duration window) {
      config.setChaosFaultCount(faultCount).setChaosDuration(window);
      return this;
    }

    /**
     * Schedules a fault at an absolute instant. The hosts it names must be registered
     * before the run starts.
     *
     * @param instant The instant
     * @param fault   The fault
     * @return This builder
     */
    public Builder fault(SimInstant instant, Fault fault) {
      explicitFaults.add(new AppliedFault(instant, fault));
      return this;
    }

    /**
     * Reproduces a previous run: its seed is reused and the faults it applied are applied
     * again at the same points of the run loop, instead of generating chaos. Faults applied
     * before the start take effect before the hosts start, scheduled faults are scheduled
     * at their instants, and faults applied directly while running are applied right after
     * the same clock advance. Hosts must be registered in the same order as in the original
     * run, and the faults must not be applied a second time by hand.
     *
     * @param previous The report of the run to reproduce
     * @return This builder
     */
    public Builder replay(SimulationReport previous) {
      config.setSeed(previous.seed());
      explicitFaults.clear();
      explicitFaults.addAll(previous.appliedFaults());
      replay = true;
      return this;
    }

    public Simulation build() {
      return new Simulation(config.copy(), explicitFaults, !replay);
    }
  }
}
