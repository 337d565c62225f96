package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.core.Dispatcher;
import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.core.SimPromise;
import io.github.panghy.flowsim.io.network.HostNetwork;
import io.github.panghy.flowsim.scheduler.CooperativeScheduler;
import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.scheduler.Task;
import io.github.panghy.flowsim.scheduler.TimerHandle;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * The primitives a host uses to interact with the simulated world: clock, network,
 * entropy and task spawning.
 *
 * <p>A HostContext is handed to {@link HostProcess#start(HostContext)} and is the only
 * way host logic reaches simulation state. There is no ambient "current simulation";
 * independent simulations can run side by side in one JVM.</p>
 *
 * <p>Suspending primitives ({@link #sleep}, {@link #yieldNow}, and the network's
 * accept, connect and recv) return {@link SimFuture}s; host logic continues in the
 * continuations attached to them.</p>
 */
public class HostContext {

  static final String RANDOM_PURPOSE = "random";
  static final String BUGGIFY_PURPOSE = "buggify";

  private final Simulation simulation;
  private final Host host;
  private final HostNetwork network;

  HostContext(Simulation simulation, Host host) {
    this.simulation = simulation;
    this.host = host;
    this.network = simulation.getNetwork().forHost(host.getId());
  }

  public HostId getHostId() {
    return host.getId();
  }

  public String getHostName() {
    return host.getId().name();
  }

  /**
   * Gets the current time as seen by this host, including any clock skew.
   *
   * @return The host's current instant
   */
  public SimInstant now() {
    return simulation.getClock().now().plus(host.getClockSkew());
  }

  /**
   * Suspends the calling task for a duration of simulated time. A zero or negative
   * duration wakes the task at the current instant.
   *
   * @param duration The duration
   * @return A future completing when the timer fires
   * @throws IllegalStateException if called outside of a task
   */
  public SimFuture<Void> sleep(Duration duration) {
    CooperativeScheduler scheduler = simulation.getScheduler();
    Task task = scheduler.requireCurrentTask("sleep");
    SimFuture<Void> future = new SimFuture<>(scheduler);
    TimerHandle handle = simulation.getClock().schedule(duration, task, future.getPromise());
    future.onCancel(() -> simulation.getClock().cancel(handle));
    return future;
  }

  /**
   * Gives other ready tasks a chance to run. The continuation attached to the returned
   * future is queued behind every task that is already ready.
   *
   * @return A completed future
   */
  public SimFuture<Void> yieldNow() {
    return SimFuture.completed(simulation.getScheduler(), null);
  }

  /**
   * Races a future against a timer. The loser is cancelled; losing to the timer fails
   * the result with a {@link TimeoutException}.
   *
   * @param future  The operation
   * @param timeout How long to wait
   * @param <T>     The value type
   * @return A future of the operation's outcome or the timeout
   */
  public <T> SimFuture<T> withTimeout(SimFuture<T> future, Duration timeout) {
    SimFuture<T> result = new SimFuture<>(simulation.getScheduler());
    SimFuture<Void> timer = sleep(timeout);
    future.addCallback(() -> {
      if (result.completeFrom(future)) {
        timer.cancel();
      }
    });
    timer.addCallback(() -> {
      if (!timer.isCancelled() &&
          result.getPromise().completeExceptionally(new TimeoutException("Timed out after " + timeout))) {
        future.cancel();
      }
    });
    return result;
  }

  /**
   * Gets this host's network handle.
   *
   * @return The network as seen by this host
   */
  public HostNetwork network() {
    return network;
  }

  /**
   * Gets this host's entropy stream for a purpose.
   *
   * @param purpose What the stream is used for
   * @return The stream
   */
  public EntropyStream entropy(String purpose) {
    return simulation.getEntropy().streamFor(host.getId(), purpose);
  }

  /**
   * Gets this host's general-purpose random stream.
   *
   * @return The stream
   */
  public EntropyStream random() {
    return entropy(RANDOM_PURPOSE);
  }

  /**
   * Starts another task on this host. If the host crashes the task is cancelled with the
   * rest of the host's tasks.
   *
   * @param name The task name
   * @param body The work to run
   * @param <T>  The result type
   * @return A future of the task's result; cancelled if the task is cancelled
   */
  public <T> SimFuture<T> spawn(String name, TaskBody<T> body) {
    Objects.requireNonNull(body, "Body cannot be null");
    CooperativeScheduler scheduler = simulation.getScheduler();
    SimFuture<T> result = new SimFuture<>(scheduler);
    scheduler.spawn(host.getId(), name, () -> {
      SimFuture<T> future = body.run(this);
      if (future != null) {
        future.addCallback(() -> result.completeFrom(future));
      }
      return future;
    }, task -> {
      if (!result.isDone()) {
        Throwable failure = task.getFailure();
        result.getPromise().completeExceptionally(failure != null ? failure :
            new CancellationException("Task " + name + " was cancelled"));
      }
    });
    return result;
  }

  /**
   * Creates a promise whose future wakes the tasks waiting on it when completed.
   *
   * @param <T> The value type
   * @return A new promise
   */
  public <T> SimPromise<T> newPromise() {
    return new SimFuture<T>(simulation.getScheduler()).getPromise();
  }

  public <T> SimFuture<T> completed(T value) {
    return SimFuture.completed(simulation.getScheduler(), value);
  }

  public <T> SimFuture<T> failed(Throwable exception) {
    return SimFuture.failed(simulation.getScheduler(), exception);
  }

  /**
   * Waits for every future, collecting their values in order.
   *
   * @param futures The futures
   * @param <T>     The value type
   * @return A future of all values
   */
  public <T> SimFuture<List<T>> allOf(Collection<SimFuture<T>> futures) {
    return SimFuture.allOf(simulation.getScheduler(), futures);
  }

  /**
   * Decides whether a registered bug fires at this point. Unregistered bugs never fire.
   *
   * <pre>{@code
   * if (ctx.buggify("slow_commit")) {
   *   return ctx.sleep(Duration.ofSeconds(1)).flatMap(v -> commit());
   * }
   * }</pre>
   *
   * @param bugId The bug ID
   * @return true if the bug should be injected
   */
  public boolean buggify(String bugId) {
    Double probability = simulation.getConfiguration().getBugProbability(bugId);
    if (probability == null) {
      return false;
    }
    return entropy(BUGGIFY_PURPOSE).chance(probability);
  }

  /**
   * Returns true with the given probability.
   *
   * @param probability The probability (0.0-1.0)
   * @return true with the given probability
   */
  public boolean sometimes(double probability) {
    return entropy(BUGGIFY_PURPOSE).chance(probability);
  }

  /**
   * Gets the dispatcher of this simulation, for building futures directly.
   *
   * @return The dispatcher
   */
  public Dispatcher getDispatcher() {
    return simulation.getScheduler();
  }

  @Override
  public String toString() {
    return "HostContext{" + host.getId() + ", incarnation=" + host.getIncarnation() + "}";
  }
}
