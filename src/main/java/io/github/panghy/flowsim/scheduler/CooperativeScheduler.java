package io.github.panghy.flowsim.scheduler;

import io.github.panghy.flowsim.core.Dispatcher;
import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.simulation.EventTrail;
import io.github.panghy.flowsim.simulation.HostId;
import io.github.panghy.flowsim.simulation.TraceEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static io.github.panghy.flowsim.util.LoggingUtil.debug;
import static io.github.panghy.flowsim.util.LoggingUtil.warn;

/**
 * CooperativeScheduler runs all host logic on one logical thread.
 *
 * <p>Work is a FIFO queue of continuations, each owned by a task. {@link #drain()} pops
 * the queue until it is empty; a continuation runs to the end without interruption, so
 * a task only gives up control at the futures it waits on. When such a future completes
 * the waiting continuation is appended to the queue (see {@link #bind(Runnable)}).</p>
 *
 * <ul>
 *   <li>No locks: the scheduler, clock and network are only touched from the thread
 *   driving the simulation.</li>
 *   <li>Tasks are held in an arena keyed by id; everything else refers to them by id
 *   or through the handles they own.</li>
 *   <li>Terminating a task (completion, failure, cancellation) synchronously cancels its
 *   outstanding timers and wake registrations and discards its queued continuations.</li>
 * </ul>
 */
public class CooperativeScheduler implements Dispatcher {
  private static final Logger LOGGER = Logger.getLogger(CooperativeScheduler.class.getName());

  private final VirtualClock clock;
  private final EventTrail trail;
  private final ArrayDeque<WorkItem> readyQueue = new ArrayDeque<>();
  private final Map<Long, Task> liveTasks = new LinkedHashMap<>();
  private final Map<Long, Consumer<Task>> terminationListeners = new LinkedHashMap<>();
  private final List<TaskFailure> failures = new ArrayList<>();
  private long nextTaskId = 1;
  private Task current;

  /**
   * A continuation queued on behalf of a task.
   */
  private record WorkItem(Task task, Runnable continuation) {
  }

  /**
   * Creates a scheduler.
   *
   * @param clock The clock used to stamp failures
   * @param trail The trail receiving task lifecycle events
   */
  public CooperativeScheduler(VirtualClock clock, EventTrail trail) {
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    this.trail = Objects.requireNonNull(trail, "Trail cannot be null");
  }

  /**
   * Creates a task and queues its start.
   *
   * @param host  The owning host
   * @param name  The task name
   * @param entry Produces the task's root future
   * @return The new task
   */
  public Task spawn(HostId host, String name, Callable<? extends SimFuture<?>> entry) {
    return spawn(host, name, entry, null);
  }

  /**
   * Creates a task and queues its start.
   *
   * @param host         The owning host
   * @param name         The task name
   * @param entry        Produces the task's root future
   * @param onTerminated Invoked once when the task completes, fails or is cancelled
   * @return The new task
   */
  public Task spawn(HostId host, String name, Callable<? extends SimFuture<?>> entry,
                    Consumer<Task> onTerminated) {
    Task task = new Task(nextTaskId++, name, host, entry);
    liveTasks.put(task.getId(), task);
    if (onTerminated != null) {
      terminationListeners.put(task.getId(), onTerminated);
    }
    trail.record(TraceEvent.Kind.TASK_SPAWN, describe(task));
    enqueue(task, () -> start(task));
    return task;
  }

  @Override
  public Runnable bind(Runnable continuation) {
    Task owner = current;
    if (owner == null) {
      return continuation;
    }
    return () -> enqueue(owner, continuation);
  }

  @Override
  public void register(SimFuture<?> future) {
    if (current != null) {
      current.register(future);
    }
  }

  /**
   * Gets the task whose continuation is running.
   *
   * @return The running task, or null outside of task code
   */
  public Task currentTask() {
    return current;
  }

  /**
   * Gets the running task, failing when called from outside a task.
   *
   * @param operation The primitive being invoked, for the error message
   * @return The running task
   * @throws IllegalStateException if no task is running
   */
  public Task requireCurrentTask(String operation) {
    if (current == null) {
      throw new IllegalStateException(operation + " called outside of a simulated task");
    }
    return current;
  }

  private void enqueue(Task task, Runnable continuation) {
    if (task.isTerminal()) {
      return;
    }
    task.continuationQueued();
    if (task.getState() == Task.TaskState.SUSPENDED) {
      task.setState(Task.TaskState.READY);
    }
    readyQueue.addLast(new WorkItem(task, continuation));
  }

  /**
   * Runs queued continuations in FIFO order until the queue is empty. Continuations
   * queued while draining run in the same drain.
   *
   * @return The number of continuations executed
   */
  public int drain() {
    int processed = 0;
    while (!readyQueue.isEmpty()) {
      WorkItem item = readyQueue.pollFirst();
      Task task = item.task();
      task.continuationDequeued();
      if (task.isTerminal()) {
        continue;
      }
      run(task, item.continuation());
      processed++;
    }
    return processed;
  }

  private void run(Task task, Runnable continuation) {
    current = task;
    task.setState(Task.TaskState.RUNNING);
    try {
      continuation.run();
    } catch (Throwable t) {
      fail(task, t);
    } finally {
      current = null;
    }
    if (!task.isTerminal()) {
      task.setState(task.getQueuedContinuations() > 0 ? Task.TaskState.READY : Task.TaskState.SUSPENDED);
    }
  }

  private void start(Task task) {
    debug(LOGGER, "task " + task.getId() + " starting");
    SimFuture<?> root;
    try {
      root = task.getEntry().call();
    } catch (Exception e) {
      fail(task, e);
      return;
    }
    if (root == null) {
      fail(task, new NullPointerException("Task entry returned no future"));
      return;
    }
    root.addCallback(() -> {
      if (task.isTerminal()) {
        return;
      }
      if (root.isCompletedExceptionally()) {
        fail(task, root.getException());
      } else {
        complete(task);
      }
    });
  }

  private void complete(Task task) {
    task.setState(Task.TaskState.COMPLETED);
    trail.record(TraceEvent.Kind.TASK_COMPLETE, describe(task));
    retire(task);
  }

  private void fail(Task task, Throwable error) {
    if (task.isTerminal()) {
      return;
    }
    task.setState(Task.TaskState.FAILED);
    task.setFailure(error);
    failures.add(new TaskFailure(task.getId(), task.getName(), task.getHost(), clock.now(), error));
    warn(LOGGER, "task " + task.getId() + " (" + task.getName() + ") on " + task.getHost() + " failed", error);
    trail.record(TraceEvent.Kind.TASK_FAIL, describe(task) + " " + error.getClass().getSimpleName());
    retire(task);
  }

  /**
   * Cancels a task: its queued continuations are discarded and every outstanding
   * timer or wake registration is removed before this method returns.
   *
   * @param task   The task to cancel
   * @param reason Why the task is cancelled, for the trail
   * @return true if the task was live
   */
  public boolean cancel(Task task, String reason) {
    if (task.isTerminal()) {
      return false;
    }
    debug(LOGGER, "cancelling task " + task.getId() + ": " + reason);
    task.setState(Task.TaskState.CANCELLED);
    readyQueue.removeIf(item -> item.task() == task);
    trail.record(TraceEvent.Kind.TASK_CANCEL, describe(task) + " " + reason);
    retire(task);
    return true;
  }

  /**
   * Cancels every live task of a host, in creation order.
   *
   * @param host   The host
   * @param reason Why the tasks are cancelled
   * @return The number of tasks cancelled
   */
  public int cancelHost(HostId host, String reason) {
    int cancelled = 0;
    for (Task task : new ArrayList<>(liveTasks.values())) {
      if (task.getHost().equals(host) && cancel(task, reason)) {
        cancelled++;
      }
    }
    return cancelled;
  }

  private void retire(Task task) {
    liveTasks.remove(task.getId());
    task.releaseRegistrations();
    Consumer<Task> listener = terminationListeners.remove(task.getId());
    if (listener != null) {
      listener.accept(task);
    }
  }

  /**
   * Checks whether there is queued work.
   *
   * @return true if the ready queue is empty
   */
  public boolean isQuiescent() {
    return readyQueue.isEmpty();
  }

  public boolean hasLiveTasks() {
    return !liveTasks.isEmpty();
  }

  /**
   * Gets the tasks that have not terminated, in creation order.
   *
   * @return The live tasks
   */
  public Collection<Task> getLiveTasks() {
    return Collections.unmodifiableCollection(liveTasks.values());
  }

  /**
   * Gets every failure captured so far, in the order the tasks failed.
   *
   * @return The task failures
   */
  public List<TaskFailure> getFailures() {
    return Collections.unmodifiableList(failures);
  }

  private static String describe(Task task) {
    return "task " + task.getId() + " (" + task.getName() + ") on " + task.getHost();
  }
}
