package io.github.panghy.flowsim.core;

/**
 * Decides where the continuations of a {@link SimFuture} run.
 *
 * <p>Inside a simulation the dispatcher is the cooperative scheduler: a continuation
 * registered by a task is captured together with that task and, once the future
 * completes, appended to the ready queue instead of running inline. Outside of a task
 * (harness code, unit tests) continuations run inline.</p>
 */
public interface Dispatcher {

  /**
   * A dispatcher that runs every continuation inline and tracks nothing.
   */
  Dispatcher INLINE = new Dispatcher() {
    @Override
    public Runnable bind(Runnable continuation) {
      return continuation;
    }

    @Override
    public void register(SimFuture<?> future) {
    }
  };

  /**
   * Captures the current task (if any) for the given continuation. The returned
   * runnable is invoked when the future completes.
   *
   * @param continuation The user continuation
   * @return A runnable that schedules or runs the continuation
   */
  Runnable bind(Runnable continuation);

  /**
   * Registers a primitive future with the current task so that terminating the task
   * cancels it.
   *
   * @param future The future holding a wake registration
   */
  void register(SimFuture<?> future);
}
