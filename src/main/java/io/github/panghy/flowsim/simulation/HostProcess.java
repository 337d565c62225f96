package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.core.SimFuture;

/**
 * The entry point of a simulated host.
 *
 * <p>{@link #start(HostContext)} returns the host's top-level future; the host's main
 * task ends when that future completes. After a crash and restart {@code start} is
 * invoked again, so state kept in local variables of {@code start} does not survive a
 * crash.</p>
 *
 * <pre>{@code
 * sim.host("server", ctx -> {
 *   SimListener listener = ctx.network().bind(8080);
 *   return listener.accept().flatMap(conn -> conn.recv().flatMap(conn::send));
 * });
 * }</pre>
 */
@FunctionalInterface
public interface HostProcess {

  /**
   * Starts the host.
   *
   * @param ctx The host's view of the simulation
   * @return The future of the host's top-level work
   * @throws Exception if the host fails to start; recorded as a task failure
   */
  SimFuture<?> start(HostContext ctx) throws Exception;

  /**
   * Invoked after the host's top-level task has been terminated by a crash.
   *
   * @param ctx The host's view of the simulation
   */
  default void cancelled(HostContext ctx) {
  }
}
