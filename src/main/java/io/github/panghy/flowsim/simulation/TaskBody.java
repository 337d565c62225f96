package io.github.panghy.flowsim.simulation;

import io.github.panghy.flowsim.core.SimFuture;

/**
 * Work run as an additional task of a host.
 *
 * @param <T> The result type
 * @see HostContext#spawn(String, TaskBody)
 */
@FunctionalInterface
public interface TaskBody<T> {

  SimFuture<T> run(HostContext ctx) throws Exception;
}
