package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.core.SimPromise;
import io.github.panghy.flowsim.simulation.HostId;

import java.util.ArrayDeque;

/**
 * A bound address accepting simulated connections.
 *
 * <p>Connection requests wait on the listener's backlog until {@link #accept()} takes
 * them, in arrival order. This is the simulated counterpart of a listening socket.</p>
 */
public class SimListener {

  /**
   * A connection request waiting on the backlog. Both ends exist already; they become
   * established when the request is accepted.
   */
  record PendingConnect(SimConnection clientEnd, SimConnection serverEnd, SimPromise<SimConnection> promise) {
  }

  private final SimNetwork network;
  private final SimAddress address;
  private final HostId owner;
  private final ArrayDeque<PendingConnect> backlog = new ArrayDeque<>();
  private final ArrayDeque<SimPromise<SimConnection>> acceptWaiters = new ArrayDeque<>();
  private boolean closed;

  SimListener(SimNetwork network, SimAddress address, HostId owner) {
    this.network = network;
    this.address = address;
    this.owner = owner;
  }

  public SimAddress getAddress() {
    return address;
  }

  public HostId getOwner() {
    return owner;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Waits for the next incoming connection.
   *
   * @return A future of the server end of the connection
   * @see SimNetwork#accept(SimListener)
   */
  public SimFuture<SimConnection> accept() {
    return network.accept(this);
  }

  /**
   * Stops listening. Pending accepts fail and queued requests are refused.
   */
  public void close() {
    network.closeListener(this);
  }

  /**
   * Gets the number of connection requests waiting to be accepted.
   *
   * @return The backlog size
   */
  public int getBacklogSize() {
    return backlog.size();
  }

  ArrayDeque<PendingConnect> backlog() {
    return backlog;
  }

  ArrayDeque<SimPromise<SimConnection>> acceptWaiters() {
    return acceptWaiters;
  }

  void markClosed() {
    closed = true;
  }

  @Override
  public String toString() {
    return "SimListener{" + address + (closed ? ", closed" : "") + "}";
  }
}
