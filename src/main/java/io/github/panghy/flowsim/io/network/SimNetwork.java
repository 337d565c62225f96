package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.core.SimPromise;
import io.github.panghy.flowsim.scheduler.CooperativeScheduler;
import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.scheduler.VirtualClock;
import io.github.panghy.flowsim.simulation.EntropyManager;
import io.github.panghy.flowsim.simulation.EventTrail;
import io.github.panghy.flowsim.simulation.HostId;
import io.github.panghy.flowsim.simulation.TraceEvent;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

import static io.github.panghy.flowsim.util.LoggingUtil.debug;
import static io.github.panghy.flowsim.util.LoggingUtil.info;

/**
 * An in-memory transport between named hosts with configurable latency, loss and
 * partitions.
 *
 * <p>SimNetwork holds every listener, connection and in-flight message of a simulation.
 * Hosts reach each other by {@code host:port} addresses; the host part is resolved
 * through the hosts registered with {@link #registerHost(HostId)}.</p>
 *
 * <p>Key behaviors:</p>
 * <ul>
 *   <li>Each send draws a latency uniformly from the link's range and, independently, a
 *   loss decision, both from the sending host's entropy streams.</li>
 *   <li>Messages are delivered by {@link #deliverDue(SimInstant)} in delivery-instant
 *   order, then send order. A message never overtakes an earlier one on the same
 *   connection.</li>
 *   <li>Partitions are symmetric and checked on connect, on send and again on delivery,
 *   so a partition drops traffic already in flight.</li>
 *   <li>Crashing a host resets every connection it takes part in and closes its
 *   listeners.</li>
 * </ul>
 *
 * <p>Connection setup is immediate: a connect request waits on the listener's backlog
 * and both ends are established when the listener accepts it.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * SimListener listener = network.bind(server, 8080);
 * listener.accept().flatMap(conn -> conn.recv()).map(...);
 *
 * network.connect(client, SimAddress.parse("server:8080"))
 *     .flatMap(conn -> conn.send("ping".getBytes(StandardCharsets.UTF_8)));
 * }</pre>
 */
public class SimNetwork {
  private static final Logger LOGGER = Logger.getLogger(SimNetwork.class.getName());

  static final int FIRST_EPHEMERAL_PORT = 49152;
  static final String LATENCY_PURPOSE = "net.latency";
  static final String LOSS_PURPOSE = "net.loss";

  private final CooperativeScheduler scheduler;
  private final VirtualClock clock;
  private final EntropyManager entropy;
  private final EventTrail trail;
  private final NetworkSimulationParameters params;

  private final Map<String, HostState> hostsByName = new LinkedHashMap<>();
  private final Map<HostId, HostState> hosts = new LinkedHashMap<>();
  private final Map<Long, SimConnection> connections = new LinkedHashMap<>();
  private final PriorityQueue<InFlightMessage> inFlight = new PriorityQueue<>();
  private final Set<Link> partitions = new HashSet<>();
  private long nextConnectionId = 1;
  private long nextSeq = 1;

  /**
   * Network state of one host.
   */
  private static final class HostState {
    private final HostId id;
    private final TreeMap<Integer, SimListener> listeners = new TreeMap<>();
    private boolean up = true;
    private int nextEphemeralPort = FIRST_EPHEMERAL_PORT;

    HostState(HostId id) {
      this.id = id;
    }
  }

  /**
   * Creates a network.
   *
   * @param scheduler The scheduler whose tasks use the network
   * @param clock     The simulation clock
   * @param entropy   The source of latency and loss draws
   * @param trail     The trail receiving network events
   * @param params    The initial link conditions; copied
   */
  public SimNetwork(CooperativeScheduler scheduler, VirtualClock clock, EntropyManager entropy,
                    EventTrail trail, NetworkSimulationParameters params) {
    this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
    this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    this.entropy = Objects.requireNonNull(entropy, "Entropy cannot be null");
    this.trail = Objects.requireNonNull(trail, "Trail cannot be null");
    this.params = new NetworkSimulationParameters(params);
    // Validate the defaults up front
    this.params.getDefaultConditions();
  }

  /**
   * Makes a host reachable by its name.
   *
   * @param host The host
   * @throws IllegalArgumentException if a host with the same name is registered
   */
  public void registerHost(HostId host) {
    if (hostsByName.containsKey(host.name())) {
      throw new IllegalArgumentException("Host name already registered: " + host.name());
    }
    HostState state = new HostState(host);
    hostsByName.put(host.name(), state);
    hosts.put(host, state);
  }

  /**
   * Gets the per-host view of this network.
   *
   * @param host A registered host
   * @return The host's network handle
   */
  public HostNetwork forHost(HostId host) {
    hostState(host);
    return new HostNetwork(this, host);
  }

  // ---- listeners and connections ----

  /**
   * Binds a listener on the host's own address.
   *
   * @param host The binding host
   * @param port The port, or 0 for the next free ephemeral port
   * @return The listener
   * @throws NetworkException with {@code ADDRESS_IN_USE} if the port is bound
   */
  public SimListener bind(HostId host, int port) throws NetworkException {
    HostState state = hostState(host);
    int actualPort = port == 0 ? allocatePort(state) : port;
    SimAddress address = new SimAddress(host.name(), actualPort);
    if (state.listeners.containsKey(actualPort)) {
      throw new NetworkException(NetworkException.ErrorCode.ADDRESS_IN_USE, address.toString());
    }
    SimListener listener = new SimListener(this, address, host);
    state.listeners.put(actualPort, listener);
    debug(LOGGER, host + " listening on " + address);
    return listener;
  }

  /**
   * Binds a listener at an explicit address, which must name the binding host.
   *
   * @param host    The binding host
   * @param address The address
   * @return The listener
   * @throws NetworkException with {@code ADDRESS_IN_USE} if the address is bound
   */
  public SimListener bind(HostId host, SimAddress address) throws NetworkException {
    if (!address.host().equals(host.name())) {
      throw new IllegalArgumentException(host + " cannot bind foreign address " + address);
    }
    return bind(host, address.port());
  }

  /**
   * Opens a connection to a listener. The future completes once the listener accepts.
   *
   * <p>Fails with {@code CONNECTION_REFUSED} if the address is not bound or its host is
   * down, and with {@code NETWORK_UNREACHABLE} if the two hosts are partitioned. The
   * request is refused later if the listener closes before accepting it.</p>
   *
   * @param host    The connecting host
   * @param address The destination
   * @return A future of the client end of the connection
   */
  public SimFuture<SimConnection> connect(HostId host, SimAddress address) {
    HostState source = hostState(host);
    HostState target = hostsByName.get(address.host());
    if (target == null || !target.up || !source.up) {
      return refused(host, address);
    }
    if (isPartitioned(host, target.id)) {
      trail.record(TraceEvent.Kind.CONNECT, host + " -> " + address + " unreachable");
      return SimFuture.failed(scheduler,
          new NetworkException(NetworkException.ErrorCode.NETWORK_UNREACHABLE, host + " -> " + address));
    }
    SimListener listener = target.listeners.get(address.port());
    if (listener == null) {
      return refused(host, address);
    }

    SimAddress localAddress = new SimAddress(host.name(), allocatePort(source));
    SimConnection clientEnd = new SimConnection(this, nextConnectionId++, host, target.id, localAddress, address);
    SimConnection serverEnd = new SimConnection(this, nextConnectionId++, target.id, host, address, localAddress);
    clientEnd.setPeer(serverEnd);
    serverEnd.setPeer(clientEnd);

    SimFuture<SimConnection> future = new SimFuture<>(scheduler);
    SimListener.PendingConnect pending = new SimListener.PendingConnect(clientEnd, serverEnd, future.getPromise());
    trail.record(TraceEvent.Kind.CONNECT, "conn " + clientEnd.getId() + " " + localAddress + " -> " + address);

    SimPromise<SimConnection> waiter = listener.acceptWaiters().pollFirst();
    if (waiter != null) {
      establish(pending);
      waiter.complete(serverEnd);
    } else {
      listener.backlog().addLast(pending);
      future.onCancel(() -> listener.backlog().remove(pending));
    }
    return future;
  }

  private SimFuture<SimConnection> refused(HostId host, SimAddress address) {
    trail.record(TraceEvent.Kind.CONNECT, host + " -> " + address + " refused");
    return SimFuture.failed(scheduler,
        new NetworkException(NetworkException.ErrorCode.CONNECTION_REFUSED, host + " -> " + address));
  }

  /**
   * Waits for the next connection request on a listener, in arrival order. A queued
   * request whose hosts have been partitioned since it was made fails with
   * {@code NETWORK_UNREACHABLE} and is skipped.
   *
   * @param listener The listener
   * @return A future of the server end of the accepted connection
   */
  public SimFuture<SimConnection> accept(SimListener listener) {
    if (listener.isClosed()) {
      return SimFuture.failed(scheduler,
          new NetworkException(NetworkException.ErrorCode.CONNECTION_CLOSED, "listener " + listener.getAddress()));
    }
    SimListener.PendingConnect pending;
    while ((pending = listener.backlog().pollFirst()) != null) {
      SimConnection clientEnd = pending.clientEnd();
      if (isPartitioned(clientEnd.getLocalHost(), clientEnd.getRemoteHost())) {
        trail.record(TraceEvent.Kind.CONNECT, "conn " + clientEnd.getId() + " " + clientEnd.getLocalAddress()
            + " -> " + clientEnd.getRemoteAddress() + " unreachable");
        pending.promise().completeExceptionally(new NetworkException(NetworkException.ErrorCode.NETWORK_UNREACHABLE,
            clientEnd.getLocalHost() + " -> " + clientEnd.getRemoteAddress()));
        continue;
      }
      establish(pending);
      return SimFuture.completed(scheduler, pending.serverEnd());
    }
    SimFuture<SimConnection> future = new SimFuture<>(scheduler);
    SimPromise<SimConnection> promise = future.getPromise();
    listener.acceptWaiters().addLast(promise);
    future.onCancel(() -> listener.acceptWaiters().remove(promise));
    return future;
  }

  private void establish(SimListener.PendingConnect pending) {
    SimConnection clientEnd = pending.clientEnd();
    SimConnection serverEnd = pending.serverEnd();
    clientEnd.setState(SimConnection.ConnectionState.ESTABLISHED);
    serverEnd.setState(SimConnection.ConnectionState.ESTABLISHED);
    connections.put(clientEnd.getId(), clientEnd);
    connections.put(serverEnd.getId(), serverEnd);
    trail.record(TraceEvent.Kind.ACCEPT, "conn " + serverEnd.getId() + " " + serverEnd.getLocalAddress()
        + " <- " + serverEnd.getRemoteAddress());
    pending.promise().complete(clientEnd);
  }

  /**
   * Sends bytes over a connection.
   *
   * <p>Fails with {@code CONNECTION_CLOSED} if this end is closed and with
   * {@code NETWORK_UNREACHABLE} if the hosts are partitioned; in both cases nothing is
   * enqueued. A lost message still succeeds for the caller and is never delivered.</p>
   *
   * @param connection The sending end
   * @param data       The bytes; the remaining bytes are copied
   * @return A completed future
   */
  public SimFuture<Void> send(SimConnection connection, ByteBuffer data) {
    if (connection.getState() != SimConnection.ConnectionState.ESTABLISHED) {
      return closedFailure(connection);
    }
    HostId from = connection.getLocalHost();
    HostId to = connection.getRemoteHost();
    if (isPartitioned(from, to)) {
      return SimFuture.failed(scheduler, new NetworkException(NetworkException.ErrorCode.NETWORK_UNREACHABLE,
          "conn " + connection.getId() + " " + from + " -> " + to));
    }
    ByteBuffer copy = ByteBuffer.allocate(data.remaining());
    copy.put(data.duplicate());
    copy.flip();

    LinkConditions conditions = params.conditionsFor(Link.between(from, to));
    Duration latency = entropy.streamFor(from, LATENCY_PURPOSE)
        .nextDuration(conditions.minLatency(), conditions.maxLatency());
    boolean lost = entropy.streamFor(from, LOSS_PURPOSE).chance(conditions.lossRate());
    long seq = nextSeq++;
    if (lost) {
      trail.record(TraceEvent.Kind.DROP, "msg#" + seq + " conn " + connection.getId() + " "
          + copy.remaining() + " bytes lost");
      return SimFuture.completed(scheduler, null);
    }
    enqueue(new InFlightMessage(seq, connection, copy, deliveryInstant(connection, latency)));
    return SimFuture.completed(scheduler, null);
  }

  private SimInstant deliveryInstant(SimConnection connection, Duration latency) {
    SimInstant deliverAt = SimInstant.max(clock.now().plus(latency), connection.getLastDelivery());
    connection.setLastDelivery(deliverAt);
    return deliverAt;
  }

  private void enqueue(InFlightMessage message) {
    inFlight.add(message);
    trail.record(TraceEvent.Kind.SEND, message.toString());
  }

  /**
   * Receives up to {@code maxBytes}, waiting until data is buffered. Fails with
   * {@code CONNECTION_CLOSED} once the connection is closed and the buffer is empty.
   *
   * @param connection The receiving end
   * @param maxBytes   The maximum number of bytes to return
   * @return A future of the bytes
   */
  public SimFuture<ByteBuffer> recv(SimConnection connection, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
    }
    if (connection.getState() == SimConnection.ConnectionState.CLOSED) {
      return closedFailure(connection);
    }
    if (!connection.receiveBuffer().isEmpty()) {
      return SimFuture.completed(scheduler, connection.read(maxBytes));
    }
    if (connection.isPeerClosed()) {
      return closedFailure(connection);
    }
    SimFuture<ByteBuffer> future = new SimFuture<>(scheduler);
    SimConnection.RecvWaiter waiter = new SimConnection.RecvWaiter(future.getPromise(), maxBytes);
    connection.recvWaiters().addLast(waiter);
    future.onCancel(() -> connection.recvWaiters().remove(waiter));
    return future;
  }

  /**
   * Receives everything buffered, waiting until data is available.
   *
   * @param connection The receiving end
   * @return A future of the bytes
   */
  public SimFuture<ByteBuffer> recv(SimConnection connection) {
    return recv(connection, Integer.MAX_VALUE);
  }

  /**
   * Closes one end gracefully. Local receivers fail, unread data is discarded and the
   * peer sees the close in order behind the data already sent.
   *
   * @param connection The end to close
   */
  public void close(SimConnection connection) {
    if (connection.getState() == SimConnection.ConnectionState.CLOSED) {
      return;
    }
    boolean wasEstablished = connection.getState() == SimConnection.ConnectionState.ESTABLISHED;
    connection.setState(SimConnection.ConnectionState.CLOSED);
    connection.receiveBuffer().clear();
    failWaiters(connection);
    connections.remove(connection.getId());
    trail.record(TraceEvent.Kind.CLOSE, "conn " + connection.getId() + " " + connection.getLocalAddress());
    if (wasEstablished && connection.getPeer().getState() != SimConnection.ConnectionState.CLOSED) {
      LinkConditions conditions = params.conditionsFor(
          Link.between(connection.getLocalHost(), connection.getRemoteHost()));
      Duration latency = entropy.streamFor(connection.getLocalHost(), LATENCY_PURPOSE)
          .nextDuration(conditions.minLatency(), conditions.maxLatency());
      enqueue(new InFlightMessage(nextSeq++, connection, null, deliveryInstant(connection, latency)));
    }
  }

  /**
   * Closes a listener: waiting accepts fail and queued connection requests are refused.
   *
   * @param listener The listener
   */
  public void closeListener(SimListener listener) {
    if (listener.isClosed()) {
      return;
    }
    listener.markClosed();
    HostState state = hosts.get(listener.getOwner());
    state.listeners.remove(listener.getAddress().port());
    List<SimPromise<SimConnection>> waiters = new ArrayList<>(listener.acceptWaiters());
    listener.acceptWaiters().clear();
    for (SimPromise<SimConnection> waiter : waiters) {
      waiter.completeExceptionally(new NetworkException(NetworkException.ErrorCode.CONNECTION_CLOSED,
          "listener " + listener.getAddress()));
    }
    List<SimListener.PendingConnect> pending = new ArrayList<>(listener.backlog());
    listener.backlog().clear();
    for (SimListener.PendingConnect request : pending) {
      request.promise().completeExceptionally(new NetworkException(NetworkException.ErrorCode.CONNECTION_REFUSED,
          request.clientEnd().getLocalAddress() + " -> " + listener.getAddress()));
    }
    debug(LOGGER, "listener " + listener.getAddress() + " closed");
  }

  private <T> SimFuture<T> closedFailure(SimConnection connection) {
    return SimFuture.failed(scheduler, new NetworkException(NetworkException.ErrorCode.CONNECTION_CLOSED,
        "conn " + connection.getId() + " " + connection.getLocalAddress()));
  }

  private void failWaiters(SimConnection connection) {
    List<SimConnection.RecvWaiter> waiters = new ArrayList<>(connection.recvWaiters());
    connection.recvWaiters().clear();
    for (SimConnection.RecvWaiter waiter : waiters) {
      waiter.promise().completeExceptionally(new NetworkException(NetworkException.ErrorCode.CONNECTION_CLOSED,
          "conn " + connection.getId() + " " + connection.getLocalAddress()));
    }
  }

  // ---- delivery ----

  /**
   * Gets the delivery instant of the earliest in-flight message.
   *
   * @return The instant, or empty if nothing is in flight
   */
  public Optional<SimInstant> nextDeliveryInstant() {
    InFlightMessage head = inFlight.peek();
    return head == null ? Optional.empty() : Optional.of(head.getDeliverAt());
  }

  /**
   * Delivers every message due at or before the instant, in delivery-instant order then
   * send order. Messages whose link is partitioned now, or whose destination is closed,
   * are dropped.
   *
   * @param instant The current instant
   * @return The number of messages delivered
   */
  public int deliverDue(SimInstant instant) {
    int delivered = 0;
    while (!inFlight.isEmpty() && !inFlight.peek().getDeliverAt().isAfter(instant)) {
      InFlightMessage message = inFlight.poll();
      if (deliver(message)) {
        delivered++;
      }
    }
    return delivered;
  }

  private boolean deliver(InFlightMessage message) {
    SimConnection source = message.getSource();
    SimConnection target = source.getPeer();
    if (isPartitioned(source.getLocalHost(), target.getLocalHost())) {
      trail.record(TraceEvent.Kind.DROP, message + " partitioned");
      return false;
    }
    if (target.getState() == SimConnection.ConnectionState.CLOSED) {
      trail.record(TraceEvent.Kind.DROP, message + " destination closed");
      return false;
    }
    trail.record(TraceEvent.Kind.DELIVER, message.toString());
    if (message.isFin()) {
      target.markPeerClosed();
      failWaiters(target);
      return true;
    }
    target.receiveBuffer().addLast(message.getPayload());
    while (!target.receiveBuffer().isEmpty() && !target.recvWaiters().isEmpty()) {
      SimConnection.RecvWaiter waiter = target.recvWaiters().pollFirst();
      waiter.promise().complete(target.read(waiter.maxBytes()));
    }
    return true;
  }

  /**
   * Gets the number of messages sent but not yet delivered or dropped.
   *
   * @return The in-flight count
   */
  public int inFlightCount() {
    return inFlight.size();
  }

  // ---- partitions and link conditions ----

  /**
   * Partitions two hosts in both directions.
   *
   * @param a One host
   * @param b The other host
   */
  public void partition(HostId a, HostId b) {
    if (a.equals(b)) {
      throw new IllegalArgumentException("Cannot partition a host from itself: " + a);
    }
    if (partitions.add(Link.between(a, b))) {
      info(LOGGER, "partitioned " + a + " and " + b);
    }
  }

  /**
   * Removes the partition between two hosts, in both directions.
   *
   * @param a One host
   * @param b The other host
   */
  public void repair(HostId a, HostId b) {
    if (partitions.remove(Link.between(a, b))) {
      info(LOGGER, "repaired " + a + " and " + b);
    }
  }

  public boolean isPartitioned(HostId a, HostId b) {
    return !a.equals(b) && partitions.contains(Link.between(a, b));
  }

  /**
   * Changes the latency range of a link. Messages already in flight keep their
   * delivery instant.
   *
   * @param link The link
   * @param min  The minimum one-way latency
   * @param max  The maximum one-way latency
   */
  public void setLinkLatency(Link link, Duration min, Duration max) {
    params.setLinkConditions(link, params.conditionsFor(link).withLatency(min, max));
  }

  /**
   * Changes the loss rate of a link.
   *
   * @param link The link
   * @param rate The loss probability (0.0-1.0)
   */
  public void setLinkLoss(Link link, double rate) {
    params.setLinkConditions(link, params.conditionsFor(link).withLossRate(rate));
  }

  public LinkConditions getLinkConditions(Link link) {
    return params.conditionsFor(link);
  }

  // ---- host lifecycle ----

  /**
   * Takes a host down: every connection it takes part in is reset on both ends, its
   * listeners close and new connections to it are refused until it restarts.
   *
   * @param host The host
   */
  public void crashHost(HostId host) {
    HostState state = hostState(host);
    if (!state.up) {
      return;
    }
    state.up = false;
    for (SimListener listener : new ArrayList<>(state.listeners.values())) {
      closeListener(listener);
    }
    for (SimConnection connection : new ArrayList<>(connections.values())) {
      if (connection.getLocalHost().equals(host) || connection.getRemoteHost().equals(host)) {
        reset(connection);
      }
    }
  }

  private void reset(SimConnection connection) {
    connection.setState(SimConnection.ConnectionState.CLOSED);
    connection.markReset();
    connection.receiveBuffer().clear();
    connections.remove(connection.getId());
    trail.record(TraceEvent.Kind.CLOSE, "conn " + connection.getId() + " " + connection.getLocalAddress() + " reset");
    failWaiters(connection);
  }

  /**
   * Brings a crashed host back. It starts with no listeners and no connections.
   *
   * @param host The host
   */
  public void restartHost(HostId host) {
    hostState(host).up = true;
  }

  public boolean isUp(HostId host) {
    return hostState(host).up;
  }

  /**
   * Gets the open connection ends owned by a host, in creation order.
   *
   * @param host The host
   * @return The connections
   */
  public List<SimConnection> getConnections(HostId host) {
    List<SimConnection> result = new ArrayList<>();
    for (SimConnection connection : connections.values()) {
      if (connection.getLocalHost().equals(host)) {
        result.add(connection);
      }
    }
    return result;
  }

  private int allocatePort(HostState state) {
    while (state.listeners.containsKey(state.nextEphemeralPort)) {
      state.nextEphemeralPort++;
    }
    if (state.nextEphemeralPort > 65535) {
      throw new IllegalStateException("Ephemeral ports exhausted on " + state.id);
    }
    return state.nextEphemeralPort++;
  }

  private HostState hostState(HostId host) {
    HostState state = hosts.get(host);
    if (state == null) {
      throw new IllegalArgumentException("Unknown host: " + host);
    }
    return state;
  }
}
