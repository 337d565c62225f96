package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.core.SimPromise;
import io.github.panghy.flowsim.scheduler.SimInstant;
import io.github.panghy.flowsim.simulation.HostId;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;

/**
 * One end of a simulated stream connection.
 *
 * <p>Connections always come in pairs, each end owned by one host. Data sent from one end
 * travels through the {@link SimNetwork} as in-flight messages and is appended to the
 * peer's receive buffer when delivered. Messages on a connection are never reordered.</p>
 *
 * <p>A connection is created in {@link ConnectionState#CONNECTING}, becomes
 * {@link ConnectionState#ESTABLISHED} when the listener accepts it and ends in
 * {@link ConnectionState#CLOSED} after a local close or a reset. When the peer closes
 * gracefully this end stays established: buffered data can still be received, after
 * which {@link #recv()} fails with {@code CONNECTION_CLOSED}.</p>
 *
 * @see SimNetwork
 */
public class SimConnection {

  /**
   * The lifecycle of a connection end.
   */
  public enum ConnectionState {
    CONNECTING,
    ESTABLISHED,
    CLOSED
  }

  /**
   * A task waiting for data.
   */
  record RecvWaiter(SimPromise<ByteBuffer> promise, int maxBytes) {
  }

  private final SimNetwork network;
  private final long id;
  private final HostId localHost;
  private final HostId remoteHost;
  private final SimAddress localAddress;
  private final SimAddress remoteAddress;
  private SimConnection peer;
  private ConnectionState state = ConnectionState.CONNECTING;

  private final ArrayDeque<ByteBuffer> receiveBuffer = new ArrayDeque<>();
  private final ArrayDeque<RecvWaiter> recvWaiters = new ArrayDeque<>();
  private boolean peerClosed;
  private boolean reset;
  // Delivery instant of the last message sent from this end; later messages never arrive earlier
  private SimInstant lastDelivery = SimInstant.ZERO;

  SimConnection(SimNetwork network, long id, HostId localHost, HostId remoteHost,
                SimAddress localAddress, SimAddress remoteAddress) {
    this.network = network;
    this.id = id;
    this.localHost = localHost;
    this.remoteHost = remoteHost;
    this.localAddress = localAddress;
    this.remoteAddress = remoteAddress;
  }

  void setPeer(SimConnection peer) {
    this.peer = peer;
  }

  /**
   * Sends bytes to the peer.
   *
   * @param data The bytes to send; the remaining bytes are copied
   * @return A future that completes once the bytes are handed to the network
   * @see SimNetwork#send(SimConnection, ByteBuffer)
   */
  public SimFuture<Void> send(ByteBuffer data) {
    return network.send(this, data);
  }

  public SimFuture<Void> send(byte[] data) {
    return network.send(this, ByteBuffer.wrap(data));
  }

  /**
   * Receives at most {@code maxBytes} bytes, waiting until some are available.
   *
   * @param maxBytes The maximum number of bytes to return
   * @return A future of the received bytes
   * @see SimNetwork#recv(SimConnection, int)
   */
  public SimFuture<ByteBuffer> recv(int maxBytes) {
    return network.recv(this, maxBytes);
  }

  /**
   * Receives everything buffered, waiting until something is available.
   *
   * @return A future of the received bytes
   */
  public SimFuture<ByteBuffer> recv() {
    return network.recv(this, Integer.MAX_VALUE);
  }

  /**
   * Closes this end gracefully. The peer sees the close after any data already sent.
   */
  public void close() {
    network.close(this);
  }

  public long getId() {
    return id;
  }

  public HostId getLocalHost() {
    return localHost;
  }

  public HostId getRemoteHost() {
    return remoteHost;
  }

  public SimAddress getLocalAddress() {
    return localAddress;
  }

  public SimAddress getRemoteAddress() {
    return remoteAddress;
  }

  public ConnectionState getState() {
    return state;
  }

  public boolean isOpen() {
    return state == ConnectionState.ESTABLISHED;
  }

  /**
   * Checks whether the peer closed its end and the close has been delivered here.
   *
   * @return true if no more data will arrive
   */
  public boolean isPeerClosed() {
    return peerClosed;
  }

  /**
   * Checks whether the connection was torn down without a graceful close.
   *
   * @return true if reset
   */
  public boolean isReset() {
    return reset;
  }

  /**
   * Gets the number of bytes delivered but not yet received.
   *
   * @return The buffered byte count
   */
  public int available() {
    int total = 0;
    for (ByteBuffer chunk : receiveBuffer) {
      total += chunk.remaining();
    }
    return total;
  }

  SimConnection getPeer() {
    return peer;
  }

  void setState(ConnectionState state) {
    this.state = state;
  }

  void markPeerClosed() {
    peerClosed = true;
  }

  void markReset() {
    reset = true;
  }

  SimInstant getLastDelivery() {
    return lastDelivery;
  }

  void setLastDelivery(SimInstant lastDelivery) {
    this.lastDelivery = lastDelivery;
  }

  ArrayDeque<ByteBuffer> receiveBuffer() {
    return receiveBuffer;
  }

  ArrayDeque<RecvWaiter> recvWaiters() {
    return recvWaiters;
  }

  /**
   * Removes up to {@code maxBytes} from the front of the receive buffer. A chunk larger
   * than what is left to read is split and its tail stays buffered.
   */
  ByteBuffer read(int maxBytes) {
    int size = Math.min(maxBytes, available());
    ByteBuffer out = ByteBuffer.allocate(size);
    while (out.hasRemaining()) {
      ByteBuffer chunk = receiveBuffer.peekFirst();
      if (chunk.remaining() <= out.remaining()) {
        out.put(chunk);
        receiveBuffer.pollFirst();
      } else {
        ByteBuffer slice = chunk.duplicate();
        slice.limit(slice.position() + out.remaining());
        chunk.position(slice.limit());
        out.put(slice);
      }
    }
    while (!receiveBuffer.isEmpty() && !receiveBuffer.peekFirst().hasRemaining()) {
      receiveBuffer.pollFirst();
    }
    out.flip();
    return out;
  }

  @Override
  public String toString() {
    return "SimConnection{id=" + id + ", " + localAddress + " -> " + remoteAddress + ", " + state + "}";
  }
}
