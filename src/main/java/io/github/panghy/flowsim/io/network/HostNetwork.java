package io.github.panghy.flowsim.io.network;

import io.github.panghy.flowsim.core.SimFuture;
import io.github.panghy.flowsim.simulation.HostId;

/**
 * The network as seen by one host. Listeners are bound on the host's own name and
 * connections originate from it.
 */
public class HostNetwork {

  private final SimNetwork network;
  private final HostId host;

  HostNetwork(SimNetwork network, HostId host) {
    this.network = network;
    this.host = host;
  }

  public HostId getHost() {
    return host;
  }

  /**
   * Binds a listener on {@code <host name>:port}.
   *
   * @param port The port, or 0 for an ephemeral port
   * @return The listener
   * @throws NetworkException if the port is already bound
   */
  public SimListener bind(int port) throws NetworkException {
    return network.bind(host, port);
  }

  /**
   * Connects to {@code host:port}.
   *
   * @param address The destination address
   * @return A future of the established connection
   */
  public SimFuture<SimConnection> connect(String address) {
    return network.connect(host, SimAddress.parse(address));
  }

  public SimFuture<SimConnection> connect(SimAddress address) {
    return network.connect(host, address);
  }
}
