package io.github.panghy.flowsim.io.network;

import java.util.Objects;

/**
 * A {@code host:port} address in the simulated network. The host part is the name the
 * host was registered under.
 *
 * @param host The host name
 * @param port The port
 */
public record SimAddress(String host, int port) {

  public SimAddress {
    Objects.requireNonNull(host, "Host cannot be null");
    if (host.isEmpty()) {
      throw new IllegalArgumentException("Host cannot be empty");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port must be between 0 and 65535: " + port);
    }
  }

  /**
   * Parses an address of the form {@code host:port}.
   *
   * @param address The address string
   * @return The parsed address
   * @throws IllegalArgumentException if the string is malformed
   */
  public static SimAddress parse(String address) {
    Objects.requireNonNull(address, "Address cannot be null");
    int colon = address.lastIndexOf(':');
    if (colon <= 0 || colon == address.length() - 1) {
      throw new IllegalArgumentException("Expected host:port but got '" + address + "'");
    }
    try {
      return new SimAddress(address.substring(0, colon), Integer.parseInt(address.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
