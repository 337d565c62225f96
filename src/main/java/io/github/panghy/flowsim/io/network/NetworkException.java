package io.github.panghy.flowsim.io.network;

import java.io.IOException;

/**
 * Error returned to a task by a simulated network operation.
 *
 * <p>Network errors are ordinary values: the failing operation's future completes
 * exceptionally with a NetworkException and the task handles it as it would a real
 * socket error. The {@link ErrorCode} identifies the condition.</p>
 */
public class NetworkException extends IOException {

  /**
   * Enumeration of simulated network error conditions.
   */
  public enum ErrorCode {
    /**
     * The address is already bound by a listener.
     */
    ADDRESS_IN_USE("address in use"),

    /**
     * No listener accepts connections at the address, or its host is down.
     */
    CONNECTION_REFUSED("connection refused"),

    /**
     * The connection (or listener) was closed or reset.
     */
    CONNECTION_CLOSED("connection closed"),

    /**
     * The two hosts are partitioned from each other.
     */
    NETWORK_UNREACHABLE("network unreachable");

    private final String description;

    ErrorCode(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final ErrorCode errorCode;

  /**
   * Creates a new network exception.
   *
   * @param errorCode The error condition
   * @param message   Detail about the failed operation
   */
  public NetworkException(ErrorCode errorCode, String message) {
    super(errorCode.getDescription() + ": " + message);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error condition.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
