package net.tether;

/**
 * Thrown when a connection to the broker could not be established. The cause is the failure
 * reported by the client library.
 */
public class ConnectionException extends TetherException {
  private static final long serialVersionUID = -3106617040297226218L;

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
