package net.tether;

/**
 * Thrown once reconnection attempts are exhausted, and by every later connection operation. The
 * supervisor does not leave this state.
 */
public class ConnectionFailedException extends ConnectionException {
  private static final long serialVersionUID = 8032245914786524471L;

  public ConnectionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
