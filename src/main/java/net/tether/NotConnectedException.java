package net.tether;

/**
 * Thrown when an operation needs a live connection and none exists. Never retried internally.
 */
public class NotConnectedException extends TetherException {
  private static final long serialVersionUID = -6218953128590731042L;

  public NotConnectedException(String message) {
    super(message);
  }

  public NotConnectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
