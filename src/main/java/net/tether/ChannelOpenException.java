package net.tether;

/**
 * Thrown when a channel cannot be opened or configured on the current connection.
 */
public class ChannelOpenException extends TetherException {
  private static final long serialVersionUID = 1960271431522186027L;

  public ChannelOpenException(String message) {
    super(message);
  }

  public ChannelOpenException(String message, Throwable cause) {
    super(message, cause);
  }
}
