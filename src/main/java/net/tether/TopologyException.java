package net.tether;

/**
 * Thrown when the broker rejects an exchange, queue or binding declaration, typically because an
 * object of the same name exists with different properties. Not retried.
 */
public class TopologyException extends TetherException {
  private static final long serialVersionUID = -725310064521733830L;
  private final int replyCode;

  public TopologyException(String message, int replyCode, Throwable cause) {
    super(message, cause);
    this.replyCode = replyCode;
  }

  /**
   * Returns the AMQP reply code the broker closed the channel with, or -1 if unknown.
   */
  public int getReplyCode() {
    return replyCode;
  }
}
