package net.tether.internal.util;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

public final class Exceptions {
  /** Reply code used when a shutdown signal carries no close method. */
  public static final int UNKNOWN_REPLY_CODE = -1;

  private Exceptions() {
  }

  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T extractCause(Throwable t, Class<T> type) {
    Throwable cause = t;
    while (cause != null) {
      if (type.isAssignableFrom(cause.getClass()))
        return (T) cause;
      cause = cause.getCause();
    }

    return null;
  }

  public static boolean isCausedByConnectionClosure(Throwable t) {
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    return sse != null && isConnectionClosure(sse);
  }

  /**
   * Reliably returns whether the shutdown signal represents a connection closure.
   */
  public static boolean isConnectionClosure(ShutdownSignalException e) {
    return e instanceof AlreadyClosedException ? e.getReference() instanceof Connection : e
        .isHardError();
  }

  /**
   * Returns the AMQP reply code carried by the shutdown signal found in {@code t}'s causes, else
   * {@link #UNKNOWN_REPLY_CODE}.
   */
  public static int replyCodeOf(Throwable t) {
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    if (sse == null)
      return UNKNOWN_REPLY_CODE;
    Method method = sse.getReason();
    if (method instanceof AMQP.Connection.Close)
      return ((AMQP.Connection.Close) method).getReplyCode();
    if (method instanceof AMQP.Channel.Close)
      return ((AMQP.Channel.Close) method).getReplyCode();
    return UNKNOWN_REPLY_CODE;
  }

  /**
   * Returns the reply text carried by the shutdown signal found in {@code t}'s causes, else the
   * message of {@code t}.
   */
  public static String replyTextOf(Throwable t) {
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    if (sse != null) {
      Method method = sse.getReason();
      if (method instanceof AMQP.Connection.Close)
        return ((AMQP.Connection.Close) method).getReplyText();
      if (method instanceof AMQP.Channel.Close)
        return ((AMQP.Channel.Close) method).getReplyText();
    }
    return t.getMessage();
  }
}
