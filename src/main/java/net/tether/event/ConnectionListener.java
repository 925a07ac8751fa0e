package net.tether.event;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Listens for supervised {@link Connection} related events. Listener failures are logged and
 * otherwise ignored.
 */
public interface ConnectionListener {
  /**
   * Called when the {@code connection} is successfully created by an initial connect.
   */
  void onCreate(Connection connection);

  /**
   * Called when an initial connect fails.
   */
  void onCreateFailure(Throwable failure);

  /**
   * Called when the connection is closed without a shutdown having been requested.
   */
  void onClosure(ShutdownSignalException cause);

  /**
   * Called when reconnection is started.
   */
  void onRecoveryStarted();

  /**
   * Called when the {@code connection} is re-established, but before its channel, topology and
   * consumers are provisioned again.
   */
  void onRecovery(Connection connection);

  /**
   * Called when the channel, topology and consumers have been provisioned on the recovered
   * {@code connection}.
   */
  void onRecoveryCompleted(Connection connection);

  /**
   * Called when recovery fails for good, either because reconnect attempts were exhausted or
   * because provisioning hit a configuration fault.
   */
  void onRecoveryFailure(Throwable failure);
}
