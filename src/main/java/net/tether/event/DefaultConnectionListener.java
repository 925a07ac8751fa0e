package net.tether.event;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * No-op connection listener for sub-classing.
 */
public abstract class DefaultConnectionListener implements ConnectionListener {
  @Override
  public void onCreate(Connection connection) {
  }

  @Override
  public void onCreateFailure(Throwable failure) {
  }

  @Override
  public void onClosure(ShutdownSignalException cause) {
  }

  @Override
  public void onRecovery(Connection connection) {
  }

  @Override
  public void onRecoveryCompleted(Connection connection) {
  }

  @Override
  public void onRecoveryFailure(Throwable failure) {
  }

  @Override
  public void onRecoveryStarted() {
  }
}
