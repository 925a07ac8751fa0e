package net.tether.internal;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import net.tether.ConnectionException;
import net.tether.ConnectionFailedException;
import net.tether.ConnectionState;
import net.tether.NotConnectedException;
import net.tether.config.BrokerConfig;
import net.tether.config.ReconnectPolicy;
import net.tether.event.ConnectionListener;
import net.tether.internal.util.Assert;
import net.tether.internal.util.concurrent.InterruptableWaiter;
import net.tether.internal.util.concurrent.ReentrantCircuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Owns the single physical connection to the broker. Connection loss is observed through the
 * client's shutdown listener and published as a {@link ClosureSignal}; reconnection is driven by the
 * caller through {@link #reconnect()}.
 *
 * <p>
 * The connection handle is replaced under a write lock and read under a read lock. Dialing is
 * serialized separately so that a slow dial never blocks readers or {@link #shutdown()}.
 */
public class ConnectionSupervisor {
  final Logger log = LoggerFactory.getLogger(getClass());
  private final BrokerConfig config;
  private final ReconnectPolicy reconnectPolicy;
  private final ConnectionFactory connectionFactory;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Lock dialLock = new ReentrantLock();
  private final ReentrantCircuit circuit = new ReentrantCircuit();
  private final InterruptableWaiter retryWaiter = new InterruptableWaiter();
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile boolean closed;
  private volatile Throwable failure;

  // Guarded by lock
  private Connection delegate;
  private ClosureSignal closureSignal;

  /**
   * Creates a supervisor for a copy of the {@code config}. The config's connection factory is
   * pointed at the configured broker and has the client's own automatic recovery disabled.
   *
   * @throws NullPointerException if {@code config} or {@code reconnectPolicy} are null
   * @throws IllegalArgumentException if the config does not describe a valid broker address
   */
  public ConnectionSupervisor(BrokerConfig config, ReconnectPolicy reconnectPolicy) {
    this.config = Assert.notNull(config, "config").copy();
    this.reconnectPolicy = Assert.notNull(reconnectPolicy, "reconnectPolicy");
    connectionFactory = this.config.getConnectionFactory();
    configure(connectionFactory);
    circuit.open();
  }

  /**
   * Handles closure of one physical connection.
   */
  private class ConnectionShutdownListener implements ShutdownListener {
    private final Connection connection;
    private final ClosureSignal signal;

    ConnectionShutdownListener(Connection connection, ClosureSignal signal) {
      this.connection = connection;
      this.signal = signal;
    }

    @Override
    public void shutdownCompleted(ShutdownSignalException e) {
      closureDetected(connection, signal, e);
    }
  }

  /**
   * Waits up to {@code timeout} for a connection to be available, then returns it. Returns
   * immediately while connected; blocks while a reconnect is in progress.
   *
   * @throws NotConnectedException if no connection became available in time or the supervisor was
   *           shut down
   * @throws ConnectionFailedException if reconnection has failed for good
   * @throws InterruptedIOException if the calling thread is interrupted
   */
  public Connection awaitConnected(Duration timeout) throws IOException {
    try {
      if (!circuit.await(timeout))
        throw new NotConnectedException(String.format("Timed out after %s waiting for %s", timeout,
            config));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting for " + config);
    }

    return current();
  }

  /**
   * Connects to the broker unless a live connection already exists.
   *
   * @throws ConnectionException if the dial fails
   * @throws ConnectionFailedException if reconnection has previously failed for good
   * @throws NotConnectedException if the supervisor has been shut down
   */
  public void connect() throws IOException {
    dialLock.lock();
    try {
      checkUsable();
      if (isConnected())
        return;

      state = ConnectionState.CONNECTING;
      Connection connection;
      try {
        connection = dial(false);
      } catch (IOException e) {
        throw connectFailed(e);
      } catch (TimeoutException e) {
        throw connectFailed(e);
      }

      if (!install(connection))
        throw new NotConnectedException(config + " was shut down while connecting");
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onCreate(connection);
        } catch (Exception e) {
          log.warn("Connection listener {} failed on create", listener, e);
        }
    } finally {
      dialLock.unlock();
    }
  }

  /**
   * Returns the live connection.
   *
   * @throws NotConnectedException if there is no connection, it has closed, or the supervisor was
   *           shut down
   * @throws ConnectionFailedException if reconnection has failed for good
   */
  public Connection current() throws IOException {
    lock.readLock().lock();
    try {
      if (state == ConnectionState.FAILED)
        throw new ConnectionFailedException("Connection " + config.getName() + " has failed",
            failure);
      if (closed)
        throw new NotConnectedException("Connection " + config.getName() + " has been shut down");
      if (delegate == null || !delegate.isOpen())
        throw new NotConnectedException("Connection " + config.getName() + " is not open");
      return delegate;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Collection<ConnectionListener> getConnectionListeners() {
    return config.getConnectionListeners();
  }

  /**
   * Returns the failure that reconnection ended with, else null.
   */
  public Throwable getFailure() {
    return failure;
  }

  public String getName() {
    return config.getName();
  }

  public ConnectionState getState() {
    return state;
  }

  /**
   * Returns whether a live connection is currently held.
   */
  public boolean isConnected() {
    lock.readLock().lock();
    try {
      return delegate != null && delegate.isOpen();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns whether {@link #shutdown()} has been called.
   */
  public boolean isShutdown() {
    return closed;
  }

  /**
   * Reconnects following an unexpected closure, performing up to the policy's max attempts with
   * the policy's wait time between them. Returns immediately if a live connection already exists.
   *
   * @return true if connected, false if the supervisor was shut down before a connection could be
   *         established
   * @throws ConnectionFailedException if attempts are exhausted, or were exhausted by an earlier
   *           call. The supervisor is then {@link ConnectionState#FAILED failed} for good.
   * @throws InterruptedIOException if the calling thread is interrupted between attempts
   */
  public boolean reconnect() throws IOException {
    dialLock.lock();
    try {
      if (closed)
        return false;
      checkUsable();
      if (isConnected())
        return true;

      state = ConnectionState.RECONNECTING;
      circuit.open();
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onRecoveryStarted();
        } catch (Exception e) {
          log.warn("Connection listener {} failed on recovery start", listener, e);
        }

      ReconnectStats stats = new ReconnectStats(reconnectPolicy);
      while (true) {
        if (closed)
          return false;

        Exception attemptFailure;
        try {
          Connection connection = dial(true);
          if (!install(connection))
            return false;
          for (ConnectionListener listener : config.getConnectionListeners())
            try {
              listener.onRecovery(connection);
            } catch (Exception e) {
              log.warn("Connection listener {} failed on recovery", listener, e);
            }
          return true;
        } catch (IOException e) {
          attemptFailure = e;
        } catch (TimeoutException e) {
          attemptFailure = e;
        }

        stats.recordFailedAttempt();
        if (stats.isPolicyExceeded())
          throw reconnectFailed(attemptFailure, stats.getAttemptCount());

        Duration waitTime = stats.getWaitTime();
        log.warn("Reconnect attempt {} for {} failed, retrying in {}ms: {}",
            stats.getAttemptCount(), config, waitTime.toMillis(), attemptFailure.toString());
        try {
          retryWaiter.await(waitTime);
        } catch (InterruptedException e) {
          if (closed)
            return false;
          state = ConnectionState.DISCONNECTED;
          Thread.currentThread().interrupt();
          throw new InterruptedIOException("Interrupted while reconnecting " + config);
        }
      }
    } finally {
      dialLock.unlock();
    }
  }

  /**
   * Aborts the current connection and reports it as an unexpected closure, so that whoever watches
   * the closure signal reconnects and provisions from scratch. Does nothing once shut down.
   */
  public void recycle() {
    Connection connection;
    ClosureSignal signal;
    lock.readLock().lock();
    try {
      if (closed || delegate == null)
        return;
      connection = delegate;
      signal = closureSignal;
    } finally {
      lock.readLock().unlock();
    }

    log.warn("Recycling connection {}", config);
    connection.abort();
    closureDetected(connection, signal, null);
  }

  /**
   * Closes the connection, if any, and stops any reconnect in progress. Safe to call repeatedly
   * and concurrently with a reconnect; only the first call has an effect.
   *
   * @throws IOException if closing the connection fails
   */
  public void shutdown() throws IOException {
    Connection connection;
    ClosureSignal signal;
    lock.writeLock().lock();
    try {
      if (closed)
        return;
      closed = true;
      connection = delegate;
      signal = closureSignal;
      if (state != ConnectionState.FAILED)
        state = ConnectionState.CLOSING;
    } finally {
      lock.writeLock().unlock();
    }

    retryWaiter.interruptWaiters();
    circuit.close();
    try {
      if (connection != null && connection.isOpen()) {
        log.info("Closing connection {}", config);
        connection.close();
      }
    } finally {
      if (signal != null)
        signal.fire(null, true);
      if (state != ConnectionState.FAILED)
        state = ConnectionState.DISCONNECTED;
    }
  }

  @Override
  public String toString() {
    return config.getName();
  }

  /**
   * Returns the closure signal of the current, or most recent, connection. The signal may already
   * have fired.
   *
   * @throws NotConnectedException if no connection was ever established
   */
  public ClosureSignal watchClosure() throws NotConnectedException {
    lock.readLock().lock();
    try {
      if (closureSignal == null)
        throw new NotConnectedException("Connection " + config.getName() + " was never established");
      return closureSignal;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void checkUsable() throws IOException {
    if (state == ConnectionState.FAILED)
      throw new ConnectionFailedException("Connection " + config.getName() + " has failed", failure);
    if (closed)
      throw new NotConnectedException("Connection " + config.getName() + " has been shut down");
  }

  private void closureDetected(Connection connection, ClosureSignal signal,
      ShutdownSignalException cause) {
    boolean intentional;
    lock.writeLock().lock();
    try {
      intentional = closed;
      if (!intentional && delegate == connection) {
        state = ConnectionState.CLOSURE_DETECTED;
        circuit.open();
      }
    } finally {
      lock.writeLock().unlock();
    }

    if (signal.fire(cause, intentional) && !intentional) {
      log.error("Connection {} was closed unexpectedly{}", config, cause == null ? ""
          : ": " + cause.getMessage());
      for (ConnectionListener listener : config.getConnectionListeners())
        try {
          listener.onClosure(cause);
        } catch (Exception e) {
          log.warn("Connection listener {} failed on closure", listener, e);
        }
    }
  }

  private void configure(ConnectionFactory factory) {
    try {
      factory.setUri(config.toUri());
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid broker address " + config.redactedUri(), e);
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("Cannot configure TLS for " + config.redactedUri(), e);
    }

    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    if (config.getConnectionTimeout() != null)
      factory.setConnectionTimeout((int) config.getConnectionTimeout().toMillis());
    if (config.getRequestedHeartbeat() != null)
      factory.setRequestedHeartbeat((int) config.getRequestedHeartbeat().getSeconds());
  }

  private ConnectionException connectFailed(Exception e) {
    state = ConnectionState.DISCONNECTED;
    log.error("Failed to create connection {}", config, e);
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onCreateFailure(e);
      } catch (Exception listenerFailure) {
        log.warn("Connection listener {} failed on create failure", listener, listenerFailure);
      }
    return new ConnectionException("Failed to connect " + config, e);
  }

  private Connection dial(boolean recovery) throws IOException, TimeoutException {
    log.info("{} connection {}", recovery ? "Recovering" : "Creating", config);
    Connection connection = connectionFactory.newConnection(config.getName());
    log.info("{} connection {}", recovery ? "Recovered" : "Created", config);
    return connection;
  }

  /**
   * Makes {@code connection} the current connection unless the supervisor was shut down in the
   * meantime, in which case the connection is aborted.
   */
  private boolean install(Connection connection) {
    ClosureSignal signal = new ClosureSignal(config.getName());
    boolean installed = false;
    lock.writeLock().lock();
    try {
      if (!closed) {
        delegate = connection;
        closureSignal = signal;
        state = ConnectionState.CONNECTED;
        circuit.close();
        installed = true;
      }
    } finally {
      lock.writeLock().unlock();
    }

    if (!installed) {
      log.info("Discarding connection {} created during shutdown", config);
      connection.abort();
      return false;
    }

    // Fires immediately if the connection already closed
    connection.addShutdownListener(new ConnectionShutdownListener(connection, signal));
    return true;
  }

  private ConnectionFailedException reconnectFailed(Exception cause, int attempts) {
    lock.writeLock().lock();
    try {
      state = ConnectionState.FAILED;
      failure = cause;
    } finally {
      lock.writeLock().unlock();
    }

    // Release waiters so that they observe the failure
    circuit.close();
    log.error("Failed to reconnect {} after {} attempts", config, attempts, cause);
    for (ConnectionListener listener : config.getConnectionListeners())
      try {
        listener.onRecoveryFailure(cause);
      } catch (Exception e) {
        log.warn("Connection listener {} failed on recovery failure", listener, e);
      }
    return new ConnectionFailedException(String.format("Failed to reconnect %s after %s attempts",
        config, attempts), cause);
  }
}
