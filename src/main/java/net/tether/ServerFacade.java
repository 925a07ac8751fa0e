package net.tether;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.tether.config.BrokerConfig;
import net.tether.config.ConfigLoader;
import net.tether.config.ServerConfig;
import net.tether.event.ConnectionListener;
import net.tether.internal.ChannelProvisioner;
import net.tether.internal.ClosureSignal;
import net.tether.internal.ConnectionSupervisor;
import net.tether.internal.ConsumerGroup;
import net.tether.internal.TopologyDeclarer;
import net.tether.internal.util.Assert;
import net.tether.internal.util.concurrent.NamedThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Keeps a queue consumed across connection failures. Starting the facade connects to the broker,
 * declares the topology and starts the consumer group. A supervising task then waits for the
 * connection to close unexpectedly and, when it does, reconnects and provisions the topology and
 * consumers again on the new connection.
 *
 * <p>
 * Provisioning faults that a fresh connection may cure, such as a channel that cannot be opened,
 * recycle the connection. Configuration faults, such as a queue declared elsewhere with different
 * arguments, and exhausted reconnect attempts leave the facade failed; see {@link #getFailure()}.
 */
public class ServerFacade {
  static final Duration DEFAULT_CHANNEL_WAIT = Duration.ofSeconds(30);

  final Logger log = LoggerFactory.getLogger(getClass());
  private final ConnectionSupervisor supervisor;
  private final ServerConfig config;
  private final DeliveryHandler handler;
  private final ChannelProvisioner provisioner = new ChannelProvisioner();
  private final TopologyDeclarer declarer = new TopologyDeclarer();
  private final ExecutorService supervisingExecutor;
  private volatile boolean started;
  private volatile boolean stopped;
  private volatile Throwable failure;

  // Guarded by this
  private ConsumerGroup consumers;
  private Channel consumerChannel;

  /**
   * Creates a facade for the broker described by {@code brokerConfig}, maintaining the topology and
   * consumers described by a copy of {@code serverConfig}. Deliveries are passed to the
   * {@code handler}.
   *
   * @throws NullPointerException if any argument is null
   */
  public ServerFacade(BrokerConfig brokerConfig, ServerConfig serverConfig, DeliveryHandler handler) {
    this(new ConnectionSupervisor(Assert.notNull(brokerConfig, "brokerConfig"), Assert.notNull(
        serverConfig, "serverConfig").getReconnectPolicy()), serverConfig, handler);
  }

  ServerFacade(ConnectionSupervisor supervisor, ServerConfig serverConfig, DeliveryHandler handler) {
    this.supervisor = Assert.notNull(supervisor, "supervisor");
    this.config = Assert.notNull(serverConfig, "serverConfig").copy();
    this.handler = Assert.notNull(handler, "handler");
    supervisingExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory(
        supervisor.getName() + "-supervisor-%s"));
  }

  /**
   * Creates a facade from {@code properties} as read by {@link ConfigLoader}.
   *
   * @throws IllegalArgumentException if a property holds an invalid value
   */
  public static ServerFacade fromProperties(Properties properties, DeliveryHandler handler) {
    return new ServerFacade(ConfigLoader.brokerConfig(properties),
        ConfigLoader.serverConfig(properties), handler);
  }

  /**
   * Returns the failure that ended supervision, else null. A failed facade no longer consumes.
   */
  public Throwable getFailure() {
    return failure;
  }

  /**
   * Returns the connection state, which is {@link ConnectionState#FAILED} once the facade failed.
   */
  public ConnectionState getState() {
    return failure == null ? supervisor.getState() : ConnectionState.FAILED;
  }

  public boolean isFailed() {
    return failure != null;
  }

  public boolean isShutdown() {
    return stopped;
  }

  /**
   * Opens a channel for publishing on the current connection, waiting up to 30 seconds for a
   * reconnect in progress. The caller owns the channel; it is not restored after a reconnect.
   *
   * @throws NotConnectedException if no connection became available in time or the facade was
   *           shut down
   * @throws ConnectionFailedException if reconnection has failed for good
   * @throws ChannelOpenException if the channel cannot be opened
   */
  public Channel openChannel() throws IOException {
    return openChannel(DEFAULT_CHANNEL_WAIT);
  }

  /**
   * Opens a channel for publishing on the current connection, waiting up to {@code maxWait} for a
   * reconnect in progress.
   *
   * @see #openChannel()
   */
  public Channel openChannel(Duration maxWait) throws IOException {
    Assert.notNull(maxWait, "maxWait");
    return provisioner.open(supervisor.awaitConnected(maxWait));
  }

  /**
   * Connects, declares the topology, starts the consumers and begins supervising the connection.
   * If any step fails the facade is shut down.
   *
   * @throws ConnectionException if the broker cannot be reached
   * @throws TopologyException if the broker rejects the topology
   * @throws ChannelOpenException if the channel or consumers cannot be set up
   * @throws IllegalStateException if the facade was already started
   */
  public void start() throws IOException {
    synchronized (this) {
      Assert.state(!started, "%s was already started", supervisor);
      Assert.state(!stopped, "%s was shut down", supervisor);
      started = true;
    }

    try {
      supervisor.connect();
      provision();
    } catch (IOException e) {
      log.error("Failed to start {}", supervisor, e);
      try {
        shutdown();
      } catch (IOException shutdownFailure) {
        log.warn("Failed to close connection {}", supervisor, shutdownFailure);
      }
      throw e;
    }

    supervisingExecutor.execute(new Runnable() {
      @Override
      public void run() {
        supervise();
      }
    });
    log.info("Started {} consuming from {}", supervisor, config.getTopology().getQueueName());
  }

  /**
   * Stops the consumers, closes the connection and ends supervision. Safe to call repeatedly and
   * while a reconnect is in progress.
   *
   * @throws IOException if closing the connection fails
   */
  public void shutdown() throws IOException {
    synchronized (this) {
      if (stopped)
        return;
      stopped = true;
    }

    log.info("Shutting down {}", supervisor);
    try {
      stopConsumers();
      supervisor.shutdown();
    } finally {
      supervisingExecutor.shutdownNow();
    }
  }

  @Override
  public String toString() {
    return "ServerFacade [" + supervisor + "]";
  }

  /**
   * Records a failure that ends supervision.
   */
  private void fail(Throwable cause, boolean notifyListeners) {
    failure = cause;
    log.error("Supervision of {} failed for good", supervisor, cause);
    if (notifyListeners)
      for (ConnectionListener listener : supervisor.getConnectionListeners())
        try {
          listener.onRecoveryFailure(cause);
        } catch (Exception e) {
          log.warn("Connection listener {} failed on recovery failure", listener, e);
        }
  }

  /**
   * Opens a channel on the current connection, declares the topology on it and starts a consumer
   * group. The channel is closed if any step fails. Broker calls are made without holding the
   * facade's monitor so that a concurrent shutdown can close the connection under them.
   */
  private void provision() throws IOException {
    Connection connection = supervisor.current();
    Channel channel = provisioner.open(connection);
    ConsumerGroup group = new ConsumerGroup(provisioner);
    try {
      declarer.declare(channel, config.getTopology());
      group.start(channel, config.getTopology().getQueueName(), config.getConsumer(), handler);
    } catch (IOException e) {
      provisioner.close(channel);
      throw e;
    }

    synchronized (this) {
      if (!stopped) {
        consumers = group;
        consumerChannel = channel;
        return;
      }
    }

    group.stop();
    provisioner.close(channel);
    throw new NotConnectedException(supervisor + " was shut down while provisioning");
  }

  private void stopConsumers() {
    ConsumerGroup group;
    Channel channel;
    synchronized (this) {
      group = consumers;
      channel = consumerChannel;
      consumers = null;
      consumerChannel = null;
    }

    if (group != null) {
      if (!group.stop())
        log.warn("Consumers of {} did not drain in time", supervisor);
      provisioner.close(channel);
    }
  }

  /**
   * Waits for each unexpected closure and restores the connection, topology and consumers.
   */
  private void supervise() {
    while (!stopped) {
      ClosureSignal signal;
      try {
        signal = supervisor.watchClosure();
        ShutdownSignalException cause = signal.await();
        log.debug("Observed {}{}", signal, cause == null ? "" : ": " + cause.getMessage());
      } catch (NotConnectedException e) {
        log.error("Cannot supervise {}", supervisor, e);
        break;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }

      if (signal.isIntentional() || supervisor.isShutdown())
        break;

      stopConsumers();
      try {
        if (!supervisor.reconnect())
          break;
        provision();
        log.info("Restored topology and consumers of {}", supervisor);
        Connection connection = supervisor.current();
        for (ConnectionListener listener : supervisor.getConnectionListeners())
          try {
            listener.onRecoveryCompleted(connection);
          } catch (Exception e) {
            log.warn("Connection listener {} failed on recovery completion", listener, e);
          }
      } catch (ConnectionFailedException e) {
        // The supervisor already reported the failure to listeners
        fail(e, false);
        break;
      } catch (TopologyException e) {
        fail(e, true);
        shutdownSupervisor();
        break;
      } catch (ChannelOpenException e) {
        log.warn("Failed to provision {}, recycling the connection", supervisor, e);
        supervisor.recycle();
      } catch (NotConnectedException e) {
        log.warn("Connection {} closed while provisioning: {}", supervisor, e.getMessage());
        supervisor.recycle();
      } catch (InterruptedIOException e) {
        break;
      } catch (IOException e) {
        log.warn("Failed to recover {}, recycling the connection", supervisor, e);
        supervisor.recycle();
      }
    }

    log.debug("Stopped supervising {}", supervisor);
  }

  private void shutdownSupervisor() {
    try {
      supervisor.shutdown();
    } catch (IOException e) {
      log.warn("Failed to close connection {}", supervisor, e);
    }
  }
}
