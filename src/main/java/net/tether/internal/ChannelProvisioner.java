package net.tether.internal;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import net.tether.ChannelOpenException;
import net.tether.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Opens channels on a connection and applies their flow control. Failures are never retried here;
 * the caller decides whether to provision again on a fresh connection.
 */
public class ChannelProvisioner {
  final Logger log = LoggerFactory.getLogger(getClass());

  /**
   * Sets the max number of unacknowledged deliveries the broker may push to each consumer on the
   * {@code channel}, zero for unlimited. On failure the channel is closed.
   *
   * @throws ChannelOpenException if the broker rejects the setting or the channel is unusable
   */
  public void applyFlowControl(Channel channel, int prefetchCount) throws ChannelOpenException {
    Assert.notNull(channel, "channel");
    Assert.isTrue(prefetchCount >= 0, "The prefetchCount cannot be negative");
    try {
      channel.basicQos(prefetchCount);
      log.debug("Applied prefetch count {} to channel-{}", prefetchCount,
          channel.getChannelNumber());
    } catch (IOException e) {
      close(channel);
      throw new ChannelOpenException("Failed to apply prefetch count " + prefetchCount
          + " to channel-" + channel.getChannelNumber(), e);
    } catch (ShutdownSignalException e) {
      throw new ChannelOpenException("Channel-" + channel.getChannelNumber() + " is closed", e);
    }
  }

  /**
   * Closes the {@code channel} if it is still open, logging rather than throwing on failure.
   */
  public void close(Channel channel) {
    if (channel == null || !channel.isOpen())
      return;
    try {
      channel.close();
    } catch (IOException e) {
      log.warn("Failed to close channel-{}", channel.getChannelNumber(), e);
    } catch (TimeoutException e) {
      log.warn("Timed out closing channel-{}", channel.getChannelNumber(), e);
    } catch (ShutdownSignalException e) {
      log.debug("Channel-{} closed concurrently", channel.getChannelNumber());
    }
  }

  /**
   * Opens a new channel on the {@code connection}. The caller owns the returned channel.
   *
   * @throws ChannelOpenException if the connection refuses the channel or is not usable
   */
  public Channel open(Connection connection) throws ChannelOpenException {
    Assert.notNull(connection, "connection");
    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (IOException e) {
      throw new ChannelOpenException("Failed to open channel on " + connection, e);
    } catch (ShutdownSignalException e) {
      throw new ChannelOpenException("Cannot open channel on closed connection " + connection, e);
    }

    if (channel == null)
      throw new ChannelOpenException("No channel number available on " + connection);
    log.info("Created channel-{} on {}", channel.getChannelNumber(), connection);
    return channel;
  }
}
