package net.tether.internal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.tether.ChannelOpenException;
import net.tether.DeliveryHandler;
import net.tether.config.ConsumerConfig;
import net.tether.internal.util.Assert;
import net.tether.internal.util.concurrent.NamedThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A group of consumer workers sharing one channel. Each worker owns a broker consumer whose
 * deliveries are buffered in arrival order and processed by a dedicated thread, so a slow handler
 * only holds up its own worker. A group is started once; after a reconnect a new group is started
 * on the new channel.
 */
public class ConsumerGroup {
  private static final long POLL_MILLIS = 100;

  final Logger log = LoggerFactory.getLogger(getClass());
  private final ChannelProvisioner provisioner;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final CountDownLatch stopCompleted = new CountDownLatch(1);
  private final List<Worker> workers = new ArrayList<Worker>();
  private volatile boolean running;
  private volatile boolean drained;
  private Channel channel;
  private ConsumerConfig config;
  private DeliveryHandler handler;
  private ExecutorService executor;

  public ConsumerGroup(ChannelProvisioner provisioner) {
    this.provisioner = Assert.notNull(provisioner, "provisioner");
  }

  /**
   * Returns the consumer tags for a group of {@code count} consumers: {@code prefix-1} through
   * {@code prefix-count}.
   */
  public static List<String> consumerTags(String prefix, int count) {
    List<String> tags = new ArrayList<String>(count);
    for (int i = 1; i <= count; i++)
      tags.add(prefix + "-" + i);
    return Collections.unmodifiableList(tags);
  }

  /**
   * Handles deliveries for one consumer tag.
   */
  private final class Worker extends DefaultConsumer implements Runnable {
    private final String consumerTag;
    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<Delivery>();
    private volatile boolean ended;

    Worker(Channel channel, String consumerTag) {
      super(channel);
      this.consumerTag = consumerTag;
    }

    @Override
    public void handleCancel(String consumerTag) {
      log.warn("Consumer {} was cancelled by the broker", consumerTag);
      ended = true;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties,
        byte[] body) {
      deliveries.add(new Delivery(envelope, properties, body));
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      if (!sig.isInitiatedByApplication())
        log.warn("Consumer {} lost its channel: {}", consumerTag, sig.getMessage());
      ended = true;
    }

    @Override
    public void run() {
      log.debug("Consumer {} started", consumerTag);
      try {
        while (running && !ended) {
          Delivery delivery = deliveries.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (delivery != null)
            process(delivery);
        }
      } catch (InterruptedException e) {
        log.warn("Consumer {} interrupted", consumerTag);
        Thread.currentThread().interrupt();
        return;
      }

      requeueBuffered();
      log.debug("Consumer {} stopped", consumerTag);
    }

    @Override
    public String toString() {
      return consumerTag;
    }

    void cancel() {
      if (ended || !getChannel().isOpen())
        return;
      try {
        getChannel().basicCancel(consumerTag);
      } catch (IOException e) {
        log.warn("Failed to cancel consumer {}", consumerTag, e);
      } catch (ShutdownSignalException e) {
        log.debug("Channel closed before consumer {} could be cancelled", consumerTag);
      }
    }

    private void process(Delivery delivery) {
      long deliveryTag = delivery.getEnvelope().getDeliveryTag();
      String contentType = delivery.getProperties() == null ? null : delivery.getProperties()
          .getContentType();
      if (config.getContentType() != null && !config.getContentType().equals(contentType)) {
        log.warn("Consumer {} rejecting delivery {} with content type {}, expected {}",
            consumerTag, deliveryTag, contentType, config.getContentType());
        respond(deliveryTag, false, false);
        return;
      }

      boolean handled;
      try {
        handler.handle(delivery);
        handled = true;
      } catch (VirtualMachineError e) {
        respond(deliveryTag, false, true);
        throw e;
      } catch (Throwable e) {
        log.error("Consumer {} failed to handle delivery {}", consumerTag, deliveryTag, e);
        handled = false;
      }

      respond(deliveryTag, handled, true);
    }

    /** Nacks buffered deliveries that were never handed to the handler. */
    private void requeueBuffered() {
      List<Delivery> buffered = new ArrayList<Delivery>();
      deliveries.drainTo(buffered);
      if (!buffered.isEmpty() && getChannel().isOpen()) {
        log.debug("Consumer {} requeueing {} buffered deliveries", consumerTag, buffered.size());
        for (Delivery delivery : buffered)
          respond(delivery.getEnvelope().getDeliveryTag(), false, true);
      }
    }

    private void respond(long deliveryTag, boolean ack, boolean requeue) {
      try {
        if (ack)
          getChannel().basicAck(deliveryTag, false);
        else
          getChannel().basicNack(deliveryTag, false, requeue);
      } catch (IOException e) {
        log.error("Consumer {} failed to {} delivery {}", consumerTag, ack ? "ack" : "nack",
            deliveryTag, e);
      } catch (ShutdownSignalException e) {
        log.warn("Consumer {} could not {} delivery {}, channel closed", consumerTag, ack ? "ack"
            : "nack", deliveryTag);
        ended = true;
      }
    }
  }

  /**
   * Returns the consumer tags of the started group, else an empty list.
   */
  public List<String> getConsumerTags() {
    List<String> tags = new ArrayList<String>();
    synchronized (workers) {
      for (Worker worker : workers)
        tags.add(worker.consumerTag);
    }
    return tags;
  }

  /**
   * Returns whether the group is started and not yet stopped.
   */
  public boolean isRunning() {
    return running;
  }

  /**
   * Applies the prefetch count to the {@code channel}, registers {@code consumerCount} consumers on
   * {@code queueName} with manual acknowledgement and starts a worker for each.
   *
   * @throws ChannelOpenException if flow control cannot be applied or a consumer cannot be
   *           registered. Any consumers already started are stopped.
   * @throws IllegalStateException if the group was already started
   */
  public void start(Channel channel, String queueName, ConsumerConfig config,
      DeliveryHandler handler) throws ChannelOpenException {
    Assert.notNull(channel, "channel");
    Assert.notEmpty(queueName, "queueName");
    Assert.notNull(config, "config");
    Assert.notNull(handler, "handler");
    Assert.state(started.compareAndSet(false, true), "Consumer group already started");
    this.channel = channel;
    this.config = config;
    this.handler = handler;

    List<String> tags = consumerTags(config.getConsumerNamePrefix(), config.getConsumerCount());
    provisioner.applyFlowControl(channel, config.getPrefetchCount());
    executor = Executors.newFixedThreadPool(tags.size(), new NamedThreadFactory(
        config.getConsumerNamePrefix() + "-worker-%s"));
    running = true;

    for (String tag : tags) {
      Worker worker = new Worker(channel, tag);
      try {
        channel.basicConsume(queueName, false, tag, worker);
      } catch (IOException e) {
        stop();
        throw new ChannelOpenException("Failed to register consumer " + tag + " on " + queueName, e);
      } catch (ShutdownSignalException e) {
        stop();
        throw new ChannelOpenException("Channel closed while registering consumer " + tag, e);
      }

      synchronized (workers) {
        workers.add(worker);
      }
      executor.execute(worker);
      log.info("Created consumer {} of {} via channel-{}", tag, queueName,
          channel.getChannelNumber());
    }
  }

  /**
   * Stops the group. Workers finish their in-flight delivery and requeue anything still buffered.
   * Workers that do not finish within the channel notify timeout are interrupted and the channel is
   * aborted. Safe to call repeatedly and concurrently with deliveries. A call made while another
   * is stopping the group waits for it to complete.
   *
   * @return true if every worker finished within the timeout
   */
  public boolean stop() {
    if (!started.get())
      return true;
    if (!stopped.compareAndSet(false, true))
      return awaitStopped();

    try {
      drained = drain();
      return drained;
    } finally {
      stopCompleted.countDown();
    }
  }

  private boolean awaitStopped() {
    try {
      stopCompleted.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
    return drained;
  }

  private boolean drain() {
    running = false;
    if (executor == null)
      return true;

    List<Worker> toCancel;
    synchronized (workers) {
      toCancel = new ArrayList<Worker>(workers);
    }
    for (Worker worker : toCancel)
      worker.cancel();

    executor.shutdown();
    boolean finished;
    try {
      finished = executor.awaitTermination(config.getChannelNotifyTimeout().toNanos(),
          TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      finished = false;
    }

    if (!finished) {
      log.warn("Consumers {} did not stop within {}ms, aborting channel-{}", toCancel,
          config.getChannelNotifyTimeout().toMillis(), channel.getChannelNumber());
      executor.shutdownNow();
      try {
        channel.abort();
      } catch (IOException e) {
        log.warn("Failed to abort channel-{}", channel.getChannelNumber(), e);
      }
    } else
      log.info("Stopped consumers {}", toCancel);

    return finished;
  }
}
