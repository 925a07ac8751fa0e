package net.tether.internal;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import net.tether.NotConnectedException;
import net.tether.TopologyException;
import net.tether.config.TopologyConfig;
import net.tether.internal.util.Assert;
import net.tether.internal.util.Exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Declares the exchange, queue, dead-letter objects and bindings described by a
 * {@link TopologyConfig}. Declarations are idempotent, so the same config is applied again on every
 * fresh channel.
 */
public class TopologyDeclarer {
  public static final String QUEUE_MODE = "x-queue-mode";
  public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
  public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";

  final Logger log = LoggerFactory.getLogger(getClass());

  /**
   * Returns the arguments the primary queue is declared with.
   */
  public static Map<String, Object> queueArguments(TopologyConfig config) {
    Map<String, Object> args = new LinkedHashMap<String, Object>();
    args.put(QUEUE_MODE, config.getQueueMode());
    if (config.getDeadLetterExchange().length() > 0)
      args.put(DEAD_LETTER_EXCHANGE, config.isLegacyDeadLetterExchangeArgument() ? config
          .getDeadLetterRoutingKey() : config.getDeadLetterExchange());
    if (config.getDeadLetterRoutingKey().length() > 0)
      args.put(DEAD_LETTER_ROUTING_KEY, config.getDeadLetterRoutingKey());
    return args;
  }

  /**
   * Declares the topology on the {@code channel}.
   *
   * @throws TopologyException if the config is incomplete or the broker rejects a declaration,
   *           such as when an object of the same name exists with different properties
   * @throws NotConnectedException if the connection closed during declaration
   */
  public void declare(Channel channel, TopologyConfig config) throws IOException {
    Assert.notNull(channel, "channel");
    Assert.notNull(config, "config");
    validate(config);
    if (config.isLegacyDeadLetterExchangeArgument() && config.getDeadLetterExchange().length() > 0)
      log.warn("Declaring queue {} with {}={} (the dead-letter routing key) for compatibility, "
          + "dead-lettered messages will not reach exchange {}", config.getQueueName(),
          DEAD_LETTER_EXCHANGE, config.getDeadLetterRoutingKey(), config.getDeadLetterExchange());

    String step = "exchange " + config.getExchangeName();
    try {
      channel.exchangeDeclare(config.getExchangeName(), config.getExchangeType(), true, false,
          false, null);
      step = "queue " + config.getQueueName();
      channel.queueDeclare(config.getQueueName(), true, false, false, queueArguments(config));
      step = "binding of " + config.getQueueName() + " to " + config.getExchangeName();
      channel.queueBind(config.getQueueName(), config.getExchangeName(), config.getRoutingKey());

      if (config.hasDeadLetterQueue()) {
        step = "dead-letter exchange " + config.getDeadLetterExchange();
        channel.exchangeDeclare(config.getDeadLetterExchange(), config.getDeadLetterExchangeType(),
            true, false, false, null);
        step = "dead-letter queue " + config.getDeadLetterQueueName();
        channel.queueDeclare(config.getDeadLetterQueueName(), true, false, false,
            deadLetterQueueArguments(config));
        step = "binding of " + config.getDeadLetterQueueName() + " to "
            + config.getDeadLetterExchange();
        channel.queueBind(config.getDeadLetterQueueName(), config.getDeadLetterExchange(),
            deadLetterBindingKey(config));
      }
    } catch (IOException e) {
      throw declarationFailed(step, e);
    } catch (ShutdownSignalException e) {
      throw declarationFailed(step, e);
    }

    log.info("Declared {} via channel-{}", config, channel.getChannelNumber());
  }

  private static String deadLetterBindingKey(TopologyConfig config) {
    return config.getDeadLetterRoutingKey().length() > 0 ? config.getDeadLetterRoutingKey()
        : config.getRoutingKey();
  }

  private static Map<String, Object> deadLetterQueueArguments(TopologyConfig config) {
    Map<String, Object> args = new LinkedHashMap<String, Object>();
    args.put(QUEUE_MODE, config.getQueueMode());
    return args;
  }

  private IOException declarationFailed(String step, Exception e) {
    if (Exceptions.isCausedByConnectionClosure(e))
      return new NotConnectedException("Connection closed while declaring " + step, e);
    int replyCode = Exceptions.replyCodeOf(e);
    log.error("Failed to declare {}: {} {}", step, replyCode, Exceptions.replyTextOf(e));
    return new TopologyException("Failed to declare " + step + ": " + Exceptions.replyTextOf(e),
        replyCode, e);
  }

  private static void validate(TopologyConfig config) throws TopologyException {
    if (config.getExchangeName().length() == 0)
      throw new TopologyException("An exchange name is required", Exceptions.UNKNOWN_REPLY_CODE,
          null);
    if (config.getQueueName().length() == 0)
      throw new TopologyException("A queue name is required", Exceptions.UNKNOWN_REPLY_CODE, null);
    if (config.getDeadLetterQueueName().length() > 0 && config.getDeadLetterExchange().length() == 0)
      throw new TopologyException("Dead-letter queue " + config.getDeadLetterQueueName()
          + " requires a dead-letter exchange", Exceptions.UNKNOWN_REPLY_CODE, null);
  }
}
