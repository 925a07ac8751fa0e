package net.tether.config;

import net.tether.internal.util.Assert;

/**
 * The exchange, queue and dead-letter objects to maintain on the broker. Re-declaring the same
 * config against a fresh channel leaves existing objects and bindings untouched.
 */
public class TopologyConfig {
  private String exchangeName = "";
  private String exchangeType = "direct";
  private String routingKey = "";
  private String queueName = "";
  private String queueMode = "default";
  private String deadLetterExchange = "";
  private String deadLetterExchangeType = "direct";
  private String deadLetterRoutingKey = "";
  private String deadLetterQueueName = "";
  private boolean legacyDeadLetterExchangeArgument;

  public TopologyConfig() {
  }

  TopologyConfig(TopologyConfig config) {
    exchangeName = config.exchangeName;
    exchangeType = config.exchangeType;
    routingKey = config.routingKey;
    queueName = config.queueName;
    queueMode = config.queueMode;
    deadLetterExchange = config.deadLetterExchange;
    deadLetterExchangeType = config.deadLetterExchangeType;
    deadLetterRoutingKey = config.deadLetterRoutingKey;
    deadLetterQueueName = config.deadLetterQueueName;
    legacyDeadLetterExchangeArgument = config.legacyDeadLetterExchangeArgument;
  }

  public String getDeadLetterExchange() {
    return deadLetterExchange;
  }

  public String getDeadLetterExchangeType() {
    return deadLetterExchangeType;
  }

  public String getDeadLetterQueueName() {
    return deadLetterQueueName;
  }

  public String getDeadLetterRoutingKey() {
    return deadLetterRoutingKey;
  }

  public String getExchangeName() {
    return exchangeName;
  }

  public String getExchangeType() {
    return exchangeType;
  }

  public String getQueueMode() {
    return queueMode;
  }

  public String getQueueName() {
    return queueName;
  }

  public String getRoutingKey() {
    return routingKey;
  }

  /**
   * Returns whether both a dead-letter exchange and a dead-letter queue are configured, in which
   * case both are declared and bound to each other.
   */
  public boolean hasDeadLetterQueue() {
    return deadLetterExchange.length() > 0 && deadLetterQueueName.length() > 0;
  }

  /**
   * Returns whether the {@code x-dead-letter-exchange} queue argument is set to the dead-letter
   * routing key instead of the dead-letter exchange name.
   *
   * @see #withLegacyDeadLetterExchangeArgument(boolean)
   */
  public boolean isLegacyDeadLetterExchangeArgument() {
    return legacyDeadLetterExchangeArgument;
  }

  @Override
  public String toString() {
    return "TopologyConfig [exchange=" + exchangeName + " (" + exchangeType + "), queue="
        + queueName + ", routingKey=" + routingKey + ", deadLetterExchange=" + deadLetterExchange
        + ", deadLetterQueue=" + deadLetterQueueName + "]";
  }

  /**
   * Sets the exchange that rejected and expired messages of the primary queue are routed to. Empty
   * for none.
   */
  public TopologyConfig withDeadLetterExchange(String deadLetterExchange) {
    this.deadLetterExchange = Assert.notNull(deadLetterExchange, "deadLetterExchange");
    return this;
  }

  public TopologyConfig withDeadLetterExchangeType(String deadLetterExchangeType) {
    this.deadLetterExchangeType = Assert.notEmpty(deadLetterExchangeType, "deadLetterExchangeType");
    return this;
  }

  public TopologyConfig withDeadLetterQueueName(String deadLetterQueueName) {
    this.deadLetterQueueName = Assert.notNull(deadLetterQueueName, "deadLetterQueueName");
    return this;
  }

  /**
   * Sets the routing key dead-lettered messages are re-published with. Empty keeps their original
   * routing key.
   */
  public TopologyConfig withDeadLetterRoutingKey(String deadLetterRoutingKey) {
    this.deadLetterRoutingKey = Assert.notNull(deadLetterRoutingKey, "deadLetterRoutingKey");
    return this;
  }

  public TopologyConfig withExchangeName(String exchangeName) {
    this.exchangeName = Assert.notNull(exchangeName, "exchangeName");
    return this;
  }

  /**
   * Sets the exchange type, such as {@code direct}, {@code topic}, {@code fanout} or
   * {@code headers}.
   */
  public TopologyConfig withExchangeType(String exchangeType) {
    this.exchangeType = Assert.notEmpty(exchangeType, "exchangeType");
    return this;
  }

  /**
   * Sets the {@code x-dead-letter-exchange} argument to the dead-letter routing key rather than the
   * dead-letter exchange name. Only useful to redeclare queues that were created that way, since
   * the broker rejects a redeclaration whose arguments differ.
   */
  public TopologyConfig withLegacyDeadLetterExchangeArgument(boolean enabled) {
    this.legacyDeadLetterExchangeArgument = enabled;
    return this;
  }

  /**
   * Sets the {@code x-queue-mode} argument, {@code default} or {@code lazy}.
   */
  public TopologyConfig withQueueMode(String queueMode) {
    this.queueMode = Assert.notEmpty(queueMode, "queueMode");
    return this;
  }

  public TopologyConfig withQueueName(String queueName) {
    this.queueName = Assert.notNull(queueName, "queueName");
    return this;
  }

  public TopologyConfig withRoutingKey(String routingKey) {
    this.routingKey = Assert.notNull(routingKey, "routingKey");
    return this;
  }
}
