package net.tether.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import net.tether.internal.util.Assert;
import net.tether.util.Durations;

/**
 * Builds configs from {@link Properties}. Recognized keys:
 *
 * <pre>
 * tether.broker.scheme, username, password, host, port, name, connection-timeout, heartbeat
 * tether.topology.exchange-name, exchange-type, routing-key, queue-name, queue-mode,
 *   dead-letter-exchange, dead-letter-exchange-type, dead-letter-routing-key,
 *   dead-letter-queue-name, legacy-dead-letter-exchange-argument
 * tether.consumer.name-prefix, count, prefetch-count, content-type, channel-notify-timeout
 * tether.reconnect.max-attempts, interval, max-interval, interval-multiplier, max-duration
 * </pre>
 *
 * Absent keys keep the config defaults. Durations are parsed with {@link Durations#parse(String)}.
 */
public final class ConfigLoader {
  private static final String BROKER = "tether.broker.";
  private static final String TOPOLOGY = "tether.topology.";
  private static final String CONSUMER = "tether.consumer.";
  private static final String RECONNECT = "tether.reconnect.";

  private ConfigLoader() {
  }

  /**
   * Returns the BrokerConfig described by the {@code properties}.
   *
   * @throws IllegalArgumentException if a value is malformed
   */
  public static BrokerConfig brokerConfig(Properties properties) {
    BrokerConfig config = new BrokerConfig();
    String value;
    if ((value = get(properties, BROKER + "scheme")) != null)
      config.withScheme(value);
    if ((value = get(properties, BROKER + "username")) != null)
      config.withUsername(value);
    if ((value = properties.getProperty(BROKER + "password")) != null)
      config.withPassword(value);
    if ((value = get(properties, BROKER + "host")) != null)
      config.withHost(value);
    if ((value = get(properties, BROKER + "port")) != null)
      config.withPort(toInt(BROKER + "port", value));
    if ((value = get(properties, BROKER + "name")) != null)
      config.withName(value);
    if ((value = get(properties, BROKER + "connection-timeout")) != null)
      config.withConnectionTimeout(Durations.parse(value));
    if ((value = get(properties, BROKER + "heartbeat")) != null)
      config.withRequestedHeartbeat(Durations.parse(value));
    return config;
  }

  /**
   * Loads properties from the UTF-8 encoded {@code in}. The stream is not closed.
   */
  public static Properties load(InputStream in) throws IOException {
    Assert.notNull(in, "in");
    Properties properties = new Properties();
    Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
    properties.load(reader);
    return properties;
  }

  /**
   * Loads properties from the class path {@code resource}.
   *
   * @throws IOException if the resource cannot be found or read
   */
  public static Properties loadResource(String resource) throws IOException {
    InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null)
      throw new IOException("Resource not found: " + resource);
    try {
      return load(in);
    } finally {
      in.close();
    }
  }

  /**
   * Returns the ServerConfig described by the {@code properties}.
   *
   * @throws IllegalArgumentException if a value is malformed
   */
  public static ServerConfig serverConfig(Properties properties) {
    return new ServerConfig().withTopology(topologyConfig(properties))
        .withConsumer(consumerConfig(properties))
        .withReconnectPolicy(reconnectPolicy(properties));
  }

  static ConsumerConfig consumerConfig(Properties properties) {
    ConsumerConfig config = new ConsumerConfig();
    String value;
    if ((value = get(properties, CONSUMER + "name-prefix")) != null)
      config.withConsumerNamePrefix(value);
    if ((value = get(properties, CONSUMER + "count")) != null)
      config.withConsumerCount(toInt(CONSUMER + "count", value));
    if ((value = get(properties, CONSUMER + "prefetch-count")) != null)
      config.withPrefetchCount(toInt(CONSUMER + "prefetch-count", value));
    if ((value = get(properties, CONSUMER + "content-type")) != null)
      config.withContentType(value);
    if ((value = get(properties, CONSUMER + "channel-notify-timeout")) != null)
      config.withChannelNotifyTimeout(Durations.parse(value));
    return config;
  }

  static ReconnectPolicy reconnectPolicy(Properties properties) {
    ReconnectPolicy policy = new ReconnectPolicy();
    String value;
    if ((value = get(properties, RECONNECT + "max-attempts")) != null)
      policy.withMaxAttempts(toInt(RECONNECT + "max-attempts", value));
    if ((value = get(properties, RECONNECT + "max-duration")) != null)
      policy.withMaxDuration(Durations.parse(value));

    String interval = get(properties, RECONNECT + "interval");
    String maxInterval = get(properties, RECONNECT + "max-interval");
    if (maxInterval != null) {
      Assert.isTrue(interval != null, "%s requires %s", RECONNECT + "max-interval", RECONNECT
          + "interval");
      String multiplier = get(properties, RECONNECT + "interval-multiplier");
      policy.withBackoff(Durations.parse(interval), Durations.parse(maxInterval),
          multiplier == null ? 2 : toInt(RECONNECT + "interval-multiplier", multiplier));
    } else if (interval != null)
      policy.withInterval(Durations.parse(interval));
    return policy;
  }

  static TopologyConfig topologyConfig(Properties properties) {
    TopologyConfig config = new TopologyConfig();
    String value;
    if ((value = get(properties, TOPOLOGY + "exchange-name")) != null)
      config.withExchangeName(value);
    if ((value = get(properties, TOPOLOGY + "exchange-type")) != null)
      config.withExchangeType(value);
    if ((value = get(properties, TOPOLOGY + "routing-key")) != null)
      config.withRoutingKey(value);
    if ((value = get(properties, TOPOLOGY + "queue-name")) != null)
      config.withQueueName(value);
    if ((value = get(properties, TOPOLOGY + "queue-mode")) != null)
      config.withQueueMode(value);
    if ((value = get(properties, TOPOLOGY + "dead-letter-exchange")) != null)
      config.withDeadLetterExchange(value);
    if ((value = get(properties, TOPOLOGY + "dead-letter-exchange-type")) != null)
      config.withDeadLetterExchangeType(value);
    if ((value = get(properties, TOPOLOGY + "dead-letter-routing-key")) != null)
      config.withDeadLetterRoutingKey(value);
    if ((value = get(properties, TOPOLOGY + "dead-letter-queue-name")) != null)
      config.withDeadLetterQueueName(value);
    if ((value = get(properties, TOPOLOGY + "legacy-dead-letter-exchange-argument")) != null)
      config.withLegacyDeadLetterExchangeArgument(Boolean.parseBoolean(value));
    return config;
  }

  /** Returns the trimmed value for {@code key}, else null if absent or blank. */
  private static String get(Properties properties, String key) {
    String value = properties.getProperty(key);
    if (value == null)
      return null;
    value = value.trim();
    return value.length() == 0 ? null : value;
  }

  private static int toInt(String key, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
    }
  }
}
