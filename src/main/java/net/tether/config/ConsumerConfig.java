package net.tether.config;

import java.time.Duration;

import net.tether.internal.util.Assert;

/**
 * Consumer group configuration.
 */
public class ConsumerConfig {
  private String consumerNamePrefix = "consumer";
  private int consumerCount = 1;
  private int prefetchCount;
  private String contentType;
  private Duration channelNotifyTimeout = Duration.ofSeconds(5);

  public ConsumerConfig() {
  }

  ConsumerConfig(ConsumerConfig config) {
    consumerNamePrefix = config.consumerNamePrefix;
    consumerCount = config.consumerCount;
    prefetchCount = config.prefetchCount;
    contentType = config.contentType;
    channelNotifyTimeout = config.channelNotifyTimeout;
  }

  /**
   * Returns how long stopping the group waits for workers to finish their in-flight delivery.
   */
  public Duration getChannelNotifyTimeout() {
    return channelNotifyTimeout;
  }

  /**
   * Returns the content type deliveries must carry to reach the handler, else null to accept all.
   */
  public String getContentType() {
    return contentType;
  }

  public int getConsumerCount() {
    return consumerCount;
  }

  public String getConsumerNamePrefix() {
    return consumerNamePrefix;
  }

  public int getPrefetchCount() {
    return prefetchCount;
  }

  @Override
  public String toString() {
    return "ConsumerConfig [prefix=" + consumerNamePrefix + ", count=" + consumerCount
        + ", prefetch=" + prefetchCount + ", contentType=" + contentType + "]";
  }

  /**
   * Sets how long stopping the group waits for workers to drain before the channel is closed under
   * them.
   *
   * @throws NullPointerException if {@code channelNotifyTimeout} is null
   * @throws IllegalArgumentException if {@code channelNotifyTimeout} is negative
   */
  public ConsumerConfig withChannelNotifyTimeout(Duration channelNotifyTimeout) {
    Assert.notNull(channelNotifyTimeout, "channelNotifyTimeout");
    Assert.isTrue(!channelNotifyTimeout.isNegative(), "The channelNotifyTimeout cannot be negative");
    this.channelNotifyTimeout = channelNotifyTimeout;
    return this;
  }

  /**
   * Sets the number of concurrent consumer workers.
   *
   * @throws IllegalArgumentException if {@code consumerCount} is < 1
   */
  public ConsumerConfig withConsumerCount(int consumerCount) {
    Assert.isTrue(consumerCount >= 1, "The consumerCount must be at least 1");
    this.consumerCount = consumerCount;
    return this;
  }

  /**
   * Sets the prefix consumer tags are derived from.
   *
   * @throws IllegalArgumentException if {@code consumerNamePrefix} is empty
   */
  public ConsumerConfig withConsumerNamePrefix(String consumerNamePrefix) {
    this.consumerNamePrefix = Assert.notEmpty(consumerNamePrefix, "consumerNamePrefix");
    return this;
  }

  /**
   * Sets the content type deliveries must carry. Null or empty accepts every delivery.
   */
  public ConsumerConfig withContentType(String contentType) {
    this.contentType = contentType == null || contentType.length() == 0 ? null : contentType;
    return this;
  }

  /**
   * Sets the max number of unacknowledged deliveries per consumer, zero for unlimited.
   *
   * @throws IllegalArgumentException if {@code prefetchCount} is negative
   */
  public ConsumerConfig withPrefetchCount(int prefetchCount) {
    Assert.isTrue(prefetchCount >= 0, "The prefetchCount cannot be negative");
    this.prefetchCount = prefetchCount;
    return this;
  }
}
