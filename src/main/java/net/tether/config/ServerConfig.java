package net.tether.config;

import net.tether.internal.util.Assert;

/**
 * Everything a server facade maintains on top of its connection: the topology, the consumer group
 * and the reconnect policy.
 */
public class ServerConfig {
  private TopologyConfig topology = new TopologyConfig();
  private ConsumerConfig consumer = new ConsumerConfig();
  private ReconnectPolicy reconnectPolicy = new ReconnectPolicy();

  public ServerConfig() {
  }

  /**
   * Returns a copy of the topology and consumer configs. The reconnect policy is shared.
   */
  public ServerConfig copy() {
    ServerConfig copy = new ServerConfig();
    copy.topology = new TopologyConfig(topology);
    copy.consumer = new ConsumerConfig(consumer);
    copy.reconnectPolicy = reconnectPolicy;
    return copy;
  }

  public ConsumerConfig getConsumer() {
    return consumer;
  }

  public ReconnectPolicy getReconnectPolicy() {
    return reconnectPolicy;
  }

  public TopologyConfig getTopology() {
    return topology;
  }

  public ServerConfig withConsumer(ConsumerConfig consumer) {
    this.consumer = Assert.notNull(consumer, "consumer");
    return this;
  }

  public ServerConfig withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = Assert.notNull(reconnectPolicy, "reconnectPolicy");
    return this;
  }

  public ServerConfig withTopology(TopologyConfig topology) {
    this.topology = Assert.notNull(topology, "topology");
    return this;
  }
}
