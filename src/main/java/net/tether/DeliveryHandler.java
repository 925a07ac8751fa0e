package net.tether;

import com.rabbitmq.client.Delivery;

/**
 * Handles deliveries accepted by a consumer worker.
 */
public interface DeliveryHandler {
  /**
   * Handles the {@code delivery}. Returning normally acknowledges the delivery. Throwing negatively
   * acknowledges it with requeue; the worker keeps consuming.
   */
  void handle(Delivery delivery) throws Exception;
}
