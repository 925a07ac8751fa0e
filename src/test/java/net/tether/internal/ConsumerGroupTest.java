package net.tether.internal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.concurrentunit.Waiter;
import net.tether.ChannelOpenException;
import net.tether.DeliveryHandler;
import net.tether.config.ConsumerConfig;

import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

@Test
public class ConsumerGroupTest extends AbstractFunctionalTest {
  private static final BasicProperties JSON = new BasicProperties.Builder().contentType(
      "application/json").build();

  ConsumerGroup group;
  Channel channel;
  Map<String, Consumer> consumers;

  @BeforeMethod
  protected void beforeMethod() throws Exception {
    super.beforeMethod();
    group = new ConsumerGroup(new ChannelProvisioner());
    channel = mockChannel();
    consumers = new ConcurrentHashMap<String, Consumer>();
    doAnswer(new Answer<String>() {
      @Override
      public String answer(InvocationOnMock invocation) {
        String tag = invocation.getArgument(2);
        consumers.put(tag, invocation.<Consumer>getArgument(3));
        return tag;
      }
    }).when(channel).basicConsume(anyString(), anyBoolean(), anyString(), any(Consumer.class));
  }

  @AfterMethod
  protected void afterMethod() {
    group.stop();
  }

  private void deliver(String consumerTag, long deliveryTag, BasicProperties properties)
      throws Exception {
    consumers.get(consumerTag).handleDelivery(consumerTag,
        new Envelope(deliveryTag, false, "orders", "new"), properties, "{}".getBytes("UTF-8"));
  }

  private static DeliveryHandler noopHandler() {
    return new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) {
      }
    };
  }

  public void shouldComputeConsumerTags() {
    assertEquals(ConsumerGroup.consumerTags("orders", 3),
        Arrays.asList("orders-1", "orders-2", "orders-3"));
  }

  public void shouldRegisterConsumersWithManualAck() throws Throwable {
    group.start(channel, "orders.new",
        new ConsumerConfig().withConsumerNamePrefix("orders").withConsumerCount(3)
            .withPrefetchCount(20), noopHandler());

    verify(channel).basicQos(20);
    verify(channel).basicConsume(eq("orders.new"), eq(false), eq("orders-1"), any(Consumer.class));
    verify(channel).basicConsume(eq("orders.new"), eq(false), eq("orders-2"), any(Consumer.class));
    verify(channel).basicConsume(eq("orders.new"), eq(false), eq("orders-3"), any(Consumer.class));
    assertEquals(group.getConsumerTags(), Arrays.asList("orders-1", "orders-2", "orders-3"));
    assertTrue(group.isRunning());
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldStartOnlyOnce() throws Throwable {
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());
  }

  public void shouldAckHandledDeliveries() throws Throwable {
    final Waiter waiter = new Waiter();
    group.start(channel, "orders.new", new ConsumerConfig(), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) {
        waiter.assertEquals(delivery.getEnvelope().getDeliveryTag(), 7L);
        waiter.resume();
      }
    });

    deliver("consumer-1", 7, JSON);

    waiter.await(1000);
    verify(channel, timeout(1000)).basicAck(7, false);
  }

  public void shouldRequeueFailedDeliveries() throws Throwable {
    final AtomicInteger calls = new AtomicInteger();
    group.start(channel, "orders.new", new ConsumerConfig(), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) throws Exception {
        if (calls.incrementAndGet() == 1)
          throw new IllegalStateException("boom");
      }
    });

    deliver("consumer-1", 1, JSON);
    deliver("consumer-1", 2, JSON);

    // The worker keeps going after a failure
    verify(channel, timeout(1000)).basicNack(1, false, true);
    verify(channel, timeout(1000)).basicAck(2, false);
  }

  public void shouldRequeueDeliveriesWhoseHandlerThrowsError() throws Throwable {
    final AtomicInteger calls = new AtomicInteger();
    group.start(channel, "orders.new", new ConsumerConfig(), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) {
        if (calls.incrementAndGet() == 1)
          throw new AssertionError("bad payload");
      }
    });

    deliver("consumer-1", 1, JSON);
    deliver("consumer-1", 2, JSON);

    verify(channel, timeout(1000)).basicNack(1, false, true);
    verify(channel, timeout(1000)).basicAck(2, false);
  }

  public void shouldRejectMismatchedContentTypeWithoutHandling() throws Throwable {
    final AtomicInteger calls = new AtomicInteger();
    group.start(channel, "orders.new", new ConsumerConfig().withContentType("application/json"),
        new DeliveryHandler() {
          @Override
          public void handle(Delivery delivery) {
            calls.incrementAndGet();
          }
        });

    deliver("consumer-1", 1, new BasicProperties.Builder().contentType("text/plain").build());
    deliver("consumer-1", 2, null);
    deliver("consumer-1", 3, JSON);

    verify(channel, timeout(1000)).basicNack(1, false, false);
    verify(channel, timeout(1000)).basicNack(2, false, false);
    verify(channel, timeout(1000)).basicAck(3, false);
    assertEquals(calls.get(), 1);
  }

  public void shouldAcceptAnyContentTypeByDefault() throws Throwable {
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());

    deliver("consumer-1", 1, new BasicProperties.Builder().contentType("text/plain").build());
    deliver("consumer-1", 2, null);

    verify(channel, timeout(1000)).basicAck(1, false);
    verify(channel, timeout(1000)).basicAck(2, false);
  }

  public void stopShouldDrainBusyWorkers() throws Throwable {
    final CountDownLatch started = new CountDownLatch(5);
    group.start(channel, "orders.new", new ConsumerConfig().withConsumerCount(5)
        .withChannelNotifyTimeout(Duration.ofSeconds(5)), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) throws Exception {
        started.countDown();
        Thread.sleep(300);
      }
    });

    for (int i = 1; i <= 5; i++)
      deliver("consumer-" + i, i, JSON);
    assertTrue(started.await(2, TimeUnit.SECONDS));

    long startTime = System.nanoTime();
    assertTrue(group.stop());
    assertTrue(System.nanoTime() - startTime < TimeUnit.SECONDS.toNanos(5));

    for (int i = 1; i <= 5; i++) {
      verify(channel).basicCancel("consumer-" + i);
      verify(channel).basicAck(i, false);
    }
    verify(channel, never()).abort();
    assertFalse(group.isRunning());
  }

  public void stopShouldAbortChannelWhenWorkersDoNotFinish() throws Throwable {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch blocker = new CountDownLatch(1);
    group.start(channel, "orders.new", new ConsumerConfig()
        .withChannelNotifyTimeout(Duration.ofMillis(200)), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) throws Exception {
        started.countDown();
        blocker.await();
      }
    });

    deliver("consumer-1", 1, JSON);
    assertTrue(started.await(2, TimeUnit.SECONDS));

    assertFalse(group.stop());
    verify(channel).abort();
  }

  public void stopShouldBeIdempotent() throws Throwable {
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());

    assertTrue(group.stop());
    assertTrue(group.stop());
    verify(channel).basicCancel("consumer-1");
  }

  public void concurrentStopShouldWaitForDrain() throws Throwable {
    final Waiter waiter = new Waiter();
    final CountDownLatch started = new CountDownLatch(1);
    group.start(channel, "orders.new", new ConsumerConfig()
        .withChannelNotifyTimeout(Duration.ofSeconds(5)), new DeliveryHandler() {
      @Override
      public void handle(Delivery delivery) throws Exception {
        started.countDown();
        Thread.sleep(500);
      }
    });

    deliver("consumer-1", 1, JSON);
    assertTrue(started.await(2, TimeUnit.SECONDS));
    runInThread(new Runnable() {
      @Override
      public void run() {
        waiter.assertTrue(group.stop());
        waiter.resume();
      }
    });
    Thread.sleep(100);

    // Returns once the first stop has drained the busy worker
    assertTrue(group.stop());
    verify(channel).basicAck(1, false);
    waiter.await(5000);
  }

  public void stopBeforeStartShouldDoNothing() {
    assertTrue(group.stop());
  }

  public void workerShouldEndWhenCancelledByBroker() throws Throwable {
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());

    consumers.get("consumer-1").handleCancel("consumer-1");

    assertTrue(group.stop());
    verify(channel, never()).basicCancel("consumer-1");
  }

  public void shouldNotAckAfterChannelClosed() throws Throwable {
    group.start(channel, "orders.new", new ConsumerConfig(), noopHandler());
    closeChannel(channel);
    consumers.get("consumer-1").handleShutdownSignal("consumer-1",
        channelShutdownSignal(406, "PRECONDITION_FAILED"));

    assertTrue(group.stop());
    verify(channel, never()).basicAck(anyLong(), anyBoolean());
  }

  @Test(expectedExceptions = ChannelOpenException.class)
  public void shouldFailWhenFlowControlIsRejected() throws Throwable {
    doThrow(new IOException("rejected")).when(channel).basicQos(1);
    group.start(channel, "orders.new", new ConsumerConfig().withPrefetchCount(1), noopHandler());
  }
}
