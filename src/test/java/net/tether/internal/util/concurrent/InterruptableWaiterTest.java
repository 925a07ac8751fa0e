package net.tether.internal.util.concurrent;

import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import java.time.Duration;

import net.jodah.concurrentunit.Waiter;

import org.testng.annotations.Test;

@Test
public class InterruptableWaiterTest {
  public void shouldInterruptTimedWaiters() throws Throwable {
    final InterruptableWaiter iw = new InterruptableWaiter();
    final Waiter waiter = new Waiter();

    for (int i = 0; i < 3; i++)
      new Thread(new Runnable() {
        @Override
        public void run() {
          try {
            iw.await(Duration.ofMinutes(1));
          } catch (InterruptedException expected) {
            waiter.resume();
          }
        }
      }).start();

    Thread.sleep(100);
    assertTrue(iw.hasWaiters());
    iw.interruptWaiters();
    waiter.await(500, 3);
  }

  public void timedWaiterShouldTimeoutQuietly() throws Throwable {
    InterruptableWaiter iw = new InterruptableWaiter();
    iw.await(Duration.ofMillis(100));
    assertFalse(iw.hasWaiters());
  }

  public void shouldNotWaitForZeroDuration() throws Throwable {
    long start = System.nanoTime();
    new InterruptableWaiter().await(Duration.ZERO);
    assertTrue(System.nanoTime() - start < Duration.ofMillis(100).toNanos());
  }
}
