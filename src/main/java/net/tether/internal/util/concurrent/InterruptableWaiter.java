package net.tether.internal.util.concurrent;

import java.time.Duration;
import java.util.concurrent.locks.AbstractQueuedSynchronizer;

/**
 * A waiter where waiting threads can be interrupted (as opposed to awakened). Used to sleep between
 * reconnect attempts while still reacting promptly to a shutdown.
 */
public class InterruptableWaiter {
  private final Sync sync = new Sync();

  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = -2374198413372211743L;

    @Override
    protected int tryAcquireShared(int acquires) {
      // Disallow acquisition
      return -1;
    }
  }

  /**
   * Waits for the {@code waitDuration}, aborting if interrupted. Zero or negative durations return
   * immediately.
   */
  public void await(Duration waitDuration) throws InterruptedException {
    long nanos = waitDuration.toNanos();
    if (nanos > 0)
      sync.tryAcquireSharedNanos(0, nanos);
  }

  /**
   * Returns whether any thread is currently waiting.
   */
  public boolean hasWaiters() {
    return sync.hasQueuedThreads();
  }

  /**
   * Interrupts waiting threads.
   */
  public void interruptWaiters() {
    for (Thread t : sync.getSharedQueuedThreads())
      t.interrupt();
  }
}
