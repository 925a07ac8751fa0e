package net.tether.internal.util.concurrent;

import java.time.Duration;
import java.util.concurrent.locks.AbstractQueuedSynchronizer;

/**
 * A circuit that callers wait on while it is open. Opening and closing are idempotent and may be
 * performed by any thread. Closing releases every waiter.
 */
public class ReentrantCircuit {
  private final Sync sync = new Sync();

  /**
   * Synchronization state of 0 = closed, 1 = open.
   */
  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = 992522674231731445L;

    boolean isClosed() {
      return getState() == 0;
    }

    void open() {
      setState(1);
    }

    @Override
    protected int tryAcquireShared(int ignored) {
      return isClosed() ? 1 : -1;
    }

    @Override
    protected boolean tryReleaseShared(int ignored) {
      setState(0);
      return true;
    }
  }

  /**
   * Waits for the circuit to be closed, aborting if interrupted.
   */
  public void await() throws InterruptedException {
    sync.acquireSharedInterruptibly(0);
  }

  /**
   * Waits up to {@code waitDuration} for the circuit to be closed, aborting if interrupted.
   *
   * @return true if the circuit was closed before the wait elapsed
   */
  public boolean await(Duration waitDuration) throws InterruptedException {
    return sync.tryAcquireSharedNanos(0, waitDuration.toNanos());
  }

  /**
   * Closes the circuit, releasing any waiting threads.
   */
  public void close() {
    sync.releaseShared(1);
  }

  /**
   * Interrupts waiting threads.
   */
  public void interruptWaiters() {
    for (Thread t : sync.getSharedQueuedThreads())
      t.interrupt();
  }

  public boolean isClosed() {
    return sync.isClosed();
  }

  /**
   * Opens the circuit.
   */
  public void open() {
    sync.open();
  }

  @Override
  public String toString() {
    return isClosed() ? "closed" : "open";
  }
}
