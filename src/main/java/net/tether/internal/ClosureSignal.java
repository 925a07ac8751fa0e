package net.tether.internal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * Single-fire notification that one physical connection has closed. Only the first
 * {@link #fire(ShutdownSignalException, boolean) fire} counts; later ones are ignored.
 */
public class ClosureSignal {
  private final String connectionName;
  private final AtomicBoolean fired = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);
  private volatile ShutdownSignalException cause;
  private volatile boolean intentional;

  ClosureSignal(String connectionName) {
    this.connectionName = connectionName;
  }

  /**
   * Waits until the signal fires, returning the closure cause, which is null for closures that did
   * not come from the client library.
   */
  public ShutdownSignalException await() throws InterruptedException {
    latch.await();
    return cause;
  }

  /**
   * Waits up to {@code waitDuration} for the signal to fire.
   *
   * @return true if the signal fired
   */
  public boolean await(Duration waitDuration) throws InterruptedException {
    return latch.await(waitDuration.toNanos(), TimeUnit.NANOSECONDS);
  }

  public ShutdownSignalException getCause() {
    return cause;
  }

  public boolean isFired() {
    return latch.getCount() == 0;
  }

  /**
   * Returns whether the closure was requested through a shutdown, as opposed to being caused by the
   * broker, the network or a recycle.
   */
  public boolean isIntentional() {
    return intentional;
  }

  @Override
  public String toString() {
    return "closure of " + connectionName
        + (isFired() ? intentional ? " (intentional)" : " (unexpected)" : "");
  }

  /**
   * Fires the signal.
   *
   * @return true if this call fired the signal, false if it had already fired
   */
  boolean fire(ShutdownSignalException cause, boolean intentional) {
    if (!fired.compareAndSet(false, true))
      return false;
    this.cause = cause;
    this.intentional = intentional;
    latch.countDown();
    return true;
  }
}
