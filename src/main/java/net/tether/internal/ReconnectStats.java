package net.tether.internal;

import java.time.Duration;

import net.tether.config.ReconnectPolicy;

/**
 * Tracks the progress of one reconnect cycle against its {@link ReconnectPolicy}.
 */
final class ReconnectStats {
  private final int maxAttempts;
  private final long maxDuration;
  private final long startTime;

  // Backoff stats
  private final int intervalMultiplier;
  private final long maxInterval;

  // Mutable state
  private int attemptCount;
  private long waitTime;

  ReconnectStats(ReconnectPolicy policy) {
    maxAttempts = policy.allowsUnlimitedAttempts() ? -1 : policy.getMaxAttempts();
    maxDuration = policy.getMaxDuration() == null ? -1 : policy.getMaxDuration().toNanos();
    waitTime = policy.getInterval().toNanos();
    if (policy.getMaxInterval() == null) {
      intervalMultiplier = -1;
      maxInterval = -1;
    } else {
      intervalMultiplier = policy.getIntervalMultiplier();
      maxInterval = policy.getMaxInterval().toNanos();
    }
    startTime = System.nanoTime();
  }

  int getAttemptCount() {
    return attemptCount;
  }

  /**
   * Returns how long to pause before the next attempt, never beyond the policy's max duration.
   */
  Duration getWaitTime() {
    if (maxDuration == -1)
      return Duration.ofNanos(waitTime);
    long remaining = maxDuration - (System.nanoTime() - startTime);
    return Duration.ofNanos(Math.max(0, Math.min(waitTime, remaining)));
  }

  /**
   * Records a failed attempt, growing the wait time when backing off. The first recorded attempt
   * keeps the initial interval.
   */
  void recordFailedAttempt() {
    if (attemptCount > 0 && intervalMultiplier != -1)
      waitTime = Math.min(maxInterval, waitTime * intervalMultiplier);
    attemptCount++;
  }

  /**
   * Returns true if the max attempts or max duration for the policy have been exceeded.
   */
  boolean isPolicyExceeded() {
    boolean withinMaxAttempts = maxAttempts == -1 || attemptCount < maxAttempts;
    boolean withinMaxDuration = maxDuration == -1 || System.nanoTime() - startTime < maxDuration;
    return !withinMaxAttempts || !withinMaxDuration;
  }
}
