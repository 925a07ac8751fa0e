package net.tether.config;

import java.time.Duration;

import net.tether.internal.util.Assert;

/**
 * Policy that bounds how reconnection is attempted after an unexpected connection closure.
 */
public class ReconnectPolicy {
  private int maxAttempts;
  private Duration interval = Duration.ofSeconds(1);
  private Duration maxInterval;
  private int intervalMultiplier;
  private Duration maxDuration;

  /**
   * Creates a policy that reconnects forever, pausing one second between attempts.
   */
  public ReconnectPolicy() {
  }

  /**
   * Creates a policy performing at most {@code maxAttempts} attempts, pausing {@code interval}
   * between them.
   */
  public ReconnectPolicy(int maxAttempts, Duration interval) {
    withMaxAttempts(maxAttempts);
    withInterval(interval);
  }

  /**
   * Returns whether attempts are bounded only by the max duration, if any. True when max attempts
   * is zero or negative.
   */
  public boolean allowsUnlimitedAttempts() {
    return maxAttempts <= 0;
  }

  /**
   * Returns the interval between attempts, or the initial interval when backing off.
   */
  public Duration getInterval() {
    return interval;
  }

  /**
   * Returns the interval multiplier for backoff attempts.
   *
   * @see #withBackoff(Duration, Duration, int)
   */
  public int getIntervalMultiplier() {
    return intervalMultiplier;
  }

  /**
   * Returns the max attempts, zero or less meaning unlimited.
   *
   * @see #withMaxAttempts(int)
   */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the max duration to perform attempts for, else null.
   *
   * @see #withMaxDuration(Duration)
   */
  public Duration getMaxDuration() {
    return maxDuration;
  }

  /**
   * Returns the max interval between backoff attempts, else null when not backing off.
   *
   * @see #withBackoff(Duration, Duration)
   */
  public Duration getMaxInterval() {
    return maxInterval;
  }

  @Override
  public String toString() {
    return "ReconnectPolicy [maxAttempts=" + (allowsUnlimitedAttempts() ? "unlimited" : maxAttempts)
        + ", interval=" + interval + (maxInterval == null ? "" : ", maxInterval=" + maxInterval)
        + (maxDuration == null ? "" : ", maxDuration=" + maxDuration) + "]";
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing off to the
   * {@code maxInterval} multiplying successive intervals by a factor of 2.
   *
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0 or {@code interval} is >=
   *           {@code maxInterval}
   */
  public ReconnectPolicy withBackoff(Duration interval, Duration maxInterval) {
    return withBackoff(interval, maxInterval, 2);
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing off to the
   * {@code maxInterval} multiplying successive intervals by the {@code intervalMultiplier}.
   *
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0, {@code interval} is >=
   *           {@code maxInterval} or the {@code intervalMultiplier} is <= 1
   */
  public ReconnectPolicy withBackoff(Duration interval, Duration maxInterval, int intervalMultiplier) {
    Assert.notNull(interval, "interval");
    Assert.notNull(maxInterval, "maxInterval");
    Assert.isTrue(!interval.isNegative() && !interval.isZero(), "The interval must be greater than 0");
    Assert.isTrue(interval.compareTo(maxInterval) < 0,
        "The interval must be less than the maxInterval");
    Assert.isTrue(intervalMultiplier > 1, "The intervalMultiplier must be greater than 1");
    this.interval = interval;
    this.maxInterval = maxInterval;
    this.intervalMultiplier = intervalMultiplier;
    return this;
  }

  /**
   * Sets the {@code interval} to pause for between attempts.
   *
   * @throws NullPointerException if {@code interval} is null
   * @throws IllegalArgumentException if {@code interval} is negative
   * @throws IllegalStateException if backoff intervals have already been set via
   *           {@link #withBackoff(Duration, Duration)} or
   *           {@link #withBackoff(Duration, Duration, int)}
   */
  public ReconnectPolicy withInterval(Duration interval) {
    Assert.notNull(interval, "interval");
    Assert.isTrue(!interval.isNegative(), "The interval cannot be negative");
    Assert.state(maxInterval == null, "Backoff intervals have already been set");
    this.interval = interval;
    return this;
  }

  /**
   * Sets the max number of attempts to perform. Zero or less attempts forever.
   */
  public ReconnectPolicy withMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  /**
   * Sets the max duration to perform attempts for.
   *
   * @throws NullPointerException if {@code maxDuration} is null
   */
  public ReconnectPolicy withMaxDuration(Duration maxDuration) {
    this.maxDuration = Assert.notNull(maxDuration, "maxDuration");
    return this;
  }
}
