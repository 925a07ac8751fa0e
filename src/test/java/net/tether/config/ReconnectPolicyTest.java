package net.tether.config;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

import java.time.Duration;

import org.testng.annotations.Test;

@Test
public class ReconnectPolicyTest {
  public void defaultPolicyShouldReconnectForeverEverySecond() {
    ReconnectPolicy policy = new ReconnectPolicy();
    assertTrue(policy.allowsUnlimitedAttempts());
    assertEquals(policy.getInterval(), Duration.ofSeconds(1));
    assertNull(policy.getMaxInterval());
    assertNull(policy.getMaxDuration());
  }

  public void nonPositiveMaxAttemptsShouldBeUnlimited() {
    assertTrue(new ReconnectPolicy(0, Duration.ofMillis(5)).allowsUnlimitedAttempts());
    assertTrue(new ReconnectPolicy(-1, Duration.ofMillis(5)).allowsUnlimitedAttempts());
    assertFalse(new ReconnectPolicy(1, Duration.ofMillis(5)).allowsUnlimitedAttempts());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectNegativeInterval() {
    new ReconnectPolicy(3, Duration.ofMillis(-1));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectBackoffBeyondMaxInterval() {
    new ReconnectPolicy().withBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectUnitMultiplier() {
    new ReconnectPolicy().withBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 1);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldRejectIntervalAfterBackoff() {
    new ReconnectPolicy().withBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10))
        .withInterval(Duration.ofSeconds(2));
  }
}
