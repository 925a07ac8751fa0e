package net.tether.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.tether.internal.util.Assert;

/**
 * Parses human readable durations such as {@code 50ms}, {@code 5 seconds} or {@code 2m}.
 */
public final class Durations {
  private static final Pattern PATTERN = Pattern.compile("(\\d+)\\s*(" + "ns|nanosecond(s)?|"
      + "us|microsecond(s)?|" + "ms|millisecond(s)?|" + "s|second(s)?|" + "m|minute(s)?|"
      + "h|hour(s)?|" + "d|day(s)?" + ")");
  private static final Map<String, ChronoUnit> SUFFIXES = new HashMap<String, ChronoUnit>();

  static {
    register(ChronoUnit.NANOS, "ns", "nanosecond", "nanoseconds");
    register(ChronoUnit.MICROS, "us", "microsecond", "microseconds");
    register(ChronoUnit.MILLIS, "ms", "millisecond", "milliseconds");
    register(ChronoUnit.SECONDS, "s", "second", "seconds");
    register(ChronoUnit.MINUTES, "m", "minute", "minutes");
    register(ChronoUnit.HOURS, "h", "hour", "hours");
    register(ChronoUnit.DAYS, "d", "day", "days");
  }

  private Durations() {
  }

  /**
   * Returns the Duration parsed from {@code duration}.
   *
   * @throws NullPointerException if {@code duration} is null
   * @throws IllegalArgumentException if {@code duration} is not a count followed by a unit
   */
  public static Duration parse(String duration) {
    Assert.notNull(duration, "duration");
    Matcher matcher = PATTERN.matcher(duration.trim());
    Assert.isTrue(matcher.matches(), "Invalid duration: %s", duration);
    return Duration.of(Long.parseLong(matcher.group(1)), SUFFIXES.get(matcher.group(2)));
  }

  private static void register(ChronoUnit unit, String... suffixes) {
    for (String suffix : suffixes)
      SUFFIXES.put(suffix, unit);
  }
}
