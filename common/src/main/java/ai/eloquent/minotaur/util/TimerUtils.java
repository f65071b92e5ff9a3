package ai.eloquent.minotaur.util;

import java.time.Duration;

/**
 * Utilities for printing time in log messages.
 */
public class TimerUtils {

  /** Static utility class */
  private TimerUtils() {}


  /**
   * Format a time difference in a human-readable format.
   * Under 100ms we print milliseconds; under a minute we print fractional seconds;
   * beyond that we print minutes and seconds (and hours, if it comes to that).
   *
   * @param diff The difference in milliseconds between two timestamps.
   *
   * @return A human-readable debug string of this time difference.
   */
  public static String formatTimeDifference(long diff) {
    if (diff < 0) {
      return "-" + formatTimeDifference(-diff);
    }
    if (diff < 100) {
      return diff + " ms";
    }
    if (diff < 60000) {
      return String.format("%d.%03d seconds", diff / 1000, diff % 1000);
    }
    long seconds = diff / 1000;
    long hours = seconds / 3600;
    long minutes = (seconds % 3600) / 60;
    long secs = seconds % 60;
    StringBuilder b = new StringBuilder();
    if (hours > 0) {
      b.append(hours).append(hours > 1 ? " hours, " : " hour, ");
    }
    b.append(String.format("%02d:%02d minutes", minutes, secs));
    return b.toString();
  }


  /**
   * @see #formatTimeDifference(long)
   */
  public static String formatDuration(Duration duration) {
    return formatTimeDifference(duration.toMillis());
  }


  /**
   * Format the amount of time that has elapsed since the argument time.
   *
   * @param clock The clock the start time was read from.
   * @param startTime The time we started measuring from.
   *
   * @return A human-readable debug string of the elapsed time.
   */
  public static String formatTimeSince(HarnessClock clock, long startTime) {
    return formatTimeDifference(clock.now() - startTime);
  }
}
