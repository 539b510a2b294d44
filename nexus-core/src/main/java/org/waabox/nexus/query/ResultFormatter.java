package org.waabox.nexus.query;

import java.util.Locale;

/**
 * Formats raw result values the way competitors read them, and turns them
 * into comparable times.
 *
 * <p>Raw values are centiseconds for timed events, a move count for
 * fewest moves, and a packed points / time / missed number for multi
 * blind.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResultFormatter {

  /** The fewest moves event. */
  static final String FEWEST_MOVES = "333fm";

  /** The multi blind event. */
  static final String MULTI_BLIND = "333mbf";

  /** Ten minutes, in seconds; from there on hundredths are not shown. */
  private static final int NO_FRACTION_FROM = 600;

  private ResultFormatter() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Formats a result.
   *
   * @param eventId the event id, never null
   * @param value   the raw result value
   *
   * @return {@code DNF} for a missing or invalid result, {@code N moves}
   *         for fewest moves, {@code m:ss} for multi blind, and
   *         {@code mm:ss.cc} otherwise, never null
   */
  public static String format(final String eventId, final int value) {
    if (value <= 0) {
      return "DNF";
    }
    if (FEWEST_MOVES.equals(eventId)) {
      return value + " moves";
    }
    if (MULTI_BLIND.equals(eventId)) {
      final int seconds = multiBlindSeconds(value);
      return String.format(Locale.ROOT, "%d:%02d", seconds / 60,
          seconds % 60);
    }
    final int totalSeconds = value / 100;
    final int hundredths = totalSeconds >= NO_FRACTION_FROM ? 0 : value % 100;
    return String.format(Locale.ROOT, "%02d:%02d.%02d", totalSeconds / 60,
        totalSeconds % 60, hundredths);
  }

  /**
   * Returns a value comparable across events, in centiseconds.
   *
   * <p>Multi blind is reduced to its time part and fewest moves counts
   * one move as one second.
   *
   * @param eventId the event id, never null
   * @param value   the raw result value
   *
   * @return the comparable time, {@link Long#MAX_VALUE} for an invalid
   *         result
   */
  public static long comparableTime(final String eventId, final int value) {
    if (value <= 0) {
      return Long.MAX_VALUE;
    }
    if (MULTI_BLIND.equals(eventId)) {
      return multiBlindSeconds(value) * 100L;
    }
    if (FEWEST_MOVES.equals(eventId)) {
      return value * 100L;
    }
    return value;
  }

  /**
   * Extracts the time of a multi blind result, in seconds.
   *
   * <p>Current results are packed as {@code 0DDTTTTTMM} and old ones as
   * {@code 1SSAATTTTT}.
   *
   * @param value the raw multi blind value
   *
   * @return the time in seconds
   */
  static int multiBlindSeconds(final int value) {
    final String digits = String.format(Locale.ROOT, "%010d", value);
    final String time = digits.startsWith("0")
        ? digits.substring(3, 8)
        : digits.substring(5, 10);
    return Integer.parseInt(time);
  }
}
