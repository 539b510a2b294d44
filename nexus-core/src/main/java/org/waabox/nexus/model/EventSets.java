package org.waabox.nexus.model;

import java.util.HashSet;
import java.util.Set;

/**
 * The fixed event id sets the classification and search logic rely on.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventSets {

  /** The canonical single-event set. */
  public static final Set<String> SINGLE_EVENTS = Set.of(
      "333", "222", "444", "555", "666", "777", "333oh", "333bf", "333fm",
      "clock", "minx", "pyram", "skewb", "sq1", "444bf", "555bf", "333mbf");

  /** Events whose average is required for the silver tier. */
  public static final Set<String> SILVER_AVERAGE_EVENTS = Set.of(
      "333", "222", "444", "555", "666", "777", "333oh",
      "minx", "pyram", "skewb", "sq1", "clock");

  /** Events whose average is required for the gold tier. */
  public static final Set<String> GOLD_AVERAGE_EVENTS = union(
      SILVER_AVERAGE_EVENTS, Set.of("333bf", "333fm", "444bf", "555bf"));

  /** Retired events tolerated by specialist purity checks. */
  public static final Set<String> LEGACY_EVENTS = Set.of(
      "333mbo", "magic", "mmagic", "333ft");

  /** Events removed from every record at parse time. */
  public static final Set<String> HIDDEN_EVENTS = Set.of("fto");

  private EventSets() {
    throw new UnsupportedOperationException("Utility class");
  }

  private static Set<String> union(final Set<String> a, final Set<String> b) {
    final Set<String> result = new HashSet<>(a);
    result.addAll(b);
    return Set.copyOf(result);
  }
}
