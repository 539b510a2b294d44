package org.waabox.nexus.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.waabox.nexus.model.Competition;

/**
 * Filters competitions by the events they hold.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CompetitionFilter {

  /** The cap applied to unfiltered and partial searches. */
  public static final int MAX_RESULTS = 100;

  /** Most recent start first, then id. */
  private static final Comparator<Competition> MOST_RECENT_FIRST = Comparator
      .comparing(Competition::from).reversed()
      .thenComparing(Competition::id);

  private CompetitionFilter() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Finds competitions by event set, most recent first.
   *
   * <p>Without requested events, the most recent competitions are
   * returned. A partial search keeps competitions holding at least the
   * requested events; an exact search keeps those holding exactly them.
   * Unfiltered and partial searches stop at {@link #MAX_RESULTS}.
   *
   * @param competitions the competitions, never null
   * @param eventIds     the requested events, never null
   * @param partial      true for an inclusive match, false for an exact
   *                     one
   *
   * @return the matching competitions, never null
   */
  public static List<Competition> find(
      final Collection<Competition> competitions,
      final Set<String> eventIds, final boolean partial) {
    Objects.requireNonNull(competitions, "competitions must not be null");
    Objects.requireNonNull(eventIds, "eventIds must not be null");

    final Set<String> requested = new HashSet<>();
    for (final String eventId : eventIds) {
      if (!eventId.isBlank()) {
        requested.add(eventId.trim());
      }
    }

    final List<Competition> sorted = new ArrayList<>(competitions);
    sorted.sort(MOST_RECENT_FIRST);
    if (requested.isEmpty()) {
      return List.copyOf(sorted.subList(0,
          Math.min(MAX_RESULTS, sorted.size())));
    }

    final List<Competition> matches = new ArrayList<>();
    for (final Competition competition : sorted) {
      final Set<String> held = new HashSet<>(competition.events());
      if (partial ? held.containsAll(requested) : held.equals(requested)) {
        matches.add(competition);
        if (partial && matches.size() >= MAX_RESULTS) {
          break;
        }
      }
    }
    return matches;
  }
}
