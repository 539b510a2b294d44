package org.waabox.nexus.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.waabox.nexus.model.EventSets;

/**
 * Podium finish counts per competitor and event.
 *
 * <p>Instances are built by {@link PodiumIndexBuilder} and are safe for
 * concurrent reads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PodiumIndex {

  /** An index without podiums. */
  private static final PodiumIndex EMPTY = new PodiumIndex(new TreeMap<>());

  /** Competitor id to event id to podium count. */
  private final Map<String, Map<String, Integer>> counts;

  /** Event id to the competitors with a podium in it. */
  private final Map<String, SortedSet<String>> competitorsByEvent;

  PodiumIndex(final Map<String, Map<String, Integer>> theCounts) {
    counts = theCounts;
    competitorsByEvent = new TreeMap<>();
    theCounts.forEach((competitorId, events) ->
        events.keySet().forEach(eventId ->
            competitorsByEvent.computeIfAbsent(eventId, e -> new TreeSet<>())
                .add(competitorId)));
  }

  /**
   * Returns an index without podiums.
   *
   * @return the empty index, never null
   */
  public static PodiumIndex empty() {
    return EMPTY;
  }

  /**
   * Returns the podium counts of a competitor.
   *
   * @param competitorId the competitor id, never null
   *
   * @return an unmodifiable event id to count map, empty if the competitor
   *         has no podium, never null
   */
  public Map<String, Integer> podiumsOf(final String competitorId) {
    Objects.requireNonNull(competitorId, "competitorId must not be null");
    final Map<String, Integer> events = counts.get(competitorId);
    return events == null ? Map.of() : Collections.unmodifiableMap(events);
  }

  /**
   * Returns the competitors whose podium events are exactly the requested
   * set.
   *
   * <p>Legacy events are ignored on both sides: they are removed from the
   * request, and a competitor's podiums in them do not break the match.
   * A request holding only legacy events matches nobody.
   *
   * @param eventIds the requested event ids, never null
   *
   * @return the matching competitor ids in id order, never null
   */
  public List<String> findBySet(final Set<String> eventIds) {
    Objects.requireNonNull(eventIds, "eventIds must not be null");
    final Set<String> requested = new TreeSet<>();
    for (final String eventId : eventIds) {
      final String trimmed = eventId.trim();
      if (!trimmed.isEmpty() && !EventSets.LEGACY_EVENTS.contains(trimmed)) {
        requested.add(trimmed);
      }
    }
    if (requested.isEmpty()) {
      return List.of();
    }

    SortedSet<String> candidates = null;
    for (final String eventId : requested) {
      final SortedSet<String> holders = competitorsByEvent.get(eventId);
      if (holders == null) {
        return List.of();
      }
      if (candidates == null || holders.size() < candidates.size()) {
        candidates = holders;
      }
    }

    final List<String> matches = new ArrayList<>();
    for (final String competitorId : candidates) {
      if (requested.equals(pureEvents(competitorId))) {
        matches.add(competitorId);
      }
    }
    return matches;
  }

  /**
   * Returns the number of competitors with at least one podium.
   *
   * @return the number of competitors
   */
  public int size() {
    return counts.size();
  }

  private Set<String> pureEvents(final String competitorId) {
    final Set<String> events = new TreeSet<>(podiumsOf(competitorId).keySet());
    events.removeAll(EventSets.LEGACY_EVENTS);
    return events;
  }
}
