package org.waabox.nexus.index;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.ResultRound;

/**
 * Builds a {@link PodiumIndex} by scanning every round of every
 * competitor's result history.
 *
 * <p>A round counts when it is a final, the position is 1, 2 or 3, and
 * the best or the average is a valid result. Competitors without any
 * podium are left out.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PodiumIndexBuilder {

  /**
   * Builds the index.
   *
   * @param competitors the competitors, never null
   *
   * @return the podium index, never null
   */
  public PodiumIndex build(final List<Competitor> competitors) {
    Objects.requireNonNull(competitors, "competitors must not be null");
    final Map<String, Map<String, Integer>> counts = new TreeMap<>();
    for (final Competitor competitor : competitors) {
      final Map<String, Integer> events = countPodiums(competitor);
      if (!events.isEmpty()) {
        counts.putIfAbsent(competitor.id(), events);
      }
    }
    return new PodiumIndex(counts);
  }

  /**
   * Counts the podiums of one competitor.
   *
   * @param competitor the competitor, never null
   *
   * @return event id to podium count, never null
   */
  static Map<String, Integer> countPodiums(final Competitor competitor) {
    final Map<String, Integer> events = new TreeMap<>();
    for (final ResultRound round : competitor.results()) {
      if (round.isPodium()) {
        events.merge(round.eventId(), 1, Integer::sum);
      }
    }
    return events;
  }
}
