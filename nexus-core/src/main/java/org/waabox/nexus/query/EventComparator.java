package org.waabox.nexus.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.RankEntry;

/**
 * Finds competitors who are faster in one event than in another.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EventComparator {

  /** The maximum number of comparisons returned. */
  public static final int MAX_RESULTS = 100;

  /** Largest difference first, then competitor id. */
  private static final Comparator<EventComparison> BEST_FIRST = Comparator
      .comparingDouble(EventComparison::difference).reversed()
      .thenComparing(EventComparison::competitorId);

  private EventComparator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Compares two events across all competitors.
   *
   * <p>Only competitors with a valid single in both events are considered,
   * and only those strictly faster in the first event are kept.
   *
   * @param competitors the competitors, never null
   * @param firstEvent  the event expected to be faster, never null
   * @param secondEvent the event expected to be slower, never null
   *
   * @return at most {@link #MAX_RESULTS} comparisons, largest difference
   *         first, never null
   */
  public static List<EventComparison> compare(
      final Collection<Competitor> competitors, final String firstEvent,
      final String secondEvent) {
    Objects.requireNonNull(competitors, "competitors must not be null");
    Objects.requireNonNull(firstEvent, "firstEvent must not be null");
    Objects.requireNonNull(secondEvent, "secondEvent must not be null");

    // Min-heap on the ranking order, the head is the weakest kept entry.
    final PriorityQueue<EventComparison> top = new PriorityQueue<>(
        BEST_FIRST.reversed());

    for (final Competitor competitor : competitors) {
      final Integer first = single(competitor, firstEvent);
      final Integer second = single(competitor, secondEvent);
      if (first == null || second == null) {
        continue;
      }
      final long t1 = ResultFormatter.comparableTime(firstEvent, first);
      final long t2 = ResultFormatter.comparableTime(secondEvent, second);
      if (t1 >= t2) {
        continue;
      }
      top.add(new EventComparison(competitor.id(), competitor.name(),
          competitor.country(), first, second, (t2 - t1) / 100.0));
      if (top.size() > MAX_RESULTS) {
        top.poll();
      }
    }

    final List<EventComparison> result = new ArrayList<>(top);
    result.sort(BEST_FIRST);
    return result;
  }

  private static Integer single(final Competitor competitor,
      final String eventId) {
    for (final RankEntry entry : competitor.singles()) {
      if (entry.eventId().equals(eventId) && entry.best() > 0) {
        return entry.best();
      }
    }
    return null;
  }
}
