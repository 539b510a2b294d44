package org.waabox.nexus.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A competitor with their ranked personal bests and result history.
 *
 * <p>Instances are immutable snapshots of one harvest cycle.
 *
 * @param id                   the globally unique competitor id, never null
 * @param name                 the display name, never null
 * @param country              the ISO2 country code, may be null
 * @param numberOfCompetitions the number of competitions attended
 * @param worldRecords         the number of world records held or set
 * @param singles              the ranked singles, never null
 * @param averages             the ranked averages, never null
 * @param results              the normalized round history, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Competitor(
    String id,
    String name,
    String country,
    int numberOfCompetitions,
    int worldRecords,
    List<RankEntry> singles,
    List<RankEntry> averages,
    List<ResultRound> results
) {

  /** Validates the fields and copies the collections. */
  public Competitor {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
    singles = List.copyOf(Objects.requireNonNull(singles,
        "singles must not be null"));
    averages = List.copyOf(Objects.requireNonNull(averages,
        "averages must not be null"));
    results = List.copyOf(Objects.requireNonNull(results,
        "results must not be null"));
  }

  /**
   * Returns the ranked entries of the given result type.
   *
   * @param type the result type, never null
   *
   * @return the ranked entries, never null
   */
  public List<RankEntry> ranks(final ResultType type) {
    return type == ResultType.SINGLES ? singles : averages;
  }

  /**
   * Returns the ids of the events with a ranked result of the given type.
   *
   * @param type the result type, never null
   *
   * @return the sorted event ids, never null
   */
  public Set<String> rankedEvents(final ResultType type) {
    final Set<String> events = new TreeSet<>();
    for (final RankEntry entry : ranks(type)) {
      events.add(entry.eventId());
    }
    return events;
  }

  /**
   * Returns whether the competitor holds, or has set, a world record.
   *
   * @return true for a world record holder
   */
  public boolean isWorldRecordHolder() {
    return worldRecords > 0;
  }
}
