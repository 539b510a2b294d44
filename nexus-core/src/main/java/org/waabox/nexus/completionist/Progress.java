package org.waabox.nexus.completionist;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.waabox.nexus.model.EventSets;
import org.waabox.nexus.model.ResultRound;

/**
 * The accumulated achievements of a competitor over a set of rounds.
 *
 * <p>Used both for the whole history at once and for the forward replay
 * of a chronological timeline, so both answer the same questions the same
 * way.
 *
 * <p>Not thread safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Progress {

  /** Competition ids of world championships, e.g. WC2019. */
  private static final Pattern CHAMPIONSHIP = Pattern.compile("^WC\\d{4}$");

  /** The podium positions. */
  private static final Set<Integer> ALL_POSITIONS = Set.of(1, 2, 3);

  /** Events with a valid single. */
  private final Set<String> singles = new HashSet<>();

  /** Events with a valid average. */
  private final Set<String> averages = new HashSet<>();

  /** Events with a won final. */
  private final Set<String> wins = new HashSet<>();

  /** Podium positions reached per event. */
  private final Map<String, Set<Integer>> positions = new HashMap<>();

  /** Whether a world record holds at this point. */
  private boolean worldRecord;

  /** Whether a championship podium was reached. */
  private boolean championshipPodium;

  /**
   * Creates a new progress.
   *
   * @param worldRecordFromStart whether the world record condition holds
   *                             before any round is applied
   */
  Progress(final boolean worldRecordFromStart) {
    worldRecord = worldRecordFromStart;
  }

  /**
   * Applies one round.
   *
   * @param round the round, never null
   */
  void apply(final ResultRound round) {
    final String eventId = round.eventId();
    if (round.hasValidSingle()) {
      singles.add(eventId);
    }
    if (round.hasValidAverage()) {
      averages.add(eventId);
    }
    if (round.setWorldRecord()) {
      worldRecord = true;
    }
    if (round.isPodium()) {
      positions.computeIfAbsent(eventId, e -> new HashSet<>())
          .add(round.position());
      if (round.competitionId() != null
          && CHAMPIONSHIP.matcher(round.competitionId()).matches()) {
        championshipPodium = true;
      }
    }
    if (round.isWin()) {
      wins.add(eventId);
    }
  }

  /**
   * Overrides the single and average coverage with ranked events.
   *
   * @param rankedSingles  events with a ranked single, never null
   * @param rankedAverages events with a ranked average, never null
   */
  void coverRanked(final Set<String> rankedSingles,
      final Set<String> rankedAverages) {
    singles.addAll(rankedSingles);
    averages.addAll(rankedAverages);
  }

  /**
   * Returns whether every condition of the tier holds.
   *
   * @param category the tier, never null
   *
   * @return true if the tier is satisfied
   */
  boolean satisfies(final Category category) {
    return switch (category) {
      case IRIDIUM -> satisfies(Category.PALLADIUM)
          && worldRecord && championshipPodium && everyPosition();
      case PALLADIUM -> satisfies(Category.PLATINUM)
          && wins.containsAll(EventSets.SINGLE_EVENTS);
      case PLATINUM -> satisfies(Category.GOLD)
          && (worldRecord || championshipPodium);
      case GOLD -> satisfies(Category.SILVER)
          && averages.containsAll(EventSets.GOLD_AVERAGE_EVENTS);
      case SILVER -> satisfies(Category.BRONZE)
          && averages.containsAll(EventSets.SILVER_AVERAGE_EVENTS);
      case BRONZE -> singles.containsAll(EventSets.SINGLE_EVENTS);
    };
  }

  Set<Category> satisfied() {
    final Set<Category> result = EnumSet.noneOf(Category.class);
    for (final Category category : Category.values()) {
      if (satisfies(category)) {
        result.add(category);
      }
    }
    return result;
  }

  private boolean everyPosition() {
    for (final String eventId : EventSets.SINGLE_EVENTS) {
      final Set<Integer> reached = positions.get(eventId);
      if (reached == null || !reached.containsAll(ALL_POSITIONS)) {
        return false;
      }
    }
    return true;
  }
}
